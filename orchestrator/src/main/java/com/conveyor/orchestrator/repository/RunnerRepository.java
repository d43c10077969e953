package com.conveyor.orchestrator.repository;

import com.conveyor.orchestrator.model.Runner;
import com.conveyor.orchestrator.model.RunnerStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RunnerRepository extends JpaRepository<Runner, String> {

    /**
     * Row-locked load. Death detection and reconnection race on a runner row;
     * whichever commits first decides what the other one sees.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Runner r WHERE r.id = :id")
    Optional<Runner> findForUpdate(@Param("id") String id);

    List<Runner> findByStatusIn(Collection<RunnerStatus> statuses);

    /** Live runners whose last heartbeat is older than {@code cutoff}. */
    List<Runner> findByStatusInAndLastHeartbeatAtBefore(Collection<RunnerStatus> statuses, Instant cutoff);
}
