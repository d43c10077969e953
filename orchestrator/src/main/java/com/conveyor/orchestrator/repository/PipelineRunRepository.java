package com.conveyor.orchestrator.repository;

import com.conveyor.orchestrator.model.PipelineRun;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface PipelineRunRepository extends JpaRepository<PipelineRun, UUID> {

    /**
     * Load a run with a row lock held until the surrounding transaction
     * commits. Every state-machine mutation of a run goes through this so
     * concurrent step callbacks for one run are applied one at a time.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM PipelineRun r WHERE r.id = :id")
    Optional<PipelineRun> findForUpdate(@Param("id") UUID id);
}
