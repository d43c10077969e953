package com.conveyor.orchestrator.repository;

import com.conveyor.orchestrator.model.DebugSession;
import com.conveyor.orchestrator.statemachine.DebugState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DebugSessionRepository extends JpaRepository<DebugSession, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DebugSession s WHERE s.id = :id")
    Optional<DebugSession> findForUpdate(@Param("id") UUID id);

    Optional<DebugSession> findFirstByPipelineRunIdAndStatusIn(UUID pipelineRunId, Collection<DebugState> states);

    List<DebugSession> findByStatusInAndExpiresAtBefore(Collection<DebugState> states, Instant cutoff);
}
