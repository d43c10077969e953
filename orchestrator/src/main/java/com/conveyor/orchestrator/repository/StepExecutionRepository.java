package com.conveyor.orchestrator.repository;

import com.conveyor.orchestrator.model.StepExecution;
import com.conveyor.orchestrator.statemachine.StepExecutionState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface StepExecutionRepository extends JpaRepository<StepExecution, UUID> {

    Optional<StepExecution> findByExecutionKey(String executionKey);

    /**
     * Insert a PENDING attempt unless one with the same key already exists.
     * Returns 1 if this call created the row, 0 if it was already there.
     *
     * ON CONFLICT DO NOTHING keeps the surrounding transaction usable when two
     * dispatchers race on one key, which a failed JPA persist would not.
     */
    @Modifying
    @Query(value = """
            INSERT INTO step_executions
                (id, execution_key, step_run_id, pipeline_run_id, step_index, attempt, status, created_at)
            VALUES
                (:id, :executionKey, :stepRunId, :pipelineRunId, :stepIndex, :attempt, 'PENDING', :createdAt)
            ON CONFLICT (execution_key) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("executionKey") String executionKey,
                       @Param("stepRunId") UUID stepRunId,
                       @Param("pipelineRunId") UUID pipelineRunId,
                       @Param("stepIndex") int stepIndex,
                       @Param("attempt") int attempt,
                       @Param("createdAt") Instant createdAt);

    /** Row-locked load; recovery and completion race on the same row. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM StepExecution e WHERE e.id = :id")
    Optional<StepExecution> findForUpdate(@Param("id") UUID id);

    /** All attempts of a step, oldest first. */
    List<StepExecution> findByStepRunIdOrderByAttemptAsc(UUID stepRunId);

    List<StepExecution> findByPipelineRunIdOrderByStepIndexAscAttemptAsc(UUID pipelineRunId);

    List<StepExecution> findByPipelineRunIdAndStatusIn(UUID pipelineRunId, Collection<StepExecutionState> states);

    List<StepExecution> findByStatusIn(Collection<StepExecutionState> states);

    List<StepExecution> findByRunnerIdAndStatusIn(String runnerId, Collection<StepExecutionState> states);

    @Query("SELECT COALESCE(MAX(e.attempt), 0) FROM StepExecution e WHERE e.stepRunId = :stepRunId")
    int findMaxAttempt(@Param("stepRunId") UUID stepRunId);
}
