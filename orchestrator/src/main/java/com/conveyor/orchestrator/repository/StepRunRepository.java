package com.conveyor.orchestrator.repository;

import com.conveyor.orchestrator.model.StepRun;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface StepRunRepository extends JpaRepository<StepRun, UUID> {

    /** All steps of a run in definition order. */
    List<StepRun> findByPipelineRunIdOrderByStepIndexAsc(UUID pipelineRunId);

    Optional<StepRun> findByPipelineRunIdAndStepIndex(UUID pipelineRunId, int stepIndex);

    /**
     * Load a step run with a row lock held until commit. Attempt creation
     * takes it so two callers cannot both see "no active attempt".
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StepRun s WHERE s.id = :id")
    Optional<StepRun> findForUpdate(@Param("id") UUID id);
}
