package com.conveyor.orchestrator.statemachine;

import com.conveyor.orchestrator.model.DebugSession;
import com.conveyor.orchestrator.model.PipelineRun;
import com.conveyor.orchestrator.model.StepExecution;
import com.conveyor.orchestrator.model.Workspace;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Rebuilds state machines from their rows and writes them back.
 *
 * Status, timestamps and progress live in ordinary columns; the transition
 * history is a JSON text column. Services always go load → mutate → store
 * inside one transaction on a row-locked entity.
 */
@Component
public class StateMachineStore {

    private static final TypeReference<List<StateTransition<PipelineRunState>>> PIPELINE_HISTORY =
            new TypeReference<>() {};
    private static final TypeReference<List<StateTransition<StepExecutionState>>> STEP_HISTORY =
            new TypeReference<>() {};
    private static final TypeReference<List<StateTransition<WorkspaceState>>> WORKSPACE_HISTORY =
            new TypeReference<>() {};
    private static final TypeReference<List<StateTransition<DebugState>>> DEBUG_HISTORY =
            new TypeReference<>() {};
    private static final TypeReference<TreeSet<Integer>> INDEX_SET =
            new TypeReference<>() {};

    private final ObjectMapper json;
    private final Clock        clock;

    public StateMachineStore(ObjectMapper objectMapper, Clock clock) {
        this.json  = objectMapper;
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Pipeline runs
    // ------------------------------------------------------------------

    public PipelineStateMachine load(PipelineRun run) {
        SortedSet<Integer> completed = read(run.getCompletedSteps(), INDEX_SET, new TreeSet<>());
        return PipelineStateMachine.restore(new PipelineRunSnapshot(
                run.getStatus(), run.getStepsTotal(), completed,
                run.getCurrentStepIndex(), run.getCurrentStepName(),
                run.getFailedStepIndex(), run.getFailedStepName(), run.getError(),
                run.getStartedAt(), run.getCompletedAt(),
                read(run.getStateHistory(), PIPELINE_HISTORY, List.of())), clock);
    }

    public void store(PipelineStateMachine m, PipelineRun run) {
        run.setStatus(m.getState());
        run.setStepsCompleted(m.getCompletedCount());
        run.setCompletedSteps(write(m.getCompletedSteps()));
        run.setCurrentStepIndex(m.getCurrentStepIndex());
        run.setCurrentStepName(m.getCurrentStepName());
        run.setFailedStepIndex(m.getFailedStepIndex());
        run.setFailedStepName(m.getFailedStepName());
        run.setError(m.getError());
        run.setStartedAt(m.getStartedAt());
        run.setCompletedAt(m.getCompletedAt());
        run.setStateHistory(write(m.getHistory()));
    }

    // ------------------------------------------------------------------
    // Step executions
    // ------------------------------------------------------------------

    public StepStateMachine load(StepExecution execution) {
        return StepStateMachine.restore(new StateMachineSnapshot<>(
                execution.getStatus(),
                read(execution.getStateHistory(), STEP_HISTORY, List.of())), clock);
    }

    public void store(StepStateMachine m, StepExecution execution) {
        execution.setStatus(m.getState());
        execution.setStateHistory(write(m.getHistory()));
    }

    // ------------------------------------------------------------------
    // Workspaces
    // ------------------------------------------------------------------

    public WorkspaceStateMachine load(Workspace workspace) {
        return WorkspaceStateMachine.restore(new WorkspaceSnapshot(
                workspace.getStatus(), workspace.getUseCount(), workspace.getLastActivityAt(),
                read(workspace.getStateHistory(), WORKSPACE_HISTORY, List.of())), clock);
    }

    public void store(WorkspaceStateMachine m, Workspace workspace) {
        workspace.setStatus(m.getState());
        workspace.setUseCount(m.getUseCount());
        workspace.setLastActivityAt(m.getLastActivityAt());
        workspace.setStateHistory(write(m.getHistory()));
    }

    // ------------------------------------------------------------------
    // Debug sessions
    // ------------------------------------------------------------------

    public DebugStateMachine load(DebugSession session) {
        return DebugStateMachine.restore(new StateMachineSnapshot<>(
                session.getStatus(),
                read(session.getStateHistory(), DEBUG_HISTORY, List.of())), clock);
    }

    public void store(DebugStateMachine m, DebugSession session) {
        session.setStatus(m.getState());
        session.setStateHistory(write(m.getHistory()));
    }

    // ------------------------------------------------------------------
    // JSON helpers
    // ------------------------------------------------------------------

    private String write(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state", e);
        }
    }

    private <T> T read(String text, TypeReference<T> type, T fallback) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        try {
            return json.readValue(text, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt state column: " + e.getOriginalMessage(), e);
        }
    }
}
