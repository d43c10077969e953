package com.conveyor.orchestrator.statemachine;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static com.conveyor.orchestrator.statemachine.PipelineRunState.*;

/**
 * State machine for a pipeline run, plus step progress tracking.
 *
 * The run auto-advances to COMPLETING once every step index has been
 * reported done. A step failing with policy {@code next} counts as done for
 * progress; any other policy fails the run.
 */
public class PipelineStateMachine extends StateMachine<PipelineRunState> {

    static final Map<PipelineRunState, Set<PipelineRunState>> TRANSITIONS = table(PipelineRunState.class,
            PENDING,    Set.of(PREPARING, CANCELLED),
            PREPARING,  Set.of(RUNNING, FAILED, CANCELLED),
            RUNNING,    Set.of(COMPLETING, FAILED, CANCELLED),
            COMPLETING, Set.of(COMPLETED, FAILED));

    static final Set<PipelineRunState> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public static final String CONTINUE_ON_FAILURE = "next";

    private final int totalSteps;
    private final SortedSet<Integer> completedSteps = new TreeSet<>();

    private Integer currentStepIndex;
    private String  currentStepName;
    private Integer failedStepIndex;
    private String  failedStepName;
    private String  error;
    private Instant startedAt;
    private Instant completedAt;

    public PipelineStateMachine(int totalSteps, Clock clock) {
        super("pipeline run", PENDING, TRANSITIONS, TERMINAL, clock);
        if (totalSteps < 0) {
            throw new IllegalArgumentException("totalSteps must be >= 0, got " + totalSteps);
        }
        this.totalSteps = totalSteps;
    }

    public static PipelineStateMachine restore(PipelineRunSnapshot s, Clock clock) {
        PipelineStateMachine m = new PipelineStateMachine(s.totalSteps(), clock);
        m.restore(s.state(), s.history());
        if (s.completedSteps() != null) {
            m.completedSteps.addAll(s.completedSteps());
        }
        m.currentStepIndex = s.currentStepIndex();
        m.currentStepName  = s.currentStepName();
        m.failedStepIndex  = s.failedStepIndex();
        m.failedStepName   = s.failedStepName();
        m.error            = s.error();
        m.startedAt        = s.startedAt();
        m.completedAt      = s.completedAt();
        return m;
    }

    public PipelineRunSnapshot toSnapshot() {
        return new PipelineRunSnapshot(getState(), totalSteps, new TreeSet<>(completedSteps),
                currentStepIndex, currentStepName, failedStepIndex, failedStepName,
                error, startedAt, completedAt, List.copyOf(getHistory()));
    }

    // ------------------------------------------------------------------
    // Step callbacks
    // ------------------------------------------------------------------

    public void onStepStarted(int index, String name) {
        checkIndex(index);
        this.currentStepIndex = index;
        this.currentStepName  = name;
    }

    /**
     * Record a successful step. Returns true when this call moved the run to
     * COMPLETING.
     */
    public boolean onStepCompleted(int index) {
        checkIndex(index);
        completedSteps.add(index);
        return completeIfAllDone();
    }

    /**
     * Record a failed step.
     *
     * @param onFailure the step's failure policy; {@code "next"} keeps the run going
     * @return true if the run is still RUNNING afterwards
     */
    public boolean onStepFailed(int index, String name, String stepError, String onFailure) {
        checkIndex(index);
        this.failedStepIndex = index;
        this.failedStepName  = name;
        this.error           = "Step '" + name + "' failed: " + stepError;

        if (CONTINUE_ON_FAILURE.equals(onFailure)) {
            completedSteps.add(index);
            completeIfAllDone();
            return getState() == RUNNING;
        }
        transition(FAILED, error);
        return false;
    }

    /** Fail the run with an error that is not tied to a step, e.g. workspace setup. */
    public void fail(String reason) {
        this.error = reason;
        transition(FAILED, reason);
    }

    private boolean completeIfAllDone() {
        if (totalSteps > 0 && completedSteps.size() >= totalSteps && getState() == RUNNING) {
            transition(COMPLETING, "All " + totalSteps + " steps completed");
            return true;
        }
        return false;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= totalSteps) {
            throw new IllegalArgumentException(
                    "Step index " + index + " out of range for " + totalSteps + " steps");
        }
    }

    @Override
    protected void onTransition(StateTransition<PipelineRunState> t) {
        if (t.to() == PREPARING && startedAt == null) {
            startedAt = t.timestamp();
        }
        if (isTerminal(t.to())) {
            completedAt = t.timestamp();
        }
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public int                getTotalSteps()       { return totalSteps; }
    public SortedSet<Integer> getCompletedSteps()   { return Collections.unmodifiableSortedSet(completedSteps); }
    public int                getCompletedCount()   { return completedSteps.size(); }
    public Integer            getCurrentStepIndex() { return currentStepIndex; }
    public String             getCurrentStepName()  { return currentStepName; }
    public Integer            getFailedStepIndex()  { return failedStepIndex; }
    public String             getFailedStepName()   { return failedStepName; }
    public String             getError()            { return error; }
    public Instant            getStartedAt()        { return startedAt; }
    public Instant            getCompletedAt()      { return completedAt; }
}
