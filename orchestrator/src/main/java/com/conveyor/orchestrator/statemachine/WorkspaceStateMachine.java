package com.conveyor.orchestrator.statemachine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.conveyor.orchestrator.statemachine.WorkspaceState.*;

/**
 * State machine for a shared workspace, with a use count of the step
 * executions currently mounted on it.
 *
 * {@link #acquire} and {@link #release} are the only way in and out of
 * IN_USE. Entering CLEANING while the use count is positive raises
 * {@link PreconditionViolationException}, not an invalid transition.
 */
public class WorkspaceStateMachine extends StateMachine<WorkspaceState> {

    static final Map<WorkspaceState, Set<WorkspaceState>> TRANSITIONS = table(WorkspaceState.class,
            CREATING, Set.of(READY, FAILED),
            READY,    Set.of(IN_USE, CLEANING),
            IN_USE,   Set.of(READY, IN_USE),
            CLEANING, Set.of(CLEANED, FAILED),
            FAILED,   Set.of(CLEANING));

    static final Set<WorkspaceState> TERMINAL = EnumSet.of(CLEANED);

    private int     useCount;
    private Instant lastActivityAt;

    public WorkspaceStateMachine(Clock clock) {
        super("workspace", CREATING, TRANSITIONS, TERMINAL, clock);
        this.lastActivityAt = clock.instant();
    }

    public static WorkspaceStateMachine restore(WorkspaceSnapshot s, Clock clock) {
        WorkspaceStateMachine m = new WorkspaceStateMachine(clock);
        m.restore(s.state(), s.history());
        m.useCount       = s.useCount();
        m.lastActivityAt = s.lastActivityAt() != null ? s.lastActivityAt() : m.lastActivityAt;
        return m;
    }

    public WorkspaceSnapshot toSnapshot() {
        return new WorkspaceSnapshot(getState(), useCount, lastActivityAt, List.copyOf(getHistory()));
    }

    // ------------------------------------------------------------------
    // Use counting
    // ------------------------------------------------------------------

    /**
     * Register one more active user. READY moves to IN_USE; IN_USE records a
     * self-transition.
     */
    public void acquire(String reason) {
        transition(IN_USE, reason == null ? "acquired" : reason);
        useCount++;
    }

    /**
     * Drop one active user. The last release moves back to READY.
     *
     * @throws PreconditionViolationException if nothing is held
     */
    public void release(String reason) {
        if (useCount <= 0) {
            throw new PreconditionViolationException("Cannot release workspace with use_count=0");
        }
        WorkspaceState target = useCount == 1 ? READY : IN_USE;
        transition(target, reason == null ? "released" : reason);
        useCount--;
    }

    public boolean canCleanup() {
        return getState() == READY && useCount == 0;
    }

    /**
     * True for READY, CREATING or FAILED workspaces idle for longer than
     * {@code threshold}. IN_USE and CLEANED workspaces are never orphaned.
     */
    public boolean isOrphaned(Duration threshold) {
        WorkspaceState s = getState();
        if (s != READY && s != CREATING && s != FAILED) {
            return false;
        }
        return Duration.between(lastActivityAt, clock().instant()).compareTo(threshold) > 0;
    }

    @Override
    protected String preconditionFailure(WorkspaceState target) {
        if (target == CLEANING && useCount > 0) {
            return "Cannot clean workspace with use_count=" + useCount;
        }
        if (target == READY && getState() == IN_USE && useCount > 1) {
            return "Workspace still has " + useCount + " active users";
        }
        return null;
    }

    @Override
    protected void onTransition(StateTransition<WorkspaceState> t) {
        lastActivityAt = t.timestamp();
    }

    public int     getUseCount()       { return useCount; }
    public Instant getLastActivityAt() { return lastActivityAt; }
}
