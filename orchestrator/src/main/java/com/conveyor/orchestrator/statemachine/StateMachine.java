package com.conveyor.orchestrator.statemachine;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Table-driven state machine shared by pipeline runs, step executions,
 * workspaces and debug sessions.
 *
 * Each subclass supplies a fixed adjacency table and its terminal subset.
 * A transition is legal only if the target is listed for the current state;
 * self-transitions are legal only where the table lists them. Every
 * successful transition is appended to the history.
 *
 * Instances are not thread-safe. The owning service loads the machine from
 * its row, applies one mutation and writes it back inside a transaction.
 */
public abstract class StateMachine<S extends Enum<S>> {

    private final String                entity;
    private final Map<S, Set<S>>        transitions;
    private final Set<S>                terminalStates;
    private final Clock                 clock;
    private final List<StateTransition<S>> history = new ArrayList<>();

    private S state;

    protected StateMachine(String entity,
                           S initial,
                           Map<S, Set<S>> transitions,
                           Set<S> terminalStates,
                           Clock clock) {
        this.entity         = entity;
        this.state          = Objects.requireNonNull(initial, "initial");
        this.transitions    = transitions;
        this.terminalStates = terminalStates;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public S getState() {
        return state;
    }

    public boolean isTerminal() {
        return terminalStates.contains(state);
    }

    public boolean isTerminal(S candidate) {
        return terminalStates.contains(candidate);
    }

    /** Targets reachable from the current state by adjacency alone. */
    public Set<S> allowedTargets() {
        return transitions.getOrDefault(state, Set.of());
    }

    /**
     * Non-raising check. Returns true exactly when {@link #transition} would
     * succeed, precondition checks included.
     */
    public boolean canTransition(S target) {
        return target != null
                && allowedTargets().contains(target)
                && preconditionFailure(target) == null;
    }

    public List<StateTransition<S>> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public Optional<StateTransition<S>> lastTransition() {
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    /** Time between the first and the last recorded transition. */
    public Optional<Duration> duration() {
        if (history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(
                history.get(0).timestamp(),
                history.get(history.size() - 1).timestamp()));
    }

    // ------------------------------------------------------------------
    // Mutation
    // ------------------------------------------------------------------

    public StateTransition<S> transition(S target) {
        return transition(target, null);
    }

    /**
     * Move to {@code target}.
     *
     * @throws InvalidTransitionException     target not adjacent, or current state terminal
     * @throws PreconditionViolationException target adjacent but a subclass precondition fails
     */
    public StateTransition<S> transition(S target, String reason) {
        Objects.requireNonNull(target, "target");
        if (!allowedTargets().contains(target)) {
            throw new InvalidTransitionException(entity, state, target, isTerminal());
        }
        String violation = preconditionFailure(target);
        if (violation != null) {
            throw new PreconditionViolationException(violation);
        }
        StateTransition<S> t = new StateTransition<>(state, target, clock.instant(), reason);
        history.add(t);
        state = target;
        onTransition(t);
        return t;
    }

    /**
     * Record a move that is outside the adjacency table. Only crash recovery
     * uses this, to put work that lost its executor back in line.
     */
    protected StateTransition<S> repair(S target, String reason) {
        StateTransition<S> t = new StateTransition<>(state, target, clock.instant(), reason);
        history.add(t);
        state = target;
        onTransition(t);
        return t;
    }

    protected String entity() {
        return entity;
    }

    public StateMachineSnapshot<S> snapshot() {
        return new StateMachineSnapshot<>(state, List.copyOf(history));
    }

    // ------------------------------------------------------------------
    // Subclass hooks
    // ------------------------------------------------------------------

    /** Returns a message when {@code target} may not be entered right now, else null. */
    protected String preconditionFailure(S target) {
        return null;
    }

    /** Called after the state and history have been updated. */
    protected void onTransition(StateTransition<S> transition) {
    }

    protected Clock clock() {
        return clock;
    }

    /** Replace state and history wholesale; used when rehydrating from storage. */
    protected void restore(S restoredState, List<StateTransition<S>> restoredHistory) {
        this.state = Objects.requireNonNull(restoredState, "state");
        this.history.clear();
        if (restoredHistory != null) {
            this.history.addAll(restoredHistory);
        }
    }

    // ------------------------------------------------------------------
    // Table helpers
    // ------------------------------------------------------------------

    /** Builder for adjacency tables; states with no entry have no outgoing edges. */
    protected static <E extends Enum<E>> Map<E, Set<E>> table(Class<E> type, Object... pairs) {
        Map<E, Set<E>> map = new EnumMap<>(type);
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            E from = (E) pairs[i];
            @SuppressWarnings("unchecked")
            Set<E> to = (Set<E>) pairs[i + 1];
            map.put(from, Collections.unmodifiableSet(EnumSet.copyOf(to)));
        }
        return Collections.unmodifiableMap(map);
    }
}
