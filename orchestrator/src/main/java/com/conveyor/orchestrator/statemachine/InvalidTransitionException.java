package com.conveyor.orchestrator.statemachine;

/**
 * Raised when a requested move is not in the adjacency table for the current
 * state, or the current state is terminal. Treated as a programming or
 * protocol error by callers.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String entity;
    private final Enum<?> from;
    private final Enum<?> to;
    private final boolean terminal;

    public InvalidTransitionException(String entity, Enum<?> from, Enum<?> to, boolean terminal) {
        super(message(entity, from, to, terminal));
        this.entity   = entity;
        this.from     = from;
        this.to       = to;
        this.terminal = terminal;
    }

    public String  getEntity()   { return entity; }
    public Enum<?> getFrom()     { return from; }
    public Enum<?> getTo()       { return to; }
    public boolean isTerminal()  { return terminal; }

    private static String message(String entity, Enum<?> from, Enum<?> to, boolean terminal) {
        String msg = "Invalid " + entity + " transition: " + from + " -> " + to;
        if (terminal) {
            msg += " (cannot transition from terminal state " + from + ")";
        }
        return msg;
    }
}
