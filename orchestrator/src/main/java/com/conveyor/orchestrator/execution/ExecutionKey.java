package com.conveyor.orchestrator.execution;

import java.util.Objects;
import java.util.UUID;

/**
 * Idempotency key of one step execution attempt: {@code {run_id}:{step_index}:{attempt}}.
 *
 * Parsing takes the two rightmost colon-separated fields as index and
 * attempt, so run ids that themselves contain colons survive a round trip.
 * Attempts are numbered from 1.
 */
public record ExecutionKey(String runId, int stepIndex, int attempt) {

    public ExecutionKey {
        Objects.requireNonNull(runId, "runId");
        if (runId.isEmpty()) {
            throw new IllegalArgumentException("runId must not be empty");
        }
        if (stepIndex < 0) {
            throw new IllegalArgumentException("stepIndex must be >= 0, got " + stepIndex);
        }
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
    }

    public static ExecutionKey of(UUID runId, int stepIndex, int attempt) {
        return new ExecutionKey(runId.toString(), stepIndex, attempt);
    }

    public static String generate(String runId, int stepIndex, int attempt) {
        return new ExecutionKey(runId, stepIndex, attempt).toString();
    }

    /**
     * @throws IllegalArgumentException if the key does not have the
     *         {@code run:index:attempt} shape
     */
    public static ExecutionKey parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Execution key must not be null");
        }
        int attemptSep = key.lastIndexOf(':');
        int indexSep   = attemptSep > 0 ? key.lastIndexOf(':', attemptSep - 1) : -1;
        if (indexSep <= 0) {
            throw new IllegalArgumentException("Malformed execution key: " + key);
        }
        try {
            int index   = Integer.parseInt(key.substring(indexSep + 1, attemptSep));
            int attempt = Integer.parseInt(key.substring(attemptSep + 1));
            return new ExecutionKey(key.substring(0, indexSep), index, attempt);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed execution key: " + key, e);
        }
    }

    public ExecutionKey nextAttempt() {
        return new ExecutionKey(runId, stepIndex, attempt + 1);
    }

    @Override
    public String toString() {
        return runId + ":" + stepIndex + ":" + attempt;
    }
}
