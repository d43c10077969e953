package com.conveyor.orchestrator.trigger;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a dedup check. A rejected trigger is a normal result, not an
 * error: it carries the run the original trigger started.
 */
public record TriggerCheckResult(
        boolean allowed,
        UUID originalRunId,
        Instant originalTriggeredAt,
        String reason
) {
    public static TriggerCheckResult admitted(String reason) {
        return new TriggerCheckResult(true, null, null, reason);
    }

    public static TriggerCheckResult duplicate(UUID originalRunId, Instant originalTriggeredAt) {
        return new TriggerCheckResult(false, originalRunId, originalTriggeredAt,
                "Duplicate trigger, run " + originalRunId + " started at " + originalTriggeredAt);
    }

    public boolean isDuplicate() {
        return !allowed;
    }
}
