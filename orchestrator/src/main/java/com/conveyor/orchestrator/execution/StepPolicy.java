package com.conveyor.orchestrator.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parsed on_success / on_failure action of a step.
 *
 * <pre>
 *   next                       continue with the following step
 *   stop                       end the run here
 *   merge:&lt;branch&gt;             merge the run's branch, then continue
 *   trigger:pipeline:&lt;id&gt;      start another pipeline, then continue
 *   trigger:&lt;card&gt;             run a card as a fix-up, then continue
 * </pre>
 *
 * Unknown actions are treated as {@code stop}.
 *
 * @param target branch, pipeline id or card id; null for NEXT and STOP
 */
public record StepPolicy(Action action, String target) {

    private static final Logger log = LoggerFactory.getLogger(StepPolicy.class);

    public enum Action { NEXT, STOP, MERGE, TRIGGER_PIPELINE, TRIGGER_CARD }

    public static final StepPolicy NEXT = new StepPolicy(Action.NEXT, null);
    public static final StepPolicy STOP = new StepPolicy(Action.STOP, null);

    private static final String MERGE_PREFIX    = "merge:";
    private static final String PIPELINE_PREFIX = "trigger:pipeline:";
    private static final String TRIGGER_PREFIX  = "trigger:";

    public static StepPolicy parse(String raw) {
        if (raw == null || raw.isBlank() || raw.equals("next")) {
            return NEXT;
        }
        if (raw.equals("stop")) {
            return STOP;
        }
        if (raw.startsWith(MERGE_PREFIX) && raw.length() > MERGE_PREFIX.length()) {
            return new StepPolicy(Action.MERGE, raw.substring(MERGE_PREFIX.length()));
        }
        if (raw.startsWith(PIPELINE_PREFIX) && raw.length() > PIPELINE_PREFIX.length()) {
            return new StepPolicy(Action.TRIGGER_PIPELINE, raw.substring(PIPELINE_PREFIX.length()));
        }
        if (raw.startsWith(TRIGGER_PREFIX) && raw.length() > TRIGGER_PREFIX.length()
                && !raw.startsWith(PIPELINE_PREFIX)) {
            return new StepPolicy(Action.TRIGGER_CARD, raw.substring(TRIGGER_PREFIX.length()));
        }
        log.warn("Unknown step action '{}', treating as 'stop'", raw);
        return STOP;
    }

    /** Merge and trigger actions are handed to collaborators as events. */
    public boolean isSideEffect() {
        return action == Action.MERGE || action == Action.TRIGGER_PIPELINE || action == Action.TRIGGER_CARD;
    }

    /** Whether the run keeps going after a successful step with this policy. */
    public boolean continuesAfterSuccess() {
        return action != Action.STOP;
    }

    /** Whether the run keeps going after a failed step with this policy. */
    public boolean continuesAfterFailure() {
        return action == Action.NEXT;
    }
}
