package com.conveyor.orchestrator.trigger;

import java.util.Objects;

/**
 * Dedup key of a trigger: {@code {trigger_type}:{repo_id}:{ref}}.
 *
 * Push triggers may fold the commit SHA into the ref
 * ({@code push:repo-1:main:abc123}) so a new commit on the same branch is
 * never treated as a duplicate of the previous one.
 */
public record TriggerKey(String triggerType, String repoId, String ref) {

    public static final String PUSH          = "push";
    public static final String CARD_COMPLETE = "card_complete";
    public static final String MANUAL        = "manual";

    public TriggerKey {
        Objects.requireNonNull(triggerType, "triggerType");
        Objects.requireNonNull(repoId, "repoId");
        Objects.requireNonNull(ref, "ref");
    }

    public static TriggerKey forPush(String repoId, String branch, String commitSha) {
        String ref = commitSha == null || commitSha.isBlank() ? branch : branch + ":" + commitSha;
        return new TriggerKey(PUSH, repoId, ref);
    }

    public static TriggerKey forCardComplete(String repoId, String cardId) {
        return new TriggerKey(CARD_COMPLETE, repoId, cardId);
    }

    public static TriggerKey forManual(String repoId, String pipelineId) {
        return new TriggerKey(MANUAL, repoId, pipelineId);
    }

    /** Inverse of {@link #toString()}; the ref keeps any further colons. */
    public static TriggerKey parse(String key) {
        String[] parts = key == null ? new String[0] : key.split(":", 3);
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed trigger key: " + key);
        }
        return new TriggerKey(parts[0], parts[1], parts[2]);
    }

    @Override
    public String toString() {
        return triggerType + ":" + repoId + ":" + ref;
    }
}
