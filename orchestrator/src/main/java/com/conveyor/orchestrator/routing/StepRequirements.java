package com.conveyor.orchestrator.routing;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Hardware and placement requirements of a step.
 *
 * @param arch     required CPU architecture (amd64, arm64), or null for any
 * @param has      required capabilities such as gpio, camera or cuda
 * @param runnerId pin the step to one specific runner, or null
 */
public record StepRequirements(
        String arch,
        Set<String> has,
        @JsonAlias("runner_id") String runnerId
) {
    public StepRequirements {
        has = has == null ? Set.of() : Set.copyOf(has);
    }

    public static StepRequirements none() {
        return new StepRequirements(null, Set.of(), null);
    }

    public static StepRequirements arch(String arch) {
        return new StepRequirements(arch, Set.of(), null);
    }

    public static StepRequirements has(String... capabilities) {
        return new StepRequirements(null, new LinkedHashSet<>(Set.of(capabilities)), null);
    }

    public static StepRequirements pinned(String runnerId) {
        return new StepRequirements(null, Set.of(), runnerId);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return arch == null && has.isEmpty() && runnerId == null;
    }
}
