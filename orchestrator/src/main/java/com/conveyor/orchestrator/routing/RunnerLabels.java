package com.conveyor.orchestrator.routing;

import java.util.Set;

/**
 * Capabilities a runner advertises when it registers. Matching is plain
 * equality on arch and a subset test on capabilities.
 */
public record RunnerLabels(String arch, Set<String> has) {

    public RunnerLabels {
        has = has == null ? Set.of() : Set.copyOf(has);
    }

    public static RunnerLabels none() {
        return new RunnerLabels(null, Set.of());
    }

    public boolean satisfies(StepRequirements req) {
        if (req.arch() != null && !req.arch().equals(arch)) {
            return false;
        }
        return has.containsAll(req.has());
    }
}
