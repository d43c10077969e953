package com.conveyor.orchestrator.routing;

import com.conveyor.orchestrator.model.StepKind;

/**
 * Where and how one step should execute. Computed per dispatch, never stored.
 *
 * @param requiredLabels    arch and capabilities a remote runner must offer
 * @param requiredRunnerId  runner the step is pinned to, or null
 * @param workspaceAffinity "local", the id of the runner holding the workspace,
 *                          or null until a runner is assigned
 */
public record RoutingDecision(
        ExecutorType executorType,
        StepKind stepKind,
        String image,
        RunnerLabels requiredLabels,
        String requiredRunnerId,
        String workspaceAffinity,
        String reason
) {
    public static final String LOCAL_AFFINITY = "local";

    public boolean isLocal() {
        return executorType == ExecutorType.LOCAL;
    }

    /** The requirements a runner must satisfy to take this step. */
    public StepRequirements toRequirements() {
        return new StepRequirements(requiredLabels.arch(), requiredLabels.has(), requiredRunnerId);
    }
}
