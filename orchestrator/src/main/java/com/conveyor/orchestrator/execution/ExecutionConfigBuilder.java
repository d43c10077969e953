package com.conveyor.orchestrator.execution;

import com.conveyor.orchestrator.model.StepKind;
import com.conveyor.orchestrator.routing.RoutingDecision;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a step definition plus its routing decision into the concrete
 * container configuration for one attempt.
 *
 * Environment precedence, lowest first: the step's own variables, then
 * {@code HOME}, then the CONVEYOR_* execution variables, which user
 * configuration cannot override.
 */
@Component
public class ExecutionConfigBuilder {

    static final String WORKSPACE_HOME    = "/workspace/home";
    static final String DEFAULT_WORKDIR   = "/workspace/repo";
    static final String AGENT_ENTRYPOINT  = "/control/agent-wrapper";

    private final String backendUrl;
    private final int    defaultTimeoutSeconds;

    public ExecutionConfigBuilder(
            @Value("${conveyor.control.backend-url:http://localhost:8080}") String backendUrl,
            @Value("${conveyor.steps.default-timeout-seconds:3600}") int defaultTimeoutSeconds) {
        this.backendUrl            = backendUrl;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    /**
     * @param stepToken bearer token the in-container control script uses to
     *                  report status, logs and heartbeats
     */
    public ExecutionConfig build(StepDefinition step,
                                 RoutingDecision decision,
                                 ExecutionKey key,
                                 String volumeName,
                                 String stepToken) {
        StepConfig config = step.config();

        List<String> command = switch (step.type()) {
            case SCRIPT, DOCKER -> shell(step);
            case AGENT          -> List.of(AGENT_ENTRYPOINT);
        };

        Map<String, String> env = new LinkedHashMap<>(config.environment());
        env.put("HOME", WORKSPACE_HOME);
        env.put("CONVEYOR_EXECUTION_KEY", key.toString());
        env.put("CONVEYOR_RUN_ID", key.runId());
        env.put("CONVEYOR_STEP_INDEX", Integer.toString(key.stepIndex()));
        env.put("CONVEYOR_STEP_NAME", step.name());
        env.put("CONVEYOR_BACKEND_URL", backendUrl);
        if (stepToken != null) {
            env.put("CONVEYOR_STEP_TOKEN", stepToken);
        }
        if (step.type() == StepKind.AGENT) {
            env.put("CONVEYOR_RUNNER_TYPE", config.runnerType() == null ? "any" : config.runnerType());
            if (config.prompt() != null) {
                env.put("CONVEYOR_AGENT_PROMPT", config.prompt());
            }
        }

        String workDir = config.workingDir() == null || config.workingDir().isBlank()
                ? DEFAULT_WORKDIR : config.workingDir();
        return new ExecutionConfig(key.toString(), step.type(), decision.image(),
                command, env, workDir, volumeName, timeoutFor(step));
    }

    public int timeoutFor(StepDefinition step) {
        return step.timeoutSeconds() == null || step.timeoutSeconds() <= 0
                ? defaultTimeoutSeconds : step.timeoutSeconds();
    }

    private static List<String> shell(StepDefinition step) {
        String command = step.config().command();
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Step '" + step.name() + "' has no command");
        }
        return List.of("bash", "-c", command);
    }
}
