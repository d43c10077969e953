package com.conveyor.orchestrator.routing;

import com.conveyor.orchestrator.execution.StepConfig;
import com.conveyor.orchestrator.model.StepKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Decides whether a step runs in a local container or on a remote runner.
 *
 * Rules, first match wins:
 * <ol>
 *   <li>previous runner set: stay on that runner (execution affinity)</li>
 *   <li>requirements pin a runner id</li>
 *   <li>requirements list capabilities</li>
 *   <li>required arch differs from the local arch</li>
 *   <li>agent step and no local agent runtime</li>
 *   <li>otherwise local</li>
 * </ol>
 *
 * With remote execution disabled, any rule that would pick a runner raises
 * {@link RoutingException} instead. The router is stateless; a LOCAL decision
 * always refers to the single local executor bean.
 */
@Component
public class ExecutionRouter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRouter.class);

    static final String DEFAULT_SCRIPT_IMAGE = "conveyor-base:latest";

    private final String  localArch;
    private final boolean allowRemote;
    private final boolean localAgentRuntime;

    public ExecutionRouter(
            @Value("${conveyor.routing.local-arch:}") String localArch,
            @Value("${conveyor.routing.allow-remote:true}") boolean allowRemote,
            @Value("${conveyor.routing.local-agent-runtime:true}") boolean localAgentRuntime) {
        this.localArch         = localArch == null || localArch.isBlank()
                ? normalizeArch(System.getProperty("os.arch"))
                : normalizeArch(localArch);
        this.allowRemote       = allowRemote;
        this.localAgentRuntime = localAgentRuntime;
        log.info("Execution router: localArch={}, allowRemote={}, localAgentRuntime={}",
                this.localArch, allowRemote, localAgentRuntime);
    }

    public RoutingDecision route(StepKind kind, StepConfig config, StepRequirements requirements) {
        return route(kind, config, requirements, null);
    }

    /**
     * @param previousRunnerId runner that executed the previous step of the
     *                         run, or null
     * @throws RoutingException remote route needed while remote is disabled,
     *                          or a docker step without an image
     */
    public RoutingDecision route(StepKind kind,
                                 StepConfig config,
                                 StepRequirements requirements,
                                 String previousRunnerId) {
        StepRequirements req = requirements == null ? StepRequirements.none() : requirements;
        String image = resolveImage(kind, config);
        RunnerLabels labels = new RunnerLabels(
                req.arch() == null ? null : normalizeArch(req.arch()), req.has());

        if (previousRunnerId != null) {
            return remote(kind, image, labels, previousRunnerId,
                    "Continuing on runner " + previousRunnerId + " (execution affinity)");
        }
        if (req.runnerId() != null) {
            return remote(kind, image, labels, req.runnerId(),
                    "Step pinned to runner " + req.runnerId());
        }
        if (!req.has().isEmpty()) {
            return remote(kind, image, labels, null,
                    "Step requires hardware " + req.has());
        }
        if (req.arch() != null && !normalizeArch(req.arch()).equals(localArch)) {
            return remote(kind, image, labels, null,
                    "Step requires arch " + req.arch() + ", local arch is " + localArch);
        }
        if (kind == StepKind.AGENT && !localAgentRuntime) {
            return remote(kind, image, labels, null,
                    "No local agent runtime available");
        }
        return new RoutingDecision(ExecutorType.LOCAL, kind, image, labels, null,
                RoutingDecision.LOCAL_AFFINITY, "No remote requirements, executing locally");
    }

    public String getLocalArch() {
        return localArch;
    }

    private RoutingDecision remote(StepKind kind, String image, RunnerLabels labels,
                                   String runnerId, String reason) {
        if (!allowRemote) {
            throw new RoutingException(reason + ", but remote execution is disabled");
        }
        // Unpinned: the workspace follows whichever runner takes the job.
        return new RoutingDecision(ExecutorType.REMOTE, kind, image, labels, runnerId, runnerId, reason);
    }

    // ------------------------------------------------------------------
    // Images
    // ------------------------------------------------------------------

    /**
     * The image a step runs in: the configured one, else a per-kind default.
     * Docker steps must name their image.
     */
    public static String resolveImage(StepKind kind, StepConfig config) {
        String configured = config == null ? null : config.image();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return switch (kind) {
            case SCRIPT -> DEFAULT_SCRIPT_IMAGE;
            case DOCKER -> throw new RoutingException("Docker step requires an image");
            case AGENT  -> agentImage(config == null ? null : config.runnerType());
        };
    }

    private static String agentImage(String runnerType) {
        if (runnerType == null) {
            return "conveyor-agent:latest";
        }
        return switch (runnerType) {
            case "claude-code" -> "conveyor-claude:latest";
            case "gemini"      -> "conveyor-gemini:latest";
            default            -> "conveyor-agent:latest";
        };
    }

    /** Map JVM and uname spellings onto amd64 / arm64. */
    public static String normalizeArch(String arch) {
        if (arch == null) {
            return "amd64";
        }
        String a = arch.trim().toLowerCase(Locale.ROOT);
        return switch (a) {
            case "x86_64", "amd64", "x64" -> "amd64";
            case "aarch64", "arm64"       -> "arm64";
            default                       -> a;
        };
    }
}
