package com.conveyor.orchestrator.debug;

import com.conveyor.orchestrator.model.DebugSession;
import com.conveyor.orchestrator.model.PipelineRun;

/**
 * A freshly created debug re-run. {@code token} is the only copy of the CLI
 * access token; the session stores its hash.
 */
public record DebugRerun(DebugSession session, PipelineRun run, String token) {

    public String joinCommand() {
        return "conveyor debug " + session.getId() + " --token " + token;
    }
}
