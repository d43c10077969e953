package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.debug.DebugRerun;

/**
 * Response body for POST /api/debug. The token is shown once and never
 * again; only its hash is stored.
 */
public record DebugRerunResponse(
        DebugSessionResponse session,
        PipelineRunResponse  run,
        String               token,
        String               joinCommand
) {
    public static DebugRerunResponse from(DebugRerun rerun, DebugSessionResponse session) {
        return new DebugRerunResponse(session, PipelineRunResponse.from(rerun.run()),
                rerun.token(), rerun.joinCommand());
    }
}
