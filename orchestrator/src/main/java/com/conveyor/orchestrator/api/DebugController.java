package com.conveyor.orchestrator.api;

import com.conveyor.orchestrator.api.dto.ConnectRequest;
import com.conveyor.orchestrator.api.dto.DebugRerunRequest;
import com.conveyor.orchestrator.api.dto.DebugRerunResponse;
import com.conveyor.orchestrator.api.dto.DebugSessionResponse;
import com.conveyor.orchestrator.api.dto.ExtendRequest;
import com.conveyor.orchestrator.debug.DebugRerun;
import com.conveyor.orchestrator.debug.DebugSessionService;
import com.conveyor.orchestrator.model.DebugSession;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API for debug re-runs.
 *
 * POST /api/debug                    re-run a failed or cancelled run with breakpoints
 * GET  /api/debug/{id}               session state
 * POST /api/debug/{id}/connect       CLI attaches with the session token
 * POST /api/debug/{id}/disconnect    CLI detaches; the run stays paused
 * POST /api/debug/{id}/resume        continue execution from the breakpoint
 * POST /api/debug/{id}/abort         end the session and cancel the run
 * POST /api/debug/{id}/extend        push the expiry back, up to the maximum
 */
@RestController
@RequestMapping("/api/debug")
public class DebugController {

    private final DebugSessionService sessions;

    public DebugController(DebugSessionService sessions) {
        this.sessions = sessions;
    }

    @PostMapping
    public ResponseEntity<DebugRerunResponse> create(@RequestBody DebugRerunRequest req) {
        if (req.runId() == null) {
            throw new IllegalArgumentException("runId is required");
        }
        DebugRerun rerun = sessions.create(req.runId(), req.breakpoints());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(DebugRerunResponse.from(rerun, toResponse(rerun.session())));
    }

    @GetMapping("/{id}")
    public DebugSessionResponse get(@PathVariable UUID id) {
        return toResponse(sessions.get(id));
    }

    @PostMapping("/{id}/connect")
    public DebugSessionResponse connect(@PathVariable UUID id, @RequestBody ConnectRequest req) {
        return toResponse(sessions.connect(id, req.token()));
    }

    @PostMapping("/{id}/disconnect")
    public DebugSessionResponse disconnect(@PathVariable UUID id) {
        return toResponse(sessions.disconnect(id));
    }

    @PostMapping("/{id}/resume")
    public DebugSessionResponse resume(@PathVariable UUID id) {
        return toResponse(sessions.resume(id));
    }

    @PostMapping("/{id}/abort")
    public DebugSessionResponse abort(@PathVariable UUID id) {
        return toResponse(sessions.abort(id));
    }

    @PostMapping("/{id}/extend")
    public DebugSessionResponse extend(@PathVariable UUID id, @RequestBody ExtendRequest req) {
        return toResponse(sessions.extend(id, req.additionalSeconds()));
    }

    private DebugSessionResponse toResponse(DebugSession session) {
        return DebugSessionResponse.from(session, sessions.breakpointsOf(session));
    }
}
