package com.conveyor.orchestrator.api;

import com.conveyor.orchestrator.api.dto.LogLinesRequest;
import com.conveyor.orchestrator.api.dto.StepStatusRequest;
import com.conveyor.orchestrator.auth.StepTokenService;
import com.conveyor.orchestrator.event.StepFinishedEvent;
import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.model.StepExecution;
import com.conveyor.orchestrator.service.NotFoundException;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * Endpoints a running step calls back on, authenticated with the bearer
 * token issued for its execution key.
 *
 * POST /api/steps/{executionKey}/status     running, completed or failed
 * POST /api/steps/{executionKey}/logs       append output lines
 * POST /api/steps/{executionKey}/heartbeat  liveness
 *
 * A missing or malformed Authorization header is 401. A token that is
 * unknown, expired, revoked or issued for another key is 403.
 */
@RestController
@RequestMapping("/api/steps/{executionKey}")
public class StepControlController {

    private static final String BEARER = "Bearer ";

    private final StepTokenService          tokens;
    private final StepExecutionService      executions;
    private final ApplicationEventPublisher events;

    public StepControlController(StepTokenService tokens,
                                 StepExecutionService executions,
                                 ApplicationEventPublisher events) {
        this.tokens     = tokens;
        this.executions = executions;
        this.events     = events;
    }

    @PostMapping("/status")
    public ResponseEntity<Map<String, String>> status(@PathVariable String executionKey,
                                                      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                                      @RequestBody StepStatusRequest req) {
        StepExecution execution = authorize(executionKey, auth);
        String status = req.status() == null ? "" : req.status().toLowerCase();
        switch (status) {
            case "running":
                executions.markRunning(execution.getId(), req.containerId());
                break;
            case "completed":
                events.publishEvent(new StepFinishedEvent(execution.getId(),
                        req.exitCode() != null ? req.exitCode() : 0, req.error(), execution.getRunnerId()));
                break;
            case "failed":
                events.publishEvent(new StepFinishedEvent(execution.getId(),
                        req.exitCode() != null && req.exitCode() != 0 ? req.exitCode() : 1,
                        req.error(), execution.getRunnerId()));
                break;
            default:
                throw new IllegalArgumentException("Unknown step status: " + req.status());
        }
        return ResponseEntity.ok(Map.of("status", "accepted"));
    }

    @PostMapping("/logs")
    public ResponseEntity<Map<String, Integer>> logs(@PathVariable String executionKey,
                                                     @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth,
                                                     @RequestBody LogLinesRequest req) {
        StepExecution execution = authorize(executionKey, auth);
        List<String> lines = req.lines() == null ? List.of() : req.lines();
        executions.appendLogs(execution.getId(), lines);
        return ResponseEntity.ok(Map.of("accepted", lines.size()));
    }

    @PostMapping("/heartbeat")
    public ResponseEntity<Map<String, Boolean>> heartbeat(@PathVariable String executionKey,
                                                          @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String auth) {
        StepExecution execution = authorize(executionKey, auth);
        return ResponseEntity.ok(Map.of("running", executions.heartbeat(execution.getId())));
    }

    private StepExecution authorize(String executionKey, String header) {
        if (header == null || !header.startsWith(BEARER) || header.substring(BEARER.length()).isBlank()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Missing bearer token");
        }
        String token = header.substring(BEARER.length()).trim();
        String issuedFor = tokens.validate(token).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.FORBIDDEN, "Invalid or expired step token"));
        if (!issuedFor.equals(executionKey)) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Token not valid for " + executionKey);
        }
        return executions.findByKey(executionKey)
                .orElseThrow(() -> NotFoundException.of("Step execution", executionKey));
    }
}
