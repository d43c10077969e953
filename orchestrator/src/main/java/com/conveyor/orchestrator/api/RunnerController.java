package com.conveyor.orchestrator.api;

import com.conveyor.orchestrator.api.dto.CompleteStepRequest;
import com.conveyor.orchestrator.api.dto.JobResponse;
import com.conveyor.orchestrator.api.dto.LogLinesRequest;
import com.conveyor.orchestrator.api.dto.RegisterRunnerRequest;
import com.conveyor.orchestrator.api.dto.RegisterRunnerResponse;
import com.conveyor.orchestrator.api.dto.RunnerResponse;
import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.model.Runner;
import com.conveyor.orchestrator.recovery.JobRecoveryService;
import com.conveyor.orchestrator.recovery.ReconnectAction;
import com.conveyor.orchestrator.routing.ExecutionRouter;
import com.conveyor.orchestrator.routing.RunnerLabels;
import com.conveyor.orchestrator.runner.RemoteStepExecutor;
import com.conveyor.orchestrator.runner.RunnerRegistry;
import com.conveyor.orchestrator.service.NotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * HTTP transport for runners that poll instead of holding a websocket.
 *
 * POST /api/runners/register        register or re-register
 * POST /api/runners/{id}/heartbeat  liveness; 404 means register again
 * GET  /api/runners/{id}/job        next matching job, 204 if none
 * POST /api/runners/{id}/complete   report a step result
 * POST /api/runners/{id}/logs       push log lines
 * GET  /api/runners                 all runners
 * GET  /api/runners/{id}/logs       recent buffered log lines
 */
@RestController
@RequestMapping("/api/runners")
public class RunnerController {

    private final RunnerRegistry       registry;
    private final RemoteStepExecutor   remote;
    private final JobRecoveryService   recovery;
    private final StepExecutionService executions;

    public RunnerController(RunnerRegistry registry,
                            RemoteStepExecutor remote,
                            JobRecoveryService recovery,
                            StepExecutionService executions) {
        this.registry   = registry;
        this.remote     = remote;
        this.recovery   = recovery;
        this.executions = executions;
    }

    @PostMapping("/register")
    public ResponseEntity<RegisterRunnerResponse> register(@RequestBody RegisterRunnerRequest req) {
        RunnerLabels labels = req.labels() == null ? RunnerLabels.none() : new RunnerLabels(
                req.labels().arch() == null ? null : ExecutionRouter.normalizeArch(req.labels().arch()),
                req.labels().has());
        Runner runner = registry.register(req.runnerId(), req.name(), req.runnerType(), labels);
        ReconnectAction action = recovery.onRunnerReconnect(runner.getId());
        Runner current = registry.find(runner.getId()).orElse(runner);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RegisterRunnerResponse(toResponse(current), action.wireName()));
    }

    @PostMapping("/{id}/heartbeat")
    public ResponseEntity<Map<String, String>> heartbeat(@PathVariable String id) {
        if (!registry.heartbeat(id)) {
            throw new NotFoundException("Runner " + id + " is not registered or was declared dead");
        }
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    @GetMapping("/{id}/job")
    public ResponseEntity<JobResponse> poll(@PathVariable String id) {
        return remote.pollJob(id)
                .map(job -> ResponseEntity.ok(JobResponse.from(job)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<Map<String, String>> complete(@PathVariable String id,
                                                        @RequestBody CompleteStepRequest req) {
        if (req.stepId() == null) {
            throw new IllegalArgumentException("stepId is required");
        }
        remote.onStepComplete(id, req.stepId(), req.exitCode(), req.error());
        return ResponseEntity.ok(Map.of("status", "accepted"));
    }

    @PostMapping("/{id}/logs")
    public ResponseEntity<Map<String, Integer>> pushLogs(@PathVariable String id,
                                                         @RequestBody LogLinesRequest req) {
        List<String> lines = req.lines() == null ? List.of() : req.lines();
        registry.appendLogs(id, lines);
        if (req.stepId() != null) {
            executions.appendLogs(req.stepId(), lines);
        }
        return ResponseEntity.ok(Map.of("accepted", lines.size()));
    }

    @GetMapping
    public List<RunnerResponse> list() {
        return registry.list().stream().map(this::toResponse).toList();
    }

    @GetMapping("/{id}/logs")
    public List<String> logs(@PathVariable String id) {
        registry.find(id).orElseThrow(() -> NotFoundException.of("Runner", id));
        return registry.logs(id);
    }

    private RunnerResponse toResponse(Runner runner) {
        return RunnerResponse.from(runner, registry.labelsOf(runner));
    }
}
