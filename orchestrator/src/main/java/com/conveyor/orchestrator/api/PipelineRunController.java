package com.conveyor.orchestrator.api;

import com.conveyor.orchestrator.api.dto.CancelRequest;
import com.conveyor.orchestrator.api.dto.PipelineRunResponse;
import com.conveyor.orchestrator.api.dto.StepRunResponse;
import com.conveyor.orchestrator.api.dto.TriggerResponse;
import com.conveyor.orchestrator.api.dto.TriggerRunRequest;
import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.model.StepExecution;
import com.conveyor.orchestrator.service.PipelineExecutor;
import com.conveyor.orchestrator.service.PipelineRunService;
import com.conveyor.orchestrator.service.TriggerOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for pipeline runs.
 *
 * POST /api/pipeline-runs              trigger a run (201), or report a duplicate (200)
 * GET  /api/pipeline-runs/{id}         current state of a run
 * GET  /api/pipeline-runs/{id}/steps   steps with every execution attempt
 * POST /api/pipeline-runs/{id}/cancel  cancel a run that has not finished
 */
@RestController
@RequestMapping("/api/pipeline-runs")
public class PipelineRunController {

    private final PipelineRunService   runs;
    private final PipelineExecutor     executor;
    private final StepExecutionService executions;

    public PipelineRunController(PipelineRunService runs,
                                 PipelineExecutor executor,
                                 StepExecutionService executions) {
        this.runs       = runs;
        this.executor   = executor;
        this.executions = executions;
    }

    /**
     * Trigger a run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/pipeline-runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"pipelineId":"build","repoId":"web","triggerType":"push","triggerRef":"main:abc123",
     *          "steps":[{"name":"test","type":"SCRIPT","config":{"command":"make test"}}]}'
     *
     * A trigger rejected by deduplication is not an error: it answers 200
     * with {@code duplicate=true} and the id of the run already started.
     */
    @PostMapping
    public ResponseEntity<TriggerResponse> trigger(@RequestBody TriggerRunRequest req) {
        TriggerOutcome outcome = runs.trigger(req.toTriggerRequest());
        HttpStatus status = outcome.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TriggerResponse.from(outcome));
    }

    @GetMapping("/{id}")
    public PipelineRunResponse getRun(@PathVariable UUID id) {
        return PipelineRunResponse.from(runs.get(id));
    }

    @GetMapping("/{id}/steps")
    public List<StepRunResponse> getSteps(@PathVariable UUID id) {
        runs.get(id);
        List<StepExecution> attempts = executions.forRun(id);
        return runs.steps(id).stream()
                .map(step -> StepRunResponse.from(step, attempts))
                .toList();
    }

    /** Returns 409 if the run already reached a terminal state. */
    @PostMapping("/{id}/cancel")
    public PipelineRunResponse cancel(@PathVariable UUID id,
                                      @RequestBody(required = false) CancelRequest req) {
        String reason = req == null || req.reason() == null || req.reason().isBlank()
                ? "Cancelled by user"
                : req.reason();
        return PipelineRunResponse.from(executor.cancel(id, reason));
    }
}
