package com.conveyor.orchestrator.model;

import com.conveyor.orchestrator.statemachine.StepExecutionState;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One attempt at running a {@link StepRun}, identified by its execution key
 * {@code {run_id}:{step_index}:{attempt}}.
 *
 * The unique constraint on execution_key is what makes dispatch idempotent:
 * a retried dispatch finds the existing row instead of creating a second one.
 * A retry of a failed attempt is a new row with attempt + 1.
 *
 * DB table: step_executions
 */
@Entity
@Table(name = "step_executions")
public class StepExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "execution_key", nullable = false, unique = true, updatable = false)
    private String executionKey;

    @Column(name = "step_run_id", nullable = false)
    private UUID stepRunId;

    @Column(name = "pipeline_run_id", nullable = false)
    private UUID pipelineRunId;

    @Column(name = "step_index", nullable = false)
    private int stepIndex;

    @Column(nullable = false)
    private int attempt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepExecutionState status = StepExecutionState.PENDING;

    // LOCAL or REMOTE, decided by the router before dispatch.
    @Column(name = "executor_type")
    private String executorType;

    // Set while a remote runner owns this attempt.
    @Column(name = "runner_id")
    private String runnerId;

    // Set while a local container runs this attempt.
    @Column(name = "container_id")
    private String containerId;

    @Column(name = "exit_code")
    private Integer exitCode;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "state_history", columnDefinition = "TEXT")
    private String stateHistory;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Refreshed by the local heartbeat task or the control endpoint.
    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StepExecution() {}   // required by JPA

    public StepExecution(String executionKey, UUID stepRunId, UUID pipelineRunId, int stepIndex, int attempt) {
        this.executionKey  = executionKey;
        this.stepRunId     = stepRunId;
        this.pipelineRunId = pipelineRunId;
        this.stepIndex     = stepIndex;
        this.attempt       = attempt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID               getId()            { return id; }
    public String             getExecutionKey()  { return executionKey; }
    public UUID               getStepRunId()     { return stepRunId; }
    public UUID               getPipelineRunId() { return pipelineRunId; }
    public int                getStepIndex()     { return stepIndex; }
    public int                getAttempt()       { return attempt; }
    public StepExecutionState getStatus()        { return status; }
    public String             getExecutorType()  { return executorType; }
    public String             getRunnerId()      { return runnerId; }
    public String             getContainerId()   { return containerId; }
    public Integer            getExitCode()      { return exitCode; }
    public String             getError()         { return error; }
    public String             getStateHistory()  { return stateHistory; }
    public Instant            getCreatedAt()     { return createdAt; }
    public Instant            getStartedAt()     { return startedAt; }
    public Instant            getCompletedAt()   { return completedAt; }
    public Instant            getHeartbeatAt()   { return heartbeatAt; }

    public void setStatus(StepExecutionState status) { this.status = status; }
    public void setExecutorType(String type)         { this.executorType = type; }
    public void setRunnerId(String runnerId)         { this.runnerId = runnerId; }
    public void setContainerId(String containerId)   { this.containerId = containerId; }
    public void setExitCode(Integer exitCode)        { this.exitCode = exitCode; }
    public void setError(String error)               { this.error = error; }
    public void setStateHistory(String json)         { this.stateHistory = json; }
    public void setStartedAt(Instant t)              { this.startedAt = t; }
    public void setCompletedAt(Instant t)            { this.completedAt = t; }
    public void setHeartbeatAt(Instant t)            { this.heartbeatAt = t; }
}
