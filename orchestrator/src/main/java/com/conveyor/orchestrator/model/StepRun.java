package com.conveyor.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One step of a pipeline run: its definition and coarse progress.
 *
 * Created together with the run, one row per step definition. Each attempt
 * at running it is a separate {@link StepExecution}.
 *
 * DB table: step_runs
 */
@Entity
@Table(name = "step_runs")
public class StepRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pipeline_run_id", nullable = false)
    private UUID pipelineRunId;

    @Column(name = "step_index", nullable = false)
    private int stepIndex;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepKind kind;

    // The full step definition (config, requirements, policies) as JSON.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String definition;

    @Column(name = "on_success", nullable = false)
    private String onSuccess = "next";

    @Column(name = "on_failure", nullable = false)
    private String onFailure = "stop";

    @Column(name = "timeout_seconds", nullable = false)
    private int timeoutSeconds;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StepRunStatus status = StepRunStatus.PENDING;

    // Accumulated log output across attempts.
    @Column(columnDefinition = "TEXT")
    private String logs = "";

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected StepRun() {}   // required by JPA

    public StepRun(UUID pipelineRunId, int stepIndex, String name, StepKind kind, String definition,
                   String onSuccess, String onFailure, int timeoutSeconds) {
        this.pipelineRunId  = pipelineRunId;
        this.stepIndex      = stepIndex;
        this.name           = name;
        this.kind           = kind;
        this.definition     = definition;
        this.onSuccess      = onSuccess;
        this.onFailure      = onFailure;
        this.timeoutSeconds = timeoutSeconds;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()             { return id; }
    public UUID          getPipelineRunId()  { return pipelineRunId; }
    public int           getStepIndex()      { return stepIndex; }
    public String        getName()           { return name; }
    public StepKind      getKind()           { return kind; }
    public String        getDefinition()     { return definition; }
    public String        getOnSuccess()      { return onSuccess; }
    public String        getOnFailure()      { return onFailure; }
    public int           getTimeoutSeconds() { return timeoutSeconds; }
    public StepRunStatus getStatus()         { return status; }
    public String        getLogs()           { return logs; }
    public String        getError()          { return error; }
    public Instant       getStartedAt()      { return startedAt; }
    public Instant       getCompletedAt()    { return completedAt; }

    public void setStatus(StepRunStatus status) { this.status = status; }
    public void setError(String error)          { this.error = error; }
    public void setStartedAt(Instant t)         { this.startedAt = t; }
    public void setCompletedAt(Instant t)       { this.completedAt = t; }

    public void appendLogs(String text) {
        if (text == null || text.isEmpty()) return;
        this.logs = (logs == null ? "" : logs) + text;
    }
}
