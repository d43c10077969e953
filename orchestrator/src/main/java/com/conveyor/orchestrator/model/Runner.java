package com.conveyor.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A registered remote worker.
 *
 * The id is chosen by the runner itself so that a reconnecting runner lands
 * on the same row and its assignment history stays intact.
 *
 * DB table: runners
 */
@Entity
@Table(name = "runners")
public class Runner {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    // claude-code | gemini | any
    @Column(name = "runner_type", nullable = false)
    private String runnerType = "any";

    // JSON object: {"arch": "...", "has": [...]}
    @Column(columnDefinition = "TEXT")
    private String labels;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunnerStatus status = RunnerStatus.IDLE;

    @Column(name = "current_step_execution_id")
    private UUID currentStepExecutionId;

    @Column(name = "last_heartbeat_at")
    private Instant lastHeartbeatAt;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Column(name = "connected_at")
    private Instant connectedAt;

    protected Runner() {}   // required by JPA

    public Runner(String id, String name, String runnerType, String labels, Instant now) {
        this.id              = id;
        this.name            = name;
        this.runnerType      = runnerType;
        this.labels          = labels;
        this.registeredAt    = now;
        this.connectedAt     = now;
        this.lastHeartbeatAt = now;
    }

    public String       getId()                     { return id; }
    public String       getName()                   { return name; }
    public String       getRunnerType()             { return runnerType; }
    public String       getLabels()                 { return labels; }
    public RunnerStatus getStatus()                 { return status; }
    public UUID         getCurrentStepExecutionId() { return currentStepExecutionId; }
    public Instant      getLastHeartbeatAt()        { return lastHeartbeatAt; }
    public Instant      getRegisteredAt()           { return registeredAt; }
    public Instant      getConnectedAt()            { return connectedAt; }

    public void setName(String name)                     { this.name = name; }
    public void setRunnerType(String runnerType)         { this.runnerType = runnerType; }
    public void setLabels(String labels)                 { this.labels = labels; }
    public void setStatus(RunnerStatus status)           { this.status = status; }
    public void setCurrentStepExecutionId(UUID id)       { this.currentStepExecutionId = id; }
    public void setLastHeartbeatAt(Instant t)            { this.lastHeartbeatAt = t; }
    public void setConnectedAt(Instant t)                { this.connectedAt = t; }
}
