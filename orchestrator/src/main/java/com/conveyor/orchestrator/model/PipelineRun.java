package com.conveyor.orchestrator.model;

import com.conveyor.orchestrator.statemachine.PipelineRunState;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One execution of a pipeline definition.
 *
 * Status and step progress are written only from a
 * {@code PipelineStateMachine}; the state history is kept as JSON so the
 * machine can be rebuilt exactly after a restart.
 *
 * DB table: pipeline_runs
 */
@Entity
@Table(name = "pipeline_runs")
public class PipelineRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "pipeline_id", nullable = false)
    private String pipelineId;

    @Column(name = "repo_id", nullable = false)
    private String repoId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineRunState status = PipelineRunState.PENDING;

    // push | card_complete | manual | debug
    @Column(name = "trigger_type", nullable = false)
    private String triggerType;

    @Column(name = "trigger_ref")
    private String triggerRef;

    @Column(name = "steps_total", nullable = false)
    private int stepsTotal;

    @Column(name = "steps_completed", nullable = false)
    private int stepsCompleted;

    // JSON array of completed step indices.
    @Column(name = "completed_steps", columnDefinition = "TEXT")
    private String completedSteps;

    @Column(name = "current_step_index")
    private Integer currentStepIndex;

    @Column(name = "current_step_name")
    private String currentStepName;

    @Column(name = "failed_step_index")
    private Integer failedStepIndex;

    @Column(name = "failed_step_name")
    private String failedStepName;

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

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PipelineRun() {}   // required by JPA

    public PipelineRun(String pipelineId, String repoId, String triggerType, String triggerRef, int stepsTotal) {
        this.pipelineId  = pipelineId;
        this.repoId      = repoId;
        this.triggerType = triggerType;
        this.triggerRef  = triggerRef;
        this.stepsTotal  = stepsTotal;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID             getId()               { return id; }
    public String           getPipelineId()       { return pipelineId; }
    public String           getRepoId()           { return repoId; }
    public PipelineRunState getStatus()           { return status; }
    public String           getTriggerType()      { return triggerType; }
    public String           getTriggerRef()       { return triggerRef; }
    public int              getStepsTotal()       { return stepsTotal; }
    public int              getStepsCompleted()   { return stepsCompleted; }
    public String           getCompletedSteps()   { return completedSteps; }
    public Integer          getCurrentStepIndex() { return currentStepIndex; }
    public String           getCurrentStepName()  { return currentStepName; }
    public Integer          getFailedStepIndex()  { return failedStepIndex; }
    public String           getFailedStepName()   { return failedStepName; }
    public String           getError()            { return error; }
    public String           getStateHistory()     { return stateHistory; }
    public Instant          getCreatedAt()        { return createdAt; }
    public Instant          getStartedAt()        { return startedAt; }
    public Instant          getCompletedAt()      { return completedAt; }
    public Instant          getUpdatedAt()        { return updatedAt; }

    public void setStatus(PipelineRunState status)        { this.status = status; }
    public void setStepsCompleted(int n)                  { this.stepsCompleted = n; }
    public void setCompletedSteps(String json)            { this.completedSteps = json; }
    public void setCurrentStepIndex(Integer i)            { this.currentStepIndex = i; }
    public void setCurrentStepName(String name)           { this.currentStepName = name; }
    public void setFailedStepIndex(Integer i)             { this.failedStepIndex = i; }
    public void setFailedStepName(String name)            { this.failedStepName = name; }
    public void setError(String error)                    { this.error = error; }
    public void setStateHistory(String json)              { this.stateHistory = json; }
    public void setStartedAt(Instant t)                   { this.startedAt = t; }
    public void setCompletedAt(Instant t)                 { this.completedAt = t; }
}
