package com.conveyor.orchestrator.model;

import com.conveyor.orchestrator.statemachine.WorkspaceState;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * The working-directory volume shared by all steps of one pipeline run.
 *
 * use_count mirrors the number of step executions currently mounted on the
 * volume; cleanup is refused while it is positive.
 *
 * DB table: workspaces
 */
@Entity
@Table(name = "workspaces")
public class Workspace {

    // "ws-" + pipeline run id, so the id is derivable without a lookup.
    @Id
    private String id;

    @Column(name = "pipeline_run_id", nullable = false, unique = true)
    private UUID pipelineRunId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkspaceState status = WorkspaceState.CREATING;

    @Column(name = "use_count", nullable = false)
    private int useCount;

    @Column(name = "volume_name", nullable = false)
    private String volumeName;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "state_history", columnDefinition = "TEXT")
    private String stateHistory;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "last_activity_at", nullable = false)
    private Instant lastActivityAt = Instant.now();

    @Column(name = "cleaned_at")
    private Instant cleanedAt;

    protected Workspace() {}   // required by JPA

    public Workspace(String id, UUID pipelineRunId, String volumeName) {
        this.id            = id;
        this.pipelineRunId = pipelineRunId;
        this.volumeName    = volumeName;
    }

    public static String idFor(UUID pipelineRunId) {
        return "ws-" + pipelineRunId;
    }

    public String         getId()             { return id; }
    public UUID           getPipelineRunId()  { return pipelineRunId; }
    public WorkspaceState getStatus()         { return status; }
    public int            getUseCount()       { return useCount; }
    public String         getVolumeName()     { return volumeName; }
    public String         getError()          { return error; }
    public String         getStateHistory()   { return stateHistory; }
    public Instant        getCreatedAt()      { return createdAt; }
    public Instant        getLastActivityAt() { return lastActivityAt; }
    public Instant        getCleanedAt()      { return cleanedAt; }

    public void setStatus(WorkspaceState status)   { this.status = status; }
    public void setUseCount(int useCount)          { this.useCount = useCount; }
    public void setError(String error)             { this.error = error; }
    public void setStateHistory(String json)       { this.stateHistory = json; }
    public void setLastActivityAt(Instant t)       { this.lastActivityAt = t; }
    public void setCleanedAt(Instant t)            { this.cleanedAt = t; }
}
