package com.conveyor.orchestrator.model;

import com.conveyor.orchestrator.statemachine.DebugState;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Interactive debug session attached to a breakpointed re-run of a failed
 * or cancelled pipeline run.
 *
 * Only the SHA-256 hash of the CLI access token is stored.
 *
 * DB table: debug_sessions
 */
@Entity
@Table(name = "debug_sessions")
public class DebugSession {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // The re-run being debugged.
    @Column(name = "pipeline_run_id", nullable = false)
    private UUID pipelineRunId;

    // The failed run that was re-run.
    @Column(name = "original_run_id", nullable = false)
    private UUID originalRunId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DebugState status = DebugState.PENDING;

    // JSON array of step indices to pause before.
    @Column(nullable = false, columnDefinition = "TEXT")
    private String breakpoints;

    @Column(name = "current_step_index")
    private Integer currentStepIndex;

    @Column(name = "current_step_name")
    private String currentStepName;

    @Column(name = "commit_sha")
    private String commitSha;

    @Column(name = "runtime_host")
    private String runtimeHost;

    @Column(name = "token_hash", nullable = false)
    private String tokenHash;

    @Column(name = "timeout_seconds", nullable = false)
    private int timeoutSeconds;

    @Column(name = "max_timeout_seconds", nullable = false)
    private int maxTimeoutSeconds;

    @Column(name = "state_history", columnDefinition = "TEXT")
    private String stateHistory;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "breakpoint_hit_at")
    private Instant breakpointHitAt;

    @Column(name = "connected_at")
    private Instant connectedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    protected DebugSession() {}   // required by JPA

    public DebugSession(UUID pipelineRunId, UUID originalRunId, String breakpoints, String tokenHash,
                        int timeoutSeconds, int maxTimeoutSeconds, Instant now) {
        this.pipelineRunId     = pipelineRunId;
        this.originalRunId     = originalRunId;
        this.breakpoints       = breakpoints;
        this.tokenHash         = tokenHash;
        this.timeoutSeconds    = timeoutSeconds;
        this.maxTimeoutSeconds = maxTimeoutSeconds;
        this.createdAt         = now;
        this.expiresAt         = now.plusSeconds(timeoutSeconds);
    }

    public UUID       getId()                { return id; }
    public UUID       getPipelineRunId()     { return pipelineRunId; }
    public UUID       getOriginalRunId()     { return originalRunId; }
    public DebugState getStatus()            { return status; }
    public String     getBreakpoints()       { return breakpoints; }
    public Integer    getCurrentStepIndex()  { return currentStepIndex; }
    public String     getCurrentStepName()   { return currentStepName; }
    public String     getCommitSha()         { return commitSha; }
    public String     getRuntimeHost()       { return runtimeHost; }
    public String     getTokenHash()         { return tokenHash; }
    public int        getTimeoutSeconds()    { return timeoutSeconds; }
    public int        getMaxTimeoutSeconds() { return maxTimeoutSeconds; }
    public String     getStateHistory()      { return stateHistory; }
    public Instant    getCreatedAt()         { return createdAt; }
    public Instant    getBreakpointHitAt()   { return breakpointHitAt; }
    public Instant    getConnectedAt()       { return connectedAt; }
    public Instant    getEndedAt()           { return endedAt; }
    public Instant    getExpiresAt()         { return expiresAt; }

    public void setStatus(DebugState status)         { this.status = status; }
    public void setCurrentStepIndex(Integer i)       { this.currentStepIndex = i; }
    public void setCurrentStepName(String name)      { this.currentStepName = name; }
    public void setCommitSha(String sha)             { this.commitSha = sha; }
    public void setRuntimeHost(String host)          { this.runtimeHost = host; }
    public void setTimeoutSeconds(int seconds)       { this.timeoutSeconds = seconds; }
    public void setStateHistory(String json)         { this.stateHistory = json; }
    public void setBreakpointHitAt(Instant t)        { this.breakpointHitAt = t; }
    public void setConnectedAt(Instant t)            { this.connectedAt = t; }
    public void setEndedAt(Instant t)                { this.endedAt = t; }
    public void setExpiresAt(Instant t)              { this.expiresAt = t; }
}
