package com.conveyor.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Dedup ledger entry: when a trigger key last started a run, and which run.
 *
 * DB table: trigger_records
 */
@Entity
@Table(name = "trigger_records")
public class TriggerRecord {

    @Id
    @Column(name = "trigger_key")
    private String triggerKey;

    @Column(name = "pipeline_run_id", nullable = false)
    private UUID pipelineRunId;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;

    protected TriggerRecord() {}   // required by JPA

    public TriggerRecord(String triggerKey, UUID pipelineRunId, Instant triggeredAt) {
        this.triggerKey    = triggerKey;
        this.pipelineRunId = pipelineRunId;
        this.triggeredAt   = triggeredAt;
    }

    public String  getTriggerKey()    { return triggerKey; }
    public UUID    getPipelineRunId() { return pipelineRunId; }
    public Instant getTriggeredAt()   { return triggeredAt; }

    public void setPipelineRunId(UUID id) { this.pipelineRunId = id; }
    public void setTriggeredAt(Instant t) { this.triggeredAt = t; }
}
