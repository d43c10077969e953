package com.conveyor.orchestrator.trigger;

import com.conveyor.orchestrator.model.TriggerRecord;
import com.conveyor.orchestrator.repository.TriggerRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Rejects a trigger when the same key already started a run within the
 * dedup window.
 *
 * The window is anchored at the admission that created the record: a
 * rejected duplicate does not push it forward, so a steady stream of
 * duplicates is admitted again once the original window has passed.
 * A zero window disables dedup. Expired records are only removed by
 * {@link #cleanupExpired()}.
 *
 * {@link #admit} decides under a row lock on the key's record, so of two
 * concurrent triggers for one key the second waits for the first to commit
 * and then sees its run. {@link #check} is an unlocked preview.
 */
@Service
public class TriggerDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(TriggerDeduplicator.class);

    // Run id of a row created only to have something to lock.
    static final UUID UNCLAIMED = new UUID(0L, 0L);

    private final TriggerRecordRepository records;
    private final Clock                   clock;
    private final Duration                window;
    private final MeterRegistry           meters;

    public TriggerDeduplicator(TriggerRecordRepository records,
                               Clock clock,
                               @Value("${conveyor.trigger.dedup-window:PT1H}") Duration window,
                               MeterRegistry meters) {
        this.records = records;
        this.clock   = clock;
        this.window  = window;
        this.meters  = meters;
    }

    public Duration getWindow() {
        return window;
    }

    @Transactional(readOnly = true)
    public TriggerCheckResult check(TriggerKey key) {
        return check(key, window, false);
    }

    /**
     * @param force admit even inside the window; the caller still records the new run
     */
    @Transactional(readOnly = true)
    public TriggerCheckResult check(TriggerKey key, Duration window, boolean force) {
        return decide(key, window, force, records.findById(key.toString()));
    }

    /**
     * Decide admission while holding the row lock on {@code key}'s record.
     * The lock lasts until the surrounding transaction ends, so the caller
     * must create its run and call {@link #record} in that same transaction.
     */
    @Transactional
    public TriggerCheckResult admit(TriggerKey key, boolean force) {
        return decide(key, window, force, lock(key));
    }

    /** Record that {@code key} just started {@code runId}, replacing any older entry. */
    @Transactional
    public void record(TriggerKey key, UUID runId) {
        TriggerRecord rec = lock(key).orElseThrow(
                () -> new IllegalStateException("Trigger record " + key + " vanished after insert"));
        rec.setPipelineRunId(runId);
        rec.setTriggeredAt(clock.instant());
        records.save(rec);
    }

    /** Admit, and record {@code runId} only if the trigger is admitted. */
    @Transactional
    public TriggerCheckResult checkAndRecord(TriggerKey key, UUID runId, boolean force) {
        TriggerCheckResult result = admit(key, force);
        if (result.allowed()) {
            record(key, runId);
        }
        return result;
    }

    /** Delete records whose window has fully elapsed; returns how many. */
    @Transactional
    public int cleanupExpired() {
        int removed = records.deleteAdmittedAtOrBefore(clock.instant().minus(window));
        if (removed > 0) {
            log.info("Removed {} expired trigger records", removed);
        }
        return removed;
    }

    private Optional<TriggerRecord> lock(TriggerKey key) {
        records.insertIfAbsent(key.toString(), UNCLAIMED, Instant.EPOCH);
        return records.findForUpdate(key.toString());
    }

    private TriggerCheckResult decide(TriggerKey key, Duration window, boolean force,
                                      Optional<TriggerRecord> existing) {
        if (force) {
            count("forced");
            return TriggerCheckResult.admitted("Forced trigger");
        }
        if (window.isZero() || window.isNegative()) {
            count("admitted");
            return TriggerCheckResult.admitted("Deduplication disabled");
        }
        if (existing.isPresent() && !UNCLAIMED.equals(existing.get().getPipelineRunId())) {
            TriggerRecord rec = existing.get();
            Duration age = Duration.between(rec.getTriggeredAt(), clock.instant());
            if (age.compareTo(window) < 0) {
                count("duplicate");
                log.warn("Duplicate trigger {} rejected: run {} admitted {}s ago",
                        key, rec.getPipelineRunId(), age.toSeconds());
                return TriggerCheckResult.duplicate(rec.getPipelineRunId(), rec.getTriggeredAt());
            }
        }
        count("admitted");
        return TriggerCheckResult.admitted("First trigger in window");
    }

    private void count(String outcome) {
        meters.counter("conveyor.triggers", "outcome", outcome).increment();
    }
}
