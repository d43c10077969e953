package com.conveyor.orchestrator.repository;

import com.conveyor.orchestrator.model.TriggerRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface TriggerRecordRepository extends JpaRepository<TriggerRecord, String> {

    /**
     * Make sure a row exists for {@code key} so it can be locked. Returns 1
     * if this call created it. A concurrent insert of the same key waits for
     * the first transaction instead of failing on the primary key.
     */
    @Modifying
    @Query(value = """
            INSERT INTO trigger_records (trigger_key, pipeline_run_id, triggered_at)
            VALUES (:key, :runId, :triggeredAt)
            ON CONFLICT (trigger_key) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(@Param("key") String key,
                       @Param("runId") UUID runId,
                       @Param("triggeredAt") Instant triggeredAt);

    /** Row-locked load; concurrent triggers for one key queue here. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TriggerRecord t WHERE t.triggerKey = :key")
    Optional<TriggerRecord> findForUpdate(@Param("key") String key);

    /** Delete every record admitted at or before {@code cutoff}; returns the count. */
    @Modifying
    @Query("DELETE FROM TriggerRecord t WHERE t.triggeredAt <= :cutoff")
    int deleteAdmittedAtOrBefore(@Param("cutoff") Instant cutoff);
}
