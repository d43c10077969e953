package com.conveyor.orchestrator.workspace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process reader/writer locks over workspace volumes, keyed by workspace id.
 *
 * Any number of SHARED grants may be held together; an EXCLUSIVE grant
 * requires that nothing else is held. A request that cannot be granted
 * waits on a condition until it can, or until its timeout passes, and then
 * returns a lock with {@code acquired = false}. It never throws and never
 * waits without bound.
 *
 * Grants are not tied to threads: a lock acquired by one thread may be
 * released by another.
 */
@Component
public class WorkspaceLockManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceLockManager.class);

    private final ReentrantLock mutex   = new ReentrantLock();
    private final Condition     changed = mutex.newCondition();

    // workspace id -> grants currently held; empty lists are removed
    private final Map<String, List<WorkspaceLock>> grants = new HashMap<>();

    private final Clock clock;

    public WorkspaceLockManager(Clock clock) {
        this.clock = clock;
    }

    /**
     * Request a lock, waiting at most {@code timeout}. A zero timeout tries
     * once without waiting.
     */
    public WorkspaceLock acquire(String workspaceId, LockType type, String reason, Duration timeout) {
        long remaining = Math.max(0, timeout.toNanos());
        mutex.lock();
        try {
            while (!admissible(workspaceId, type)) {
                if (remaining <= 0) {
                    log.debug("{} lock on {} not acquired within {}ms ({})",
                            type, workspaceId, timeout.toMillis(), reason);
                    return new WorkspaceLock(UUID.randomUUID(), workspaceId, type, reason, null, false);
                }
                remaining = changed.awaitNanos(remaining);
            }
            WorkspaceLock lock = new WorkspaceLock(
                    UUID.randomUUID(), workspaceId, type, reason, clock.instant(), true);
            grants.computeIfAbsent(workspaceId, k -> new ArrayList<>()).add(lock);
            log.debug("{} lock {} on {} acquired ({})", type, lock.id(), workspaceId, reason);
            return lock;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new WorkspaceLock(UUID.randomUUID(), workspaceId, type, reason, null, false);
        } finally {
            mutex.unlock();
        }
    }

    /** Release a grant. Returns false if it was not held (never acquired, or force-released). */
    public boolean release(WorkspaceLock lock) {
        if (lock == null || !lock.acquired()) {
            return false;
        }
        mutex.lock();
        try {
            List<WorkspaceLock> held = grants.get(lock.workspaceId());
            if (held == null || !held.removeIf(l -> l.id().equals(lock.id()))) {
                return false;
            }
            if (held.isEmpty()) {
                grants.remove(lock.workspaceId());
            }
            changed.signalAll();
            return true;
        } finally {
            mutex.unlock();
        }
    }

    /**
     * Run {@code action} while holding the lock; the lock is released on every
     * exit path.
     *
     * @throws LockTimeoutException if the lock was not granted within {@code timeout}
     */
    public <T> T withLock(String workspaceId, LockType type, String reason, Duration timeout, Supplier<T> action) {
        WorkspaceLock lock = acquire(workspaceId, type, reason, timeout);
        if (!lock.acquired()) {
            throw new LockTimeoutException(workspaceId, type, timeout);
        }
        try {
            return action.get();
        } finally {
            release(lock);
        }
    }

    public void runWithLock(String workspaceId, LockType type, String reason, Duration timeout, Runnable action) {
        withLock(workspaceId, type, reason, timeout, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Drop every grant on a workspace regardless of owner. Operator
     * break-glass; returns how many grants were cleared.
     */
    public int forceRelease(String workspaceId) {
        mutex.lock();
        try {
            List<WorkspaceLock> held = grants.remove(workspaceId);
            int count = held == null ? 0 : held.size();
            if (count > 0) {
                log.warn("Force-released {} lock(s) on workspace {}", count, workspaceId);
                changed.signalAll();
            }
            return count;
        } finally {
            mutex.unlock();
        }
    }

    /** Snapshot of the grants currently held on a workspace. */
    public List<WorkspaceLock> held(String workspaceId) {
        mutex.lock();
        try {
            return List.copyOf(grants.getOrDefault(workspaceId, List.of()));
        } finally {
            mutex.unlock();
        }
    }

    public boolean isLocked(String workspaceId) {
        return !held(workspaceId).isEmpty();
    }

    private boolean admissible(String workspaceId, LockType type) {
        List<WorkspaceLock> held = grants.get(workspaceId);
        if (held == null || held.isEmpty()) {
            return true;
        }
        if (type == LockType.EXCLUSIVE) {
            return false;
        }
        return held.stream().noneMatch(l -> l.type() == LockType.EXCLUSIVE);
    }
}
