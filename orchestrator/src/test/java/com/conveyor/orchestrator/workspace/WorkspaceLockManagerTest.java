package com.conveyor.orchestrator.workspace;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Lock grants and timeouts. Timing assertions use generous bounds; only
 * the ordering of events is checked strictly.
 */
class WorkspaceLockManagerTest {

    static final String WS = "ws-1";

    final WorkspaceLockManager locks = new WorkspaceLockManager(Clock.systemUTC());

    @Test
    void sharedLocks_coexist() {
        WorkspaceLock a = locks.acquire(WS, LockType.SHARED, "step 0", Duration.ZERO);
        WorkspaceLock b = locks.acquire(WS, LockType.SHARED, "step 1", Duration.ZERO);

        assertThat(a.acquired()).isTrue();
        assertThat(b.acquired()).isTrue();
        assertThat(locks.held(WS)).hasSize(2);
    }

    @Test
    void exclusive_zeroTimeoutAttemptFailsWhileSharedHeld() {
        locks.acquire(WS, LockType.SHARED, "step", Duration.ZERO);

        WorkspaceLock attempt = locks.acquire(WS, LockType.EXCLUSIVE, "cleanup", Duration.ZERO);

        assertThat(attempt.acquired()).isFalse();
        assertThat(attempt.acquiredAt()).isNull();
        assertThat(locks.release(attempt)).isFalse();
    }

    @Test
    void shared_zeroTimeoutAttemptFailsWhileExclusiveHeld() {
        locks.acquire(WS, LockType.EXCLUSIVE, "cleanup", Duration.ZERO);

        assertThat(locks.acquire(WS, LockType.SHARED, "step", Duration.ZERO).acquired()).isFalse();
    }

    @Test
    void locksOnDifferentWorkspaces_areIndependent() {
        locks.acquire(WS, LockType.EXCLUSIVE, "cleanup", Duration.ZERO);

        assertThat(locks.acquire("ws-2", LockType.EXCLUSIVE, "cleanup", Duration.ZERO).acquired()).isTrue();
    }

    @Test
    void acquire_timesOutWithinBound() {
        locks.acquire(WS, LockType.EXCLUSIVE, "holder", Duration.ZERO);

        long start = System.nanoTime();
        WorkspaceLock lock = locks.acquire(WS, LockType.SHARED, "waiter", Duration.ofMillis(100));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(lock.acquired()).isFalse();
        assertThat(elapsedMs).isBetween(90L, 2000L);
    }

    @Test
    void waiter_isGrantedWhenHolderReleases() throws Exception {
        WorkspaceLock holder = locks.acquire(WS, LockType.SHARED, "step", Duration.ZERO);

        CompletableFuture<WorkspaceLock> waiter = CompletableFuture.supplyAsync(
                () -> locks.acquire(WS, LockType.EXCLUSIVE, "cleanup", Duration.ofSeconds(5)));
        Thread.sleep(50);
        assertThat(waiter).isNotDone();

        locks.release(holder);

        assertThat(waiter.get(5, TimeUnit.SECONDS).acquired()).isTrue();
    }

    @Test
    void withLock_releasesOnException() {
        assertThatThrownBy(() -> locks.withLock(WS, LockType.EXCLUSIVE, "boom", Duration.ZERO, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.isLocked(WS)).isFalse();
    }

    @Test
    void withLock_timeoutRaisesAndSkipsAction() {
        locks.acquire(WS, LockType.EXCLUSIVE, "holder", Duration.ZERO);
        AtomicBoolean ran = new AtomicBoolean();

        assertThatThrownBy(() -> locks.runWithLock(WS, LockType.SHARED, "step", Duration.ofMillis(20),
                () -> ran.set(true)))
                .isInstanceOf(LockTimeoutException.class);
        assertThat(ran).isFalse();
    }

    @Test
    void forceRelease_dropsAllGrantsAndWakesWaiters() throws Exception {
        locks.acquire(WS, LockType.SHARED, "a", Duration.ZERO);
        locks.acquire(WS, LockType.SHARED, "b", Duration.ZERO);
        CountDownLatch started = new CountDownLatch(1);
        CompletableFuture<WorkspaceLock> waiter = CompletableFuture.supplyAsync(() -> {
            started.countDown();
            return locks.acquire(WS, LockType.EXCLUSIVE, "cleanup", Duration.ofSeconds(5));
        });
        started.await();

        assertThat(locks.forceRelease(WS)).isEqualTo(2);
        assertThat(waiter.get(5, TimeUnit.SECONDS).acquired()).isTrue();
    }

    @Test
    void release_isNotTiedToAcquiringThread() throws Exception {
        WorkspaceLock lock = locks.acquire(WS, LockType.EXCLUSIVE, "step", Duration.ZERO);

        boolean released = CompletableFuture.supplyAsync(() -> locks.release(lock)).get(5, TimeUnit.SECONDS);

        assertThat(released).isTrue();
        assertThat(locks.release(lock)).isFalse();
    }
}
