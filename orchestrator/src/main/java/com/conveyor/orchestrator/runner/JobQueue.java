package com.conveyor.orchestrator.runner;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Process-wide queue of remote jobs.
 *
 * Two structures under one lock: a FIFO of jobs waiting for a runner, and
 * a pending map of every job not yet completed or cancelled. Dequeuing only
 * removes from the FIFO, so a job that a runner is working on can still be
 * found by id and requeued if that runner dies.
 */
@Component
public class JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    private final ReentrantLock lock     = new ReentrantLock();
    private final Condition     notEmpty = lock.newCondition();

    private final Deque<QueuedJob>     fifo    = new ArrayDeque<>();
    private final Map<UUID, QueuedJob> pending = new LinkedHashMap<>();

    public JobQueue(MeterRegistry meters) {
        Gauge.builder("conveyor.jobs.queued", this, JobQueue::size)
                .description("Remote jobs waiting for a runner")
                .register(meters);
    }

    /** Add a job. Enqueuing a job that is already waiting is a no-op. */
    public void enqueue(QueuedJob job) {
        lock.lock();
        try {
            if (pending.containsKey(job.stepExecutionId()) && contains(job.stepExecutionId())) {
                return;
            }
            pending.put(job.stepExecutionId(), job);
            fifo.addLast(job);
            notEmpty.signalAll();
            log.info("Enqueued job {} ({} waiting)", job.executionKey(), fifo.size());
        } finally {
            lock.unlock();
        }
    }

    /** Take the oldest waiting job, or null if none. Never blocks. */
    public QueuedJob dequeue() {
        lock.lock();
        try {
            return fifo.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take the oldest waiting job, waiting up to {@code timeout} for one to
     * arrive. Returns null on timeout.
     */
    public QueuedJob waitForJob(Duration timeout) throws InterruptedException {
        long remaining = Math.max(0, timeout.toNanos());
        lock.lock();
        try {
            while (fifo.isEmpty()) {
                if (remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return fifo.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /** Take the oldest waiting job that {@code matcher} accepts, or null. */
    public QueuedJob dequeueMatching(Predicate<QueuedJob> matcher) {
        lock.lock();
        try {
            Iterator<QueuedJob> it = fifo.iterator();
            while (it.hasNext()) {
                QueuedJob job = it.next();
                if (matcher.test(job)) {
                    it.remove();
                    return job;
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Put a pending job back at the head of the FIFO, e.g. after its runner
     * missed the ACK or died. Returns false if the job is unknown or already
     * waiting.
     */
    public boolean requeue(UUID stepExecutionId) {
        lock.lock();
        try {
            QueuedJob job = pending.get(stepExecutionId);
            if (job == null || contains(stepExecutionId)) {
                return false;
            }
            fifo.addFirst(job);
            notEmpty.signalAll();
            log.warn("Requeued job {}", job.executionKey());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** The job finished; forget it. */
    public Optional<QueuedJob> complete(UUID stepExecutionId) {
        return remove(stepExecutionId);
    }

    /** The job was cancelled; forget it whether or not a runner had it. */
    public Optional<QueuedJob> cancel(UUID stepExecutionId) {
        return remove(stepExecutionId);
    }

    public Optional<QueuedJob> get(UUID stepExecutionId) {
        lock.lock();
        try {
            return Optional.ofNullable(pending.get(stepExecutionId));
        } finally {
            lock.unlock();
        }
    }

    /** Jobs waiting for a runner. */
    public int size() {
        lock.lock();
        try {
            return fifo.size();
        } finally {
            lock.unlock();
        }
    }

    /** Jobs not yet completed or cancelled, waiting or in flight. */
    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public List<QueuedJob> waiting() {
        lock.lock();
        try {
            return List.copyOf(fifo);
        } finally {
            lock.unlock();
        }
    }

    public boolean isWaiting(UUID stepExecutionId) {
        lock.lock();
        try {
            return contains(stepExecutionId);
        } finally {
            lock.unlock();
        }
    }

    private Optional<QueuedJob> remove(UUID stepExecutionId) {
        lock.lock();
        try {
            QueuedJob job = pending.remove(stepExecutionId);
            fifo.removeIf(j -> j.stepExecutionId().equals(stepExecutionId));
            return Optional.ofNullable(job);
        } finally {
            lock.unlock();
        }
    }

    private boolean contains(UUID stepExecutionId) {
        for (QueuedJob j : fifo) {
            if (j.stepExecutionId().equals(stepExecutionId)) {
                return true;
            }
        }
        return false;
    }
}
