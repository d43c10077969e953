package com.conveyor.orchestrator.runner;

import com.conveyor.orchestrator.event.StateChangeEvent;
import com.conveyor.orchestrator.model.Runner;
import com.conveyor.orchestrator.model.RunnerStatus;
import com.conveyor.orchestrator.repository.RunnerRepository;
import com.conveyor.orchestrator.routing.RunnerLabels;
import com.conveyor.orchestrator.service.NotFoundException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered remote runners.
 *
 * Runner rows are the source of truth for status and assignment. The
 * per-runner log buffer is in memory only and bounded; it is a convenience
 * for operators, not a record.
 */
@Service
public class RunnerRegistry {

    private static final Logger log = LoggerFactory.getLogger(RunnerRegistry.class);

    // Offline runners are still watched: they may reconnect before the death timeout.
    static final EnumSet<RunnerStatus> MONITORED =
            EnumSet.of(RunnerStatus.IDLE, RunnerStatus.BUSY, RunnerStatus.OFFLINE);

    private final RunnerRepository          runnerRepo;
    private final ObjectMapper              json;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;
    private final int                       logBufferLines;

    private final Map<String, Deque<String>> logBuffers = new ConcurrentHashMap<>();

    public RunnerRegistry(RunnerRepository runnerRepo,
                          ObjectMapper objectMapper,
                          ApplicationEventPublisher events,
                          Clock clock,
                          @Value("${conveyor.runner.log-buffer-lines:1000}") int logBufferLines) {
        this.runnerRepo     = runnerRepo;
        this.json           = objectMapper;
        this.events         = events;
        this.clock          = clock;
        this.logBufferLines = logBufferLines;
    }

    // ------------------------------------------------------------------
    // Registration and liveness
    // ------------------------------------------------------------------

    /**
     * Register a runner. A runner that comes back with an id it used before
     * gets its existing row back with the new name and labels, and keeps any
     * step reference so reconnect handling can decide what to do with it.
     *
     * @param runnerId client-chosen id, or null to have one generated
     */
    @Transactional
    public Runner register(String runnerId, String name, String runnerType, RunnerLabels labels) {
        String id   = runnerId == null || runnerId.isBlank() ? UUID.randomUUID().toString() : runnerId;
        String type = runnerType == null || runnerType.isBlank() ? "any" : runnerType;
        Instant now = clock.instant();

        Optional<Runner> existing = runnerRepo.findForUpdate(id);
        Runner runner;
        if (existing.isPresent()) {
            runner = existing.get();
            runner.setName(name == null || name.isBlank() ? runner.getName() : name);
            runner.setRunnerType(type);
            runner.setLabels(writeLabels(labels));
            runner.setConnectedAt(now);
            runner.setLastHeartbeatAt(now);
            runner.setStatus(runner.getCurrentStepExecutionId() != null ? RunnerStatus.BUSY : RunnerStatus.IDLE);
            log.info("Runner {} re-registered as '{}'", id, runner.getName());
        } else {
            runner = new Runner(id, name == null || name.isBlank() ? id : name, type, writeLabels(labels), now);
            log.info("Runner {} registered as '{}' (type={}, labels={})", id, runner.getName(), type, labels);
        }
        return save(runner);
    }

    /**
     * Record a heartbeat. Returns false for an unknown runner or one already
     * declared dead or offline; such a runner has to register again.
     */
    @Transactional
    public boolean heartbeat(String runnerId) {
        Optional<Runner> found = runnerRepo.findForUpdate(runnerId);
        if (found.isEmpty() || !found.get().getStatus().isAlive()) {
            return false;
        }
        Runner runner = found.get();
        runner.setLastHeartbeatAt(clock.instant());
        runnerRepo.save(runner);
        return true;
    }

    /** Mark the runner busy with one step execution. */
    @Transactional
    public Runner assign(String runnerId, UUID stepExecutionId) {
        Runner runner = lock(runnerId);
        runner.setStatus(RunnerStatus.BUSY);
        runner.setCurrentStepExecutionId(stepExecutionId);
        return save(runner);
    }

    /** The runner finished its step; it may take new work. */
    @Transactional
    public Runner markIdle(String runnerId) {
        Runner runner = lock(runnerId);
        runner.setCurrentStepExecutionId(null);
        if (runner.getStatus().isAlive()) {
            runner.setStatus(RunnerStatus.IDLE);
        }
        return save(runner);
    }

    /**
     * The runner disconnected. Its step reference is kept; recovery decides
     * whether to requeue it.
     */
    @Transactional
    public void markOffline(String runnerId) {
        runnerRepo.findForUpdate(runnerId).ifPresent(runner -> {
            if (runner.getStatus().isAlive()) {
                runner.setStatus(RunnerStatus.OFFLINE);
                save(runner);
                log.info("Runner {} went offline", runnerId);
            }
        });
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public Optional<Runner> find(String runnerId) {
        return runnerRepo.findById(runnerId);
    }

    @Transactional(readOnly = true)
    public List<Runner> list() {
        return runnerRepo.findAll();
    }

    /** Alive or offline runners whose last heartbeat is older than {@code cutoff}. */
    @Transactional(readOnly = true)
    public List<Runner> findStale(Instant cutoff) {
        return runnerRepo.findByStatusInAndLastHeartbeatAtBefore(MONITORED, cutoff);
    }

    public RunnerLabels labelsOf(Runner runner) {
        if (runner.getLabels() == null || runner.getLabels().isBlank()) {
            return RunnerLabels.none();
        }
        try {
            return json.readValue(runner.getLabels(), RunnerLabels.class);
        } catch (JsonProcessingException e) {
            log.warn("Runner {} has unreadable labels, treating as none: {}", runner.getId(), e.getOriginalMessage());
            return RunnerLabels.none();
        }
    }

    // ------------------------------------------------------------------
    // Log buffer
    // ------------------------------------------------------------------

    /** Append lines, dropping the oldest beyond the buffer size. */
    public void appendLogs(String runnerId, List<String> lines) {
        Deque<String> buffer = logBuffers.computeIfAbsent(runnerId, k -> new ArrayDeque<>());
        synchronized (buffer) {
            for (String line : lines) {
                buffer.addLast(line);
                while (buffer.size() > logBufferLines) {
                    buffer.removeFirst();
                }
            }
        }
    }

    public List<String> logs(String runnerId) {
        Deque<String> buffer = logBuffers.get(runnerId);
        if (buffer == null) {
            return List.of();
        }
        synchronized (buffer) {
            return List.copyOf(buffer);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Runner lock(String runnerId) {
        return runnerRepo.findForUpdate(runnerId)
                .orElseThrow(() -> NotFoundException.of("Runner", runnerId));
    }

    private Runner save(Runner runner) {
        Runner saved = runnerRepo.save(runner);
        events.publishEvent(new StateChangeEvent("runner", saved.getId(),
                saved.getStatus().name(), clock.instant()));
        return saved;
    }

    private String writeLabels(RunnerLabels labels) {
        try {
            return json.writeValueAsString(labels == null ? RunnerLabels.none() : labels);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable runner labels", e);
        }
    }
}
