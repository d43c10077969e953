package com.conveyor.orchestrator.debug;

import com.conveyor.orchestrator.auth.InvalidTokenException;
import com.conveyor.orchestrator.auth.Tokens;
import com.conveyor.orchestrator.event.DebugResumedEvent;
import com.conveyor.orchestrator.event.RunCancelRequestedEvent;
import com.conveyor.orchestrator.event.StateChangeEvent;
import com.conveyor.orchestrator.model.DebugSession;
import com.conveyor.orchestrator.model.PipelineRun;
import com.conveyor.orchestrator.repository.DebugSessionRepository;
import com.conveyor.orchestrator.service.NotFoundException;
import com.conveyor.orchestrator.service.PipelineRunService;
import com.conveyor.orchestrator.statemachine.DebugState;
import com.conveyor.orchestrator.statemachine.DebugStateMachine;
import com.conveyor.orchestrator.statemachine.PipelineRunState;
import com.conveyor.orchestrator.statemachine.PreconditionViolationException;
import com.conveyor.orchestrator.statemachine.StateMachineStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Debug re-runs: a failed or cancelled run is started again with
 * breakpoints, and pauses before each breakpointed step until a user
 * resumes or aborts it from the CLI or UI.
 *
 * The session ends at the first resume; later breakpoints of the same
 * session do not fire again.
 */
@Service
public class DebugSessionService {

    private static final Logger log = LoggerFactory.getLogger(DebugSessionService.class);

    private static final Set<PipelineRunState> RERUNNABLE =
            EnumSet.of(PipelineRunState.FAILED, PipelineRunState.CANCELLED);
    private static final Set<DebugState> PAUSED =
            EnumSet.of(DebugState.WAITING_AT_BP, DebugState.CONNECTED);
    private static final Set<DebugState> ACTIVE =
            EnumSet.of(DebugState.PENDING, DebugState.WAITING_AT_BP, DebugState.CONNECTED);

    private static final TypeReference<List<Integer>> BREAKPOINTS = new TypeReference<>() {};

    private final DebugSessionRepository    sessionRepo;
    private final PipelineRunService        runs;
    private final StateMachineStore         machines;
    private final ObjectMapper              json;
    private final ApplicationEventPublisher events;
    private final Clock                     clock;
    private final int                       defaultTimeoutSeconds;
    private final int                       maxTimeoutSeconds;

    public DebugSessionService(DebugSessionRepository sessionRepo,
                               PipelineRunService runs,
                               StateMachineStore machines,
                               ObjectMapper objectMapper,
                               ApplicationEventPublisher events,
                               Clock clock,
                               @Value("${conveyor.debug.default-timeout-seconds:3600}") int defaultTimeoutSeconds,
                               @Value("${conveyor.debug.max-timeout-seconds:14400}") int maxTimeoutSeconds) {
        this.sessionRepo           = sessionRepo;
        this.runs                  = runs;
        this.machines              = machines;
        this.json                  = objectMapper;
        this.events                = events;
        this.clock                 = clock;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        this.maxTimeoutSeconds     = maxTimeoutSeconds;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Re-run {@code originalRunId} with breakpoints before the given step
     * indices.
     *
     * @throws IllegalArgumentException the run is not FAILED or CANCELLED, or a breakpoint is out of range
     */
    @Transactional
    public DebugRerun create(UUID originalRunId, Collection<Integer> breakpoints) {
        PipelineRun original = runs.get(originalRunId);
        if (!RERUNNABLE.contains(original.getStatus())) {
            throw new IllegalArgumentException("Can only debug re-run failed or cancelled runs; run "
                    + originalRunId + " is " + original.getStatus());
        }
        SortedSet<Integer> points = new TreeSet<>(breakpoints == null ? List.of() : breakpoints);
        for (int index : points) {
            if (index < 0 || index >= original.getStepsTotal()) {
                throw new IllegalArgumentException("Breakpoint " + index + " out of range for "
                        + original.getStepsTotal() + " steps");
            }
        }

        PipelineRun run = runs.rerun(originalRunId);
        String token = Tokens.generate();
        DebugSession session = new DebugSession(run.getId(), originalRunId, write(points),
                Tokens.hash(token), defaultTimeoutSeconds, maxTimeoutSeconds, clock.instant());
        session.setCommitSha(original.getTriggerRef());
        DebugSession saved = save(new DebugStateMachine(clock), session);
        log.info("Debug session {} created for re-run {} of {} (breakpoints {})",
                saved.getId(), run.getId(), originalRunId, points);
        return new DebugRerun(saved, run, token);
    }

    // ------------------------------------------------------------------
    // Execution hooks
    // ------------------------------------------------------------------

    /**
     * Called before step {@code index} of a run is dispatched. If the run's
     * session has a breakpoint there, the session moves to WAITING_AT_BP and
     * the caller must not dispatch the step.
     */
    @Transactional
    public boolean pauseAtBreakpoint(UUID runId, int index, String stepName) {
        Optional<DebugSession> found = sessionRepo.findFirstByPipelineRunIdAndStatusIn(
                runId, EnumSet.of(DebugState.PENDING));
        if (found.isEmpty() || !read(found.get().getBreakpoints()).contains(index)) {
            return false;
        }
        DebugSession session = lock(found.get().getId());
        DebugStateMachine machine = machines.load(session);
        machine.transition(DebugState.WAITING_AT_BP, "Breakpoint at step " + index);
        Instant now = clock.instant();
        session.setCurrentStepIndex(index);
        session.setCurrentStepName(stepName);
        session.setBreakpointHitAt(now);
        session.setExpiresAt(now.plusSeconds(session.getTimeoutSeconds()));
        save(machine, session);
        log.info("Run {} paused before step {} '{}' (debug session {})", runId, index, stepName, session.getId());
        return true;
    }

    /** The debugged run reached a terminal state; end its session if still open. */
    @Transactional
    public void onRunFinished(UUID runId) {
        sessionRepo.findFirstByPipelineRunIdAndStatusIn(runId, ACTIVE).ifPresent(s -> {
            DebugSession session = lock(s.getId());
            DebugStateMachine machine = machines.load(session);
            if (machine.isActive()) {
                machine.transition(DebugState.ENDED, "Pipeline run finished");
                session.setEndedAt(clock.instant());
                save(machine, session);
            }
        });
    }

    // ------------------------------------------------------------------
    // User actions
    // ------------------------------------------------------------------

    /**
     * The CLI attached to the paused step.
     *
     * @throws InvalidTokenException the token does not belong to this session
     */
    @Transactional
    public DebugSession connect(UUID sessionId, String token) {
        DebugSession session = lock(sessionId);
        if (!Tokens.matches(token, session.getTokenHash())) {
            throw new InvalidTokenException("Invalid token for debug session " + sessionId);
        }
        DebugStateMachine machine = machines.load(session);
        machine.transition(DebugState.CONNECTED, "CLI connected");
        session.setConnectedAt(clock.instant());
        return save(machine, session);
    }

    @Transactional
    public DebugSession disconnect(UUID sessionId) {
        DebugSession session = lock(sessionId);
        DebugStateMachine machine = machines.load(session);
        machine.transition(DebugState.WAITING_AT_BP, "CLI disconnected");
        return save(machine, session);
    }

    /**
     * End the session and let the run continue with the step it paused at.
     *
     * @throws PreconditionViolationException the session is not paused at a breakpoint
     */
    @Transactional
    public DebugSession resume(UUID sessionId) {
        DebugSession session = lock(sessionId);
        if (!PAUSED.contains(session.getStatus())) {
            throw new PreconditionViolationException("Can only resume a session paused at a breakpoint, session "
                    + sessionId + " is " + session.getStatus());
        }
        DebugStateMachine machine = machines.load(session);
        machine.transition(DebugState.ENDED, "User resumed");
        session.setEndedAt(clock.instant());
        DebugSession saved = save(machine, session);
        events.publishEvent(new DebugResumedEvent(saved.getPipelineRunId(), saved.getCurrentStepIndex()));
        log.info("Debug session {} resumed at step {}", sessionId, saved.getCurrentStepIndex());
        return saved;
    }

    /** End the session and cancel the run. */
    @Transactional
    public DebugSession abort(UUID sessionId) {
        DebugSession session = lock(sessionId);
        DebugStateMachine machine = machines.load(session);
        machine.transition(DebugState.ENDED, "User aborted");
        session.setEndedAt(clock.instant());
        DebugSession saved = save(machine, session);
        events.publishEvent(new RunCancelRequestedEvent(saved.getPipelineRunId(), "Debug session aborted"));
        log.info("Debug session {} aborted", sessionId);
        return saved;
    }

    /**
     * Push the expiry back by {@code additionalSeconds}, never past
     * {@code created_at + max_timeout}.
     *
     * @throws IllegalArgumentException the extension would exceed the maximum
     */
    @Transactional
    public DebugSession extend(UUID sessionId, int additionalSeconds) {
        if (additionalSeconds <= 0) {
            throw new IllegalArgumentException("additionalSeconds must be positive");
        }
        DebugSession session = lock(sessionId);
        if (!ACTIVE.contains(session.getStatus())) {
            throw new PreconditionViolationException("Debug session " + sessionId + " is " + session.getStatus());
        }
        Instant newExpiry = session.getExpiresAt().plusSeconds(additionalSeconds);
        Instant maxExpiry = session.getCreatedAt().plusSeconds(session.getMaxTimeoutSeconds());
        if (newExpiry.isAfter(maxExpiry)) {
            throw new IllegalArgumentException("Cannot extend beyond the maximum of "
                    + session.getMaxTimeoutSeconds() / 3600 + " hours");
        }
        session.setExpiresAt(newExpiry);
        return sessionRepo.save(session);
    }

    /**
     * Time out paused sessions past their expiry and cancel their runs.
     * Returns the ids of the sessions timed out.
     */
    @Transactional
    public List<UUID> checkTimeouts() {
        List<UUID> timedOut = new ArrayList<>();
        for (DebugSession expired : sessionRepo.findByStatusInAndExpiresAtBefore(PAUSED, clock.instant())) {
            DebugSession session = lock(expired.getId());
            DebugStateMachine machine = machines.load(session);
            if (!PAUSED.contains(machine.getState())) {
                continue;
            }
            machine.transition(DebugState.TIMEOUT, "Session expired");
            session.setEndedAt(clock.instant());
            save(machine, session);
            events.publishEvent(new RunCancelRequestedEvent(session.getPipelineRunId(), "Debug session timed out"));
            timedOut.add(session.getId());
        }
        if (!timedOut.isEmpty()) {
            log.warn("Timed out {} debug session(s)", timedOut.size());
        }
        return timedOut;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public DebugSession get(UUID sessionId) {
        return sessionRepo.findById(sessionId).orElseThrow(() -> NotFoundException.of("Debug session", sessionId));
    }

    public List<Integer> breakpointsOf(DebugSession session) {
        return read(session.getBreakpoints());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DebugSession lock(UUID sessionId) {
        return sessionRepo.findForUpdate(sessionId)
                .orElseThrow(() -> NotFoundException.of("Debug session", sessionId));
    }

    private DebugSession save(DebugStateMachine machine, DebugSession session) {
        machines.store(machine, session);
        DebugSession saved = sessionRepo.save(session);
        events.publishEvent(new StateChangeEvent("debug_session", String.valueOf(saved.getId()),
                saved.getStatus().name(), clock.instant()));
        return saved;
    }

    private List<Integer> read(String breakpoints) {
        try {
            return json.readValue(breakpoints, BREAKPOINTS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable breakpoints: " + breakpoints, e);
        }
    }

    private String write(Collection<Integer> breakpoints) {
        try {
            return json.writeValueAsString(breakpoints);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable breakpoints", e);
        }
    }
}
