package com.conveyor.orchestrator.runner;

import com.conveyor.orchestrator.execution.StepExecutionService;
import com.conveyor.orchestrator.recovery.JobRecoveryService;
import com.conveyor.orchestrator.recovery.ReconnectAction;
import com.conveyor.orchestrator.runner.protocol.ProtocolException;
import com.conveyor.orchestrator.runner.protocol.RunnerMessage;
import com.conveyor.orchestrator.runner.protocol.RunnerProtocol;
import com.conveyor.orchestrator.service.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Websocket endpoint for remote runners.
 *
 * A new connection must send {@code register} within
 * {@link RunnerProtocol#REGISTRATION_TIMEOUT} or it is closed with 4000.
 * Anything else before registration, or a malformed registration, closes
 * it with 4001. After registration every message is validated by
 * {@link RunnerProtocol#parse}; bad messages get an {@code error} reply.
 *
 * A dropped connection only marks the runner offline. If it does not come
 * back before the death timeout the runner monitor requeues its work.
 */
@Component
public class RunnerSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RunnerSocketHandler.class);

    static final String RUNNER_ID_ATTR = "runnerId";

    private final RunnerProtocol           protocol;
    private final RunnerRegistry           registry;
    private final RunnerConnections        connections;
    private final RemoteStepExecutor       remote;
    private final JobRecoveryService       recovery;
    private final StepExecutionService     executions;
    private final ScheduledExecutorService timers;

    private final Map<String, ScheduledFuture<?>> registrationTimers = new ConcurrentHashMap<>();

    public RunnerSocketHandler(RunnerProtocol protocol,
                               RunnerRegistry registry,
                               RunnerConnections connections,
                               RemoteStepExecutor remote,
                               JobRecoveryService recovery,
                               StepExecutionService executions,
                               ScheduledExecutorService timers) {
        this.protocol    = protocol;
        this.registry    = registry;
        this.connections = connections;
        this.remote      = remote;
        this.recovery    = recovery;
        this.executions  = executions;
        this.timers      = timers;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        log.debug("Runner connection opened: session={} remote={}", session.getId(), session.getRemoteAddress());
        ScheduledFuture<?> timer = timers.schedule(() -> {
            if (runnerId(session) == null) {
                log.warn("Runner session {} did not register within {}s",
                        session.getId(), RunnerProtocol.REGISTRATION_TIMEOUT.toSeconds());
                RunnerConnections.closeQuietly(session,
                        new CloseStatus(RunnerConnections.REGISTRATION_TIMEOUT, "registration timeout"));
            }
        }, RunnerProtocol.REGISTRATION_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        registrationTimers.put(session.getId(), timer);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String runnerId = runnerId(session);
        RunnerMessage msg;
        try {
            msg = protocol.parse(message.getPayload());
        } catch (ProtocolException e) {
            if (runnerId == null) {
                rejectRegistration(session, e.getMessage());
            } else {
                log.warn("Bad message from runner {}: {}", runnerId, e.getMessage());
                connections.send(runnerId, protocol.error(e.getMessage()));
            }
            return;
        }

        if (runnerId == null) {
            if (msg instanceof RunnerMessage.Register register) {
                onRegister(session, register);
            } else {
                rejectRegistration(session, "first message must be register");
            }
            return;
        }

        try {
            dispatch(session, runnerId, msg);
        } catch (NotFoundException | IllegalArgumentException e) {
            log.warn("Runner {} message rejected: {}", runnerId, e.getMessage());
            connections.send(runnerId, protocol.error(e.getMessage()));
        }
    }

    private void dispatch(WebSocketSession session, String runnerId, RunnerMessage msg) {
        if (msg instanceof RunnerMessage.Heartbeat) {
            if (registry.heartbeat(runnerId)) {
                connections.send(runnerId, protocol.pong());
            } else {
                RunnerConnections.closeQuietly(session,
                        new CloseStatus(RunnerConnections.INVALID_REGISTRATION, "runner not alive, register again"));
            }
        } else if (msg instanceof RunnerMessage.Ack ack) {
            remote.onAck(runnerId, ack.stepId());
        } else if (msg instanceof RunnerMessage.Log logMsg) {
            registry.appendLogs(runnerId, logMsg.lines());
            executions.appendLogs(logMsg.stepId(), logMsg.lines());
        } else if (msg instanceof RunnerMessage.StepComplete done) {
            remote.onStepComplete(runnerId, done.stepId(), done.exitCode(), done.error());
        } else if (msg instanceof RunnerMessage.Register) {
            connections.send(runnerId, protocol.error("already registered"));
        }
    }

    private void onRegister(WebSocketSession session, RunnerMessage.Register register) {
        cancelRegistrationTimer(session.getId());
        String runnerId = register.runnerId();
        registry.register(runnerId, register.name(), register.runnerType(), register.labels());
        ReconnectAction action = recovery.onRunnerReconnect(runnerId);

        session.getAttributes().put(RUNNER_ID_ATTR, runnerId);
        connections.bind(runnerId, session);
        connections.send(runnerId, protocol.registered(runnerId, action));
        log.info("Runner {} connected over websocket ({})", runnerId, action);

        if (action != ReconnectAction.CONTINUE) {
            remote.offerWork(runnerId);
        }
    }

    private void rejectRegistration(WebSocketSession session, String reason) {
        cancelRegistrationTimer(session.getId());
        log.warn("Rejected runner session {}: {}", session.getId(), reason);
        RunnerConnections.closeQuietly(session,
                new CloseStatus(RunnerConnections.INVALID_REGISTRATION, truncate(reason)));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        cancelRegistrationTimer(session.getId());
        String runnerId = runnerId(session);
        log.info("Runner connection closed: session={} runner={} code={} reason={}",
                session.getId(), runnerId, status.getCode(), status.getReason());
        if (runnerId != null && connections.unbind(runnerId, session)) {
            registry.markOffline(runnerId);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Runner session {} transport error: {}", session.getId(), exception.getMessage());
    }

    private void cancelRegistrationTimer(String sessionId) {
        ScheduledFuture<?> timer = registrationTimers.remove(sessionId);
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private static String runnerId(WebSocketSession session) {
        return (String) session.getAttributes().get(RUNNER_ID_ATTR);
    }

    // Close reasons are limited to 123 bytes.
    private static String truncate(String reason) {
        return reason.length() > 120 ? reason.substring(0, 120) : reason;
    }
}
