package com.conveyor.orchestrator.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Open websocket sessions of registered runners, keyed by runner id. */
@Component
public class RunnerConnections {

    private static final Logger log = LoggerFactory.getLogger(RunnerConnections.class);

    /** Close code when a runner does not register in time. */
    public static final int REGISTRATION_TIMEOUT = 4000;
    /** Close code for a malformed or rejected registration. */
    public static final int INVALID_REGISTRATION = 4001;
    /** Close code when a runner missed the ACK of an execute_step. */
    public static final int ACK_TIMEOUT          = 4002;

    private static final int SEND_TIME_LIMIT_MS  = 10_000;
    private static final int SEND_BUFFER_BYTES   = 512 * 1024;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    /**
     * Bind a runner id to a session. A runner that reconnects while its old
     * session is still open replaces it; the old one is closed.
     */
    public WebSocketSession bind(String runnerId, WebSocketSession session) {
        WebSocketSession safe = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_BYTES);
        WebSocketSession previous = sessions.put(runnerId, safe);
        if (previous != null && !previous.getId().equals(session.getId())) {
            log.info("Runner {} reconnected, closing previous session {}", runnerId, previous.getId());
            closeQuietly(previous, CloseStatus.NORMAL.withReason("replaced by new connection"));
        }
        return safe;
    }

    /**
     * Forget the runner's session if it is still {@code session}. Returns
     * false when a newer session has already replaced it.
     */
    public boolean unbind(String runnerId, WebSocketSession session) {
        WebSocketSession current = sessions.get(runnerId);
        if (current == null || !current.getId().equals(session.getId())) {
            return false;
        }
        return sessions.remove(runnerId, current);
    }

    public boolean isConnected(String runnerId) {
        WebSocketSession session = sessions.get(runnerId);
        return session != null && session.isOpen();
    }

    public Set<String> connectedRunners() {
        return Set.copyOf(sessions.keySet());
    }

    /** Send one text frame. Returns false if the runner is not connected or the send failed. */
    public boolean send(String runnerId, String payload) {
        WebSocketSession session = sessions.get(runnerId);
        if (session == null || !session.isOpen()) {
            return false;
        }
        try {
            session.sendMessage(new TextMessage(payload));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Send to runner {} failed: {}", runnerId, e.getMessage());
            return false;
        }
    }

    public void close(String runnerId, int code, String reason) {
        WebSocketSession session = sessions.get(runnerId);
        if (session != null) {
            closeQuietly(session, new CloseStatus(code, reason));
        }
    }

    static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException e) {
            log.debug("Close of session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
