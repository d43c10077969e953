package com.conveyor.orchestrator.api;

import com.conveyor.orchestrator.auth.InvalidTokenException;
import com.conveyor.orchestrator.routing.RoutingException;
import com.conveyor.orchestrator.runner.protocol.ProtocolException;
import com.conveyor.orchestrator.service.NotFoundException;
import com.conveyor.orchestrator.statemachine.InvalidTransitionException;
import com.conveyor.orchestrator.statemachine.PreconditionViolationException;
import com.conveyor.orchestrator.workspace.LockTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/** Maps domain exceptions to HTTP statuses with an {@code {"error": ...}} body. */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(NotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({InvalidTransitionException.class, PreconditionViolationException.class})
    public ResponseEntity<Map<String, String>> handleConflict(RuntimeException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(LockTimeoutException.class)
    public ResponseEntity<Map<String, String>> handleLockTimeout(LockTimeoutException e) {
        log.warn("Request gave up waiting for a workspace lock: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(RoutingException.class)
    public ResponseEntity<Map<String, String>> handleRouting(RoutingException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler({IllegalArgumentException.class, ProtocolException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<Map<String, String>> handleInvalidToken(InvalidTokenException e) {
        return error(HttpStatus.FORBIDDEN, e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : status.getReasonPhrase();
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
