package com.conveyor.orchestrator.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Per-attempt bearer tokens for the in-container control script.
 *
 * A token is issued when an attempt is dispatched and revoked when it
 * settles. Tokens live in memory only: after a restart, requeued attempts
 * are dispatched again and get fresh ones.
 */
@Service
public class StepTokenService {

    private static final Logger log = LoggerFactory.getLogger(StepTokenService.class);

    record IssuedToken(String executionKey, Instant expiresAt) {}

    // sha256(token) -> issued token
    private final Map<String, IssuedToken> tokens = new ConcurrentHashMap<>();

    private final Clock    clock;
    private final Duration ttl;

    public StepTokenService(Clock clock,
                            @Value("${conveyor.steps.token-ttl:PT24H}") Duration ttl) {
        this.clock = clock;
        this.ttl   = ttl;
    }

    /** Issue a token scoped to one execution key. */
    public String issue(String executionKey) {
        String token = Tokens.generate();
        tokens.put(Tokens.hash(token), new IssuedToken(executionKey, clock.instant().plus(ttl)));
        return token;
    }

    /**
     * The execution key a token was issued for, or empty if the token is
     * unknown, revoked or expired. An expired token is forgotten on sight.
     */
    public Optional<String> validate(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String hash = Tokens.hash(token);
        IssuedToken issued = tokens.get(hash);
        if (issued == null) {
            return Optional.empty();
        }
        if (!issued.expiresAt().isAfter(clock.instant())) {
            tokens.remove(hash, issued);
            return Optional.empty();
        }
        return Optional.of(issued.executionKey());
    }

    /** Revoke every token of an execution key; returns how many. */
    public int revoke(String executionKey) {
        return removeWhere(t -> t.executionKey().equals(executionKey));
    }

    public int cleanupExpired() {
        Instant now = clock.instant();
        int removed = removeWhere(t -> !t.expiresAt().isAfter(now));
        if (removed > 0) {
            log.info("Removed {} expired step tokens", removed);
        }
        return removed;
    }

    private int removeWhere(Predicate<IssuedToken> condition) {
        int removed = 0;
        Iterator<IssuedToken> it = tokens.values().iterator();
        while (it.hasNext()) {
            if (condition.test(it.next())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    int size() {
        return tokens.size();
    }
}
