package com.conveyor.orchestrator.auth;

import com.conveyor.orchestrator.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class StepTokenServiceTest {

    MutableClock clock;
    StepTokenService tokens;

    @BeforeEach
    void setUp() {
        clock  = MutableClock.at("2024-05-01T12:00:00Z");
        tokens = new StepTokenService(clock, Duration.ofHours(24));
    }

    @Test
    void issuedToken_validatesToItsExecutionKey() {
        String token = tokens.issue("run-1:0:1");

        assertThat(tokens.validate(token)).contains("run-1:0:1");
    }

    @Test
    void validate_unknownOrBlankToken_isEmpty() {
        tokens.issue("run-1:0:1");

        assertThat(tokens.validate(Tokens.generate())).isEmpty();
        assertThat(tokens.validate("")).isEmpty();
        assertThat(tokens.validate(null)).isEmpty();
    }

    @Test
    void validate_afterTtl_isEmptyAndForgotten() {
        String token = tokens.issue("run-1:0:1");
        clock.advance(Duration.ofHours(24));

        assertThat(tokens.validate(token)).isEmpty();
        assertThat(tokens.size()).isZero();
    }

    @Test
    void revoke_removesEveryTokenOfThatKeyOnly() {
        String a = tokens.issue("run-1:0:1");
        String b = tokens.issue("run-1:0:1");
        String other = tokens.issue("run-1:1:1");

        assertThat(tokens.revoke("run-1:0:1")).isEqualTo(2);
        assertThat(tokens.validate(a)).isEmpty();
        assertThat(tokens.validate(b)).isEmpty();
        assertThat(tokens.validate(other)).contains("run-1:1:1");
    }

    @Test
    void cleanupExpired_dropsOnlyExpiredTokens() {
        tokens.issue("old:0:1");
        clock.advance(Duration.ofHours(12));
        String fresh = tokens.issue("new:0:1");
        clock.advance(Duration.ofHours(13));

        assertThat(tokens.cleanupExpired()).isEqualTo(1);
        assertThat(tokens.validate(fresh)).contains("new:0:1");
    }

    @Test
    void storedForm_isHashNotToken() {
        String token = Tokens.generate();
        String hash = Tokens.hash(token);

        assertThat(token).hasSize(43).doesNotContain("=", "+", "/");
        assertThat(hash).hasSize(64).isNotEqualTo(token);
        assertThat(Tokens.matches(token, hash)).isTrue();
        assertThat(Tokens.matches(Tokens.generate(), hash)).isFalse();
        assertThat(Tokens.matches(null, hash)).isFalse();
    }
}
