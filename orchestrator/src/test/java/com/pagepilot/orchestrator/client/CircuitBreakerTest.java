package com.pagepilot.orchestrator.client;

import com.pagepilot.orchestrator.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    MutableClock        clock;
    SimpleMeterRegistry meters;
    CircuitBreaker      breaker;

    @BeforeEach
    void setUp() {
        clock   = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
        meters  = new SimpleMeterRegistry();
        breaker = new CircuitBreaker(PlanningClientProperties.defaults(), clock, meters);
    }

    void fail(int times) {
        for (int i = 0; i < times; i++) breaker.recordFailure();
    }

    @Test
    void belowThreshold_staysClosed() {
        fail(2);

        assertThatCode(breaker::checkAvailable).doesNotThrowAnyException();
        assertThat(breaker.state().consecutiveFailures()).isEqualTo(2);
        assertThat(breaker.state().open()).isFalse();
    }

    @Test
    void atThreshold_opensAndRejectsWithRemainingSeconds() {
        fail(3);
        clock.advance(Duration.ofSeconds(60).plusMillis(200));

        assertThatThrownBy(breaker::checkAvailable)
                .isInstanceOf(PlanningUnavailableException.class)
                .hasMessage("Agent server temporarily unavailable. Please try again in 240 seconds.")
                .extracting(e -> ((PlanningUnavailableException) e).getReason())
                .isEqualTo(PlanningUnavailableException.Reason.CIRCUIT_OPEN);
        assertThat(meters.counter("pagepilot.planning.breaker.opened").count()).isEqualTo(1.0);
    }

    @Test
    void remainingSecondsRoundUp() {
        fail(3);
        clock.advance(Duration.ofMinutes(5).minusMillis(1));

        assertThatThrownBy(breaker::checkAvailable).hasMessageContaining("try again in 1 seconds");
    }

    @Test
    void exactlyAtCooldown_stillOpen() {
        fail(3);
        clock.advance(Duration.ofMinutes(5));

        assertThatThrownBy(breaker::checkAvailable).isInstanceOf(PlanningUnavailableException.class);
    }

    @Test
    void afterCooldown_closesAndResetsCounter() {
        fail(3);
        clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        assertThatCode(breaker::checkAvailable).doesNotThrowAnyException();
        assertThat(breaker.state().open()).isFalse();
        assertThat(breaker.state().consecutiveFailures()).isZero();
    }

    @Test
    void cooldownCountsFromLastFailure() {
        fail(3);
        clock.advance(Duration.ofMinutes(4));
        breaker.recordFailure();
        clock.advance(Duration.ofMinutes(2));

        assertThatThrownBy(breaker::checkAvailable).isInstanceOf(PlanningUnavailableException.class);
    }

    @Test
    void success_resetsEverything() {
        fail(3);

        breaker.recordSuccess();

        assertThatCode(breaker::checkAvailable).doesNotThrowAnyException();
        assertThat(breaker.state().consecutiveFailures()).isZero();
    }

    @Test
    void state_exposesConfiguration() {
        CircuitBreakerState state = breaker.state();

        assertThat(state.failureThreshold()).isEqualTo(3);
        assertThat(state.cooldownDuration()).isEqualTo(Duration.ofMinutes(5));
        assertThat(state.lastFailureTime()).isNull();
    }
}
