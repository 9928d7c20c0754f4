package com.cloudmusic.resolver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class CircuitBreakerTest {
    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        breaker = new CircuitBreaker("gdstudio", 3, Duration.ofSeconds(60), clock);
    }

    @Test
    void startsClosed() {
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(breaker.canExecute());
        assertEquals(0, breaker.getConsecutiveFailures());
    }

    @Test
    void opensAfterThresholdFailures() {
        breaker.recordFailure();
        breaker.recordFailure();
        assertTrue(breaker.canExecute());
        breaker.recordFailure();
        assertFalse(breaker.canExecute());
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(clock.instant(), breaker.getOpenedAt());
    }

    @Test
    void successBeforeThresholdResetsCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        assertTrue(breaker.canExecute());
        assertEquals(1, breaker.getConsecutiveFailures());
    }

    @Test
    void becomesHalfOpenOnlyAfterCooldown() {
        tripOpen();
        clock.advance(Duration.ofSeconds(59));
        assertFalse(breaker.canExecute());
        clock.advance(Duration.ofSeconds(1));
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertTrue(breaker.canExecute());
    }

    @Test
    void canExecuteDoesNotChangeState() {
        tripOpen();
        clock.advance(Duration.ofSeconds(61));
        assertTrue(breaker.canExecute());
        assertTrue(breaker.canExecute());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(3, breaker.getConsecutiveFailures());
    }

    @Test
    void successInHalfOpenClosesAndResets() {
        tripOpen();
        clock.advance(Duration.ofSeconds(60));
        breaker.recordSuccess();
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(breaker.canExecute());
        assertEquals(0, breaker.getConsecutiveFailures());
        assertNull(breaker.getOpenedAt());
    }

    @Test
    void failureInHalfOpenReopensWithFreshCooldown() {
        tripOpen();
        clock.advance(Duration.ofSeconds(60));
        breaker.recordFailure();
        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(clock.instant(), breaker.getOpenedAt());
        clock.advance(Duration.ofSeconds(30));
        assertFalse(breaker.canExecute());
        clock.advance(Duration.ofSeconds(30));
        assertTrue(breaker.canExecute());
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreaker("x", 0, Duration.ofSeconds(1), clock));
    }

    @Test
    void halfOpenAdmitsSingleTrialUntilOutcome() {
        tripOpen();
        assertFalse(breaker.tryAcquire());
        clock.advance(Duration.ofSeconds(60));

        assertTrue(breaker.tryAcquire());
        assertFalse(breaker.tryAcquire());
        assertTrue(breaker.canExecute());

        breaker.recordSuccess();
        assertTrue(breaker.tryAcquire());
        assertTrue(breaker.tryAcquire());
    }

    @Test
    void releasedTrialCanBeRetaken() {
        tripOpen();
        clock.advance(Duration.ofSeconds(60));
        assertTrue(breaker.tryAcquire());

        breaker.releaseTrial();

        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(3, breaker.getConsecutiveFailures());
        assertTrue(breaker.tryAcquire());
    }

    @Test
    void failedTrialReopensAndFreesNextTrialAfterCooldown() {
        tripOpen();
        clock.advance(Duration.ofSeconds(60));
        assertTrue(breaker.tryAcquire());

        breaker.recordFailure();
        assertFalse(breaker.tryAcquire());

        clock.advance(Duration.ofSeconds(60));
        assertTrue(breaker.tryAcquire());
    }

    private void tripOpen() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        assertEquals(CircuitState.OPEN, breaker.getState());
    }
}
