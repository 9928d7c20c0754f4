package com.cloudmusic.resolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Availability guard for a provider that tends to rate-limit or block under load.
 * <p>
 * State machine:
 * <ul>
 *   <li>CLOSED: calls permitted; each failure increments the consecutive failure count and reaching the
 *       threshold opens the circuit.</li>
 *   <li>OPEN: calls rejected until the cooldown has elapsed since {@code openedAt}; from then on the breaker
 *       reports HALF_OPEN.</li>
 *   <li>HALF_OPEN: a trial call is permitted; success closes the circuit and resets the counters, failure
 *       reopens it with a fresh {@code openedAt}.</li>
 * </ul>
 * {@link #canExecute()} and {@link #getState()} never change state: the OPEN to HALF_OPEN step is derived
 * from the clock. {@link #recordSuccess()} and {@link #recordFailure()} record completed attempts. Callers that
 * are about to make a call go through {@link #tryAcquire()}, which admits a single trial in HALF_OPEN until
 * that trial records an outcome or is released with {@link #releaseTrial()}. Every method is synchronized, so
 * each read-then-write runs as one step.
 *
 * @author Music Resolver Team
 * @since 1.0
 */
public class CircuitBreaker {
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private boolean open;
    private int consecutiveFailures;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public CircuitBreaker(String name, ResolverConfig config, Clock clock) {
        this(name, config.breakerFailureThreshold(), config.breakerCooldown(), clock);
    }

    public synchronized CircuitState getState() {
        if (!open) {
            return CircuitState.CLOSED;
        }
        return cooldownElapsed() ? CircuitState.HALF_OPEN : CircuitState.OPEN;
    }

    /**
     * Pure query: true when the state is CLOSED or HALF_OPEN.
     */
    public synchronized boolean canExecute() {
        return getState() != CircuitState.OPEN;
    }

    /**
     * Admits a call: always in CLOSED, never in OPEN, and in HALF_OPEN only when no other trial is running.
     * @return true if the caller may call the provider now
     */
    public synchronized boolean tryAcquire() {
        CircuitState state = getState();
        if (state == CircuitState.CLOSED) {
            return true;
        }
        if (state == CircuitState.OPEN || trialInFlight) {
            return false;
        }
        trialInFlight = true;
        logger.debug("Admitting trial call to {}", name);
        return true;
    }

    /**
     * Gives back a trial permit whose call ended without an outcome, e.g. because it was cancelled.
     */
    public synchronized void releaseTrial() {
        trialInFlight = false;
    }

    public synchronized void recordSuccess() {
        if (open) {
            logger.info("Circuit for {} closed after successful trial call", name);
        }
        open = false;
        trialInFlight = false;
        consecutiveFailures = 0;
        openedAt = null;
    }

    public synchronized void recordFailure() {
        CircuitState state = getState();
        trialInFlight = false;
        consecutiveFailures++;
        if (state == CircuitState.HALF_OPEN) {
            openedAt = clock.instant();
            logger.warn("Trial call to {} failed; circuit reopened for {} ms", name, cooldown.toMillis());
        } else if (state == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            open = true;
            openedAt = clock.instant();
            logger.warn("Circuit for {} opened after {} consecutive failures", name, consecutiveFailures);
        }
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant getOpenedAt() {
        return openedAt;
    }

    public String getName() {
        return name;
    }

    private boolean cooldownElapsed() {
        return openedAt != null && !clock.instant().isBefore(openedAt.plus(cooldown));
    }
}
