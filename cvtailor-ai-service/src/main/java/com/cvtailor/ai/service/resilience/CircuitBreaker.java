package com.cvtailor.ai.service.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Failure-tracking state machine guarding calls to one model.
 *
 * <pre>
 * CLOSED --(threshold failures inside the rolling window)--> OPEN
 * OPEN --(cooldown elapsed, next allow())--> HALF_OPEN
 * HALF_OPEN --(trial success)--> CLOSED
 * HALF_OPEN --(trial failure)--> OPEN
 * </pre>
 *
 * All transitions run under this instance's monitor, so breakers for
 * different models never contend. A call rejected by {@link #allow()} is not a
 * failure.
 */
@Slf4j
public class CircuitBreaker {

    private final String model;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Duration rollingWindow;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private final Deque<Instant> recentFailures = new ArrayDeque<>();
    private int failureCount;
    private Instant lastFailureTime;
    private Instant openedAt;
    private boolean trialInFlight;

    public CircuitBreaker(String model, int failureThreshold, Duration cooldown, Duration rollingWindow,
            Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1");
        }
        this.model = model;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.rollingWindow = rollingWindow;
        this.clock = clock;
    }

    /**
     * Claims permission for one call. In HALF_OPEN only the first caller gets
     * through; everybody else is rejected until the trial call reports back.
     */
    public synchronized boolean allow() {
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> {
                if (!cooldownElapsed()) {
                    yield false;
                }
                state = CircuitState.HALF_OPEN;
                trialInFlight = true;
                log.info("Circuit breaker for {} is now HALF_OPEN, sending one trial call", model);
                yield true;
            }
            case HALF_OPEN -> {
                if (trialInFlight) {
                    yield false;
                }
                trialInFlight = true;
                yield true;
            }
        };
    }

    /**
     * Same answer {@link #allow()} would give, without claiming the half-open
     * trial call. Used for filtering candidates.
     */
    public synchronized boolean isCallPermitted() {
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> cooldownElapsed();
            case HALF_OPEN -> !trialInFlight;
        };
    }

    public synchronized void recordSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            state = CircuitState.CLOSED;
            failureCount = 0;
            recentFailures.clear();
            openedAt = null;
            trialInFlight = false;
            log.info("Circuit breaker for {}: trial call succeeded, back to CLOSED", model);
        }
        // CLOSED: no-op. OPEN: a late success from a call dispatched before opening; the trial call decides.
    }

    public synchronized void recordFailure() {
        Instant now = clock.instant();
        failureCount++;
        lastFailureTime = now;

        switch (state) {
            case HALF_OPEN -> {
                open(now);
                log.warn("Circuit breaker for {}: trial call failed, back to OPEN", model);
            }
            case CLOSED -> {
                recentFailures.addLast(now);
                pruneWindow(now);
                if (recentFailures.size() >= failureThreshold) {
                    open(now);
                    log.warn("Circuit breaker for {} is now OPEN after {} failures", model, failureCount);
                } else {
                    log.debug("Circuit breaker for {}: recorded failure ({}/{})", model,
                            recentFailures.size(), failureThreshold);
                }
            }
            case OPEN -> log.debug("Circuit breaker for {}: late failure while OPEN", model);
        }
    }

    /**
     * Administrative reset. Clears the failure history; an OPEN breaker goes to
     * HALF_OPEN so the next call is tried immediately instead of waiting out the
     * cooldown.
     */
    public synchronized void reset() {
        failureCount = 0;
        recentFailures.clear();
        if (state == CircuitState.OPEN) {
            state = CircuitState.HALF_OPEN;
            trialInFlight = false;
        }
        log.info("Circuit breaker for {} manually reset (state {})", model, state);
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        Instant now = clock.instant();
        Duration untilRetry = Duration.ZERO;
        if (state == CircuitState.OPEN && openedAt != null) {
            Duration elapsed = Duration.between(openedAt, now);
            untilRetry = elapsed.compareTo(cooldown) >= 0 ? Duration.ZERO : cooldown.minus(elapsed);
        }
        return new CircuitBreakerSnapshot(model, state, failureCount, failureThreshold,
                lastFailureTime, openedAt, untilRetry, isCallPermitted());
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public String getModel() {
        return model;
    }

    private void open(Instant now) {
        state = CircuitState.OPEN;
        openedAt = now;
        trialInFlight = false;
        recentFailures.clear();
    }

    private boolean cooldownElapsed() {
        return openedAt == null || !clock.instant().isBefore(openedAt.plus(cooldown));
    }

    private void pruneWindow(Instant now) {
        Instant cutoff = now.minus(rollingWindow);
        while (!recentFailures.isEmpty() && recentFailures.peekFirst().isBefore(cutoff)) {
            recentFailures.pollFirst();
        }
    }
}
