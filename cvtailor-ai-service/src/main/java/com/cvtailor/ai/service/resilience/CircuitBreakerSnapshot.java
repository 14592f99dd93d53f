package com.cvtailor.ai.service.resilience;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of one breaker, for status reporting.
 */
public record CircuitBreakerSnapshot(
        String model,
        CircuitState state,
        int failureCount,
        int failureThreshold,
        Instant lastFailureTime,
        Instant openedAt,
        Duration timeUntilRetry,
        boolean callPermitted
) {
    public boolean isHealthy() {
        return state == CircuitState.CLOSED && failureCount == 0;
    }

    public boolean isDegraded() {
        return state == CircuitState.HALF_OPEN || (state == CircuitState.CLOSED && failureCount > 0);
    }
}
