package com.cvtailor.ai.service.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link CircuitBreaker} per model. Breakers are created lazily on
 * first use and live for the rest of the process.
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration cooldown;
    private final Duration rollingWindow;
    private final Clock clock;

    public CircuitBreakerRegistry(int failureThreshold, Duration cooldown, Duration rollingWindow, Clock clock) {
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.rollingWindow = rollingWindow;
        this.clock = clock;
    }

    public CircuitBreaker forModel(String model) {
        return breakers.computeIfAbsent(model,
                name -> new CircuitBreaker(name, failureThreshold, cooldown, rollingWindow, clock));
    }

    /**
     * Status of one model. Models never used report a fresh CLOSED breaker.
     */
    public CircuitBreakerSnapshot snapshot(String model) {
        CircuitBreaker breaker = breakers.get(model);
        if (breaker == null) {
            return new CircuitBreakerSnapshot(model, CircuitState.CLOSED, 0, failureThreshold,
                    null, null, Duration.ZERO, true);
        }
        return breaker.snapshot();
    }

    public List<CircuitBreakerSnapshot> snapshots() {
        return breakers.values().stream()
                .map(CircuitBreaker::snapshot)
                .sorted(Comparator.comparing(CircuitBreakerSnapshot::model))
                .toList();
    }

    public boolean reset(String model) {
        Optional<CircuitBreaker> breaker = Optional.ofNullable(breakers.get(model));
        if (breaker.isEmpty()) {
            log.warn("No circuit breaker found for {} to reset", model);
            return false;
        }
        breaker.get().reset();
        return true;
    }

    public HealthSummary healthSummary() {
        List<CircuitBreakerSnapshot> all = snapshots();
        int total = all.size();
        int healthy = (int) all.stream().filter(CircuitBreakerSnapshot::isHealthy).count();
        int degraded = (int) all.stream().filter(CircuitBreakerSnapshot::isDegraded).count();
        int down = (int) all.stream().filter(s -> s.state() == CircuitState.OPEN).count();

        double score = total == 0 ? 1.0 : (healthy + degraded * 0.5) / total;
        String status;
        if (score >= 0.9) {
            status = "healthy";
        } else if (score >= 0.7) {
            status = "degraded";
        } else if (score >= 0.5) {
            status = "unstable";
        } else {
            status = "critical";
        }

        List<String> available = all.stream()
                .filter(CircuitBreakerSnapshot::callPermitted)
                .map(CircuitBreakerSnapshot::model)
                .toList();

        return new HealthSummary(status, Math.round(score * 1000) / 1000.0, total, healthy, degraded, down,
                available);
    }
}
