package com.cvtailor.ai.service.monitoring;

import com.cvtailor.common.exception.ProviderFailureType;

import java.util.Map;

/**
 * @param successRate 1.0 when the model has no calls yet
 * @param failures    failed calls by cause
 */
public record ModelPerformance(
        String model,
        long calls,
        long successes,
        double successRate,
        double averageLatencyMs,
        long inputTokens,
        long outputTokens,
        double totalCostUsd,
        double averageCostUsd,
        Map<ProviderFailureType, Long> failures
) {
    public ModelPerformance {
        failures = Map.copyOf(failures);
    }
}
