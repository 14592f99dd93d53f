package com.cvtailor.ai.service.monitoring;

import java.time.Instant;
import java.util.Map;

/**
 * @param costShareByModel percentage of {@code totalCostUsd} per model, highest spender first
 */
public record CostAnalysis(
        Instant since,
        Instant asOf,
        long totalCalls,
        double totalCostUsd,
        double averageCostUsd,
        Map<String, Double> costShareByModel
) {
}
