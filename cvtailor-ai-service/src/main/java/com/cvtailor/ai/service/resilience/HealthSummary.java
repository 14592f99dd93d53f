package com.cvtailor.ai.service.resilience;

import java.util.List;

/**
 * Aggregate breaker health across all models seen so far.
 *
 * @param status one of healthy, degraded, unstable, critical
 * @param score  (healthy + 0.5 * degraded) / total, 1.0 when no model was used yet
 */
public record HealthSummary(
        String status,
        double score,
        int totalModels,
        int healthyModels,
        int degradedModels,
        int downModels,
        List<String> availableModels
) {
}
