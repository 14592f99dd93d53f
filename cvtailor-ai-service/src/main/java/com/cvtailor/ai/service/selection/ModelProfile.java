package com.cvtailor.ai.service.selection;

import com.cvtailor.ai.service.strategy.TokenUsage;

import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable description of one provider model, loaded from configuration at
 * startup.
 *
 * @param name              provider-side model identifier ("text-embedding-3-small")
 * @param provider          provider client key ("google", "groq", "openai")
 * @param tasks             task types this model may be selected for
 * @param inputCostPer1k    USD per 1K input tokens
 * @param outputCostPer1k   USD per 1K output tokens (0 for embedding models)
 * @param latencyClass      coarse latency bucket
 * @param qualityTier       quality bucket used by the selection strategies
 * @param dimensions        embedding dimensionality, 0 for chat models
 * @param maxInputTokens    context limit used to cap chunk sizes
 */
public record ModelProfile(
        String name,
        String provider,
        Set<TaskType> tasks,
        double inputCostPer1k,
        double outputCostPer1k,
        LatencyClass latencyClass,
        QualityTier qualityTier,
        int dimensions,
        int maxInputTokens
) {
    public ModelProfile {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Model name must not be blank");
        }
        if (inputCostPer1k < 0 || outputCostPer1k < 0) {
            throw new IllegalArgumentException("Model " + name + " has a negative price");
        }
        tasks = tasks == null || tasks.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(tasks));
    }

    public boolean supports(TaskType task) {
        return tasks.contains(task);
    }

    /**
     * Blended per-unit price used when strategies compare models.
     */
    public double unitCost() {
        return inputCostPer1k + outputCostPer1k;
    }

    public double estimateCost(int inputTokens, int outputTokens) {
        return (Math.max(0, inputTokens) / 1000.0) * inputCostPer1k
                + (Math.max(0, outputTokens) / 1000.0) * outputCostPer1k;
    }

    public double costFor(TokenUsage usage) {
        if (usage == null) {
            return 0.0;
        }
        return estimateCost(usage.inputTokens(), usage.outputTokens());
    }
}
