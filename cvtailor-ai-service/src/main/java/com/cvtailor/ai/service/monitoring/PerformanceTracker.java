package com.cvtailor.ai.service.monitoring;

import com.cvtailor.ai.service.strategy.TokenUsage;
import com.cvtailor.common.exception.ProviderFailureType;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-model call statistics: latency, success rate, tokens and cost of every
 * dispatched provider call since startup.
 *
 * Fed by the invoker after each dispatch. Counters are lock-free; summaries
 * are point-in-time reads and may be off by a call that is being recorded.
 */
@Slf4j
public class PerformanceTracker {

    // Thresholds for recommendations
    static final double SLOW_LATENCY_MS = 5000;
    static final double EXPENSIVE_CALL_USD = 0.20;
    static final double MIN_SUCCESS_RATE = 0.95;

    private final Map<String, ModelCounters> byModel = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Instant startedAt;

    public PerformanceTracker(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    // ═══════════════════════════════════════════════════════
    // Recording
    // ═══════════════════════════════════════════════════════

    public void recordSuccess(String model, long latencyMs, TokenUsage usage, double costUsd) {
        counters(model).record(latencyMs, true, null, usage, costUsd);
    }

    public void recordFailure(String model, long latencyMs, ProviderFailureType failureType, TokenUsage usage,
            double costUsd) {
        counters(model).record(latencyMs, false, failureType, usage, costUsd);
        log.debug("Recorded {} failure for {} after {} ms", failureType, model, latencyMs);
    }

    /**
     * Cost of a call that was already counted (as a timeout) but completed
     * after the caller stopped waiting.
     */
    public void recordLateCost(String model, TokenUsage usage, double costUsd) {
        counters(model).addUsage(usage, costUsd);
    }

    // ═══════════════════════════════════════════════════════
    // Reporting
    // ═══════════════════════════════════════════════════════

    public Map<String, ModelPerformance> summary() {
        Map<String, ModelPerformance> summary = new LinkedHashMap<>();
        byModel.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> summary.put(e.getKey(), e.getValue().snapshot(e.getKey())));
        return summary;
    }

    /**
     * Spend per model and each model's share of the total.
     */
    public CostAnalysis costAnalysis() {
        Map<String, ModelPerformance> summary = summary();
        long calls = summary.values().stream().mapToLong(ModelPerformance::calls).sum();
        double total = summary.values().stream().mapToDouble(ModelPerformance::totalCostUsd).sum();

        Map<String, Double> share = new LinkedHashMap<>();
        summary.values().stream()
                .sorted(Comparator.comparingDouble(ModelPerformance::totalCostUsd).reversed())
                .forEach(p -> share.put(p.model(), total > 0 ? round(p.totalCostUsd() / total * 100, 2) : 0.0));

        return new CostAnalysis(startedAt, clock.instant(), calls, total,
                calls > 0 ? total / calls : 0.0, share);
    }

    /**
     * Models that are slow, expensive or unreliable by the tracker's
     * thresholds. A model needs at least one call to be judged.
     */
    public List<Recommendation> recommendations() {
        List<Recommendation> found = new ArrayList<>();
        for (ModelPerformance p : summary().values()) {
            if (p.calls() == 0) {
                continue;
            }
            if (p.averageLatencyMs() > SLOW_LATENCY_MS) {
                found.add(new Recommendation(p.model(), Recommendation.Kind.LATENCY,
                        String.format(Locale.ROOT, "Average latency %.0f ms, consider a faster model",
                                p.averageLatencyMs())));
            }
            if (p.averageCostUsd() > EXPENSIVE_CALL_USD) {
                found.add(new Recommendation(p.model(), Recommendation.Kind.COST,
                        String.format(Locale.ROOT, "Average cost $%.6f per call, consider a cheaper model",
                                p.averageCostUsd())));
            }
            if (p.successRate() < MIN_SUCCESS_RATE) {
                found.add(new Recommendation(p.model(), Recommendation.Kind.RELIABILITY,
                        String.format(Locale.ROOT, "Success rate %.1f%%, model may be unstable",
                                p.successRate() * 100)));
            }
        }
        return found;
    }

    private ModelCounters counters(String model) {
        return byModel.computeIfAbsent(model, m -> new ModelCounters());
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    private static final class ModelCounters {
        private final LongAdder calls = new LongAdder();
        private final LongAdder successes = new LongAdder();
        private final LongAdder latencyMs = new LongAdder();
        private final LongAdder inputTokens = new LongAdder();
        private final LongAdder outputTokens = new LongAdder();
        private final DoubleAdder costUsd = new DoubleAdder();
        private final Map<ProviderFailureType, LongAdder> failures = new ConcurrentHashMap<>();

        void record(long latency, boolean success, ProviderFailureType failureType, TokenUsage usage, double cost) {
            calls.increment();
            latencyMs.add(Math.max(0, latency));
            if (success) {
                successes.increment();
            } else if (failureType != null) {
                failures.computeIfAbsent(failureType, t -> new LongAdder()).increment();
            }
            addUsage(usage, cost);
        }

        void addUsage(TokenUsage usage, double cost) {
            if (usage != null) {
                inputTokens.add(usage.inputTokens());
                outputTokens.add(usage.outputTokens());
            }
            if (cost > 0) {
                costUsd.add(cost);
            }
        }

        ModelPerformance snapshot(String model) {
            long total = calls.sum();
            long ok = successes.sum();
            double cost = costUsd.sum();
            Map<ProviderFailureType, Long> failureCounts = new EnumMap<>(ProviderFailureType.class);
            failures.forEach((type, count) -> failureCounts.put(type, count.sum()));
            return new ModelPerformance(model, total, ok, total > 0 ? (double) ok / total : 1.0,
                    total > 0 ? (double) latencyMs.sum() / total : 0.0, inputTokens.sum(), outputTokens.sum(),
                    cost, total > 0 ? cost / total : 0.0, failureCounts);
        }
    }
}
