package com.cvtailor.ai.service.selection;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * How surviving candidates are ordered. Each strategy maps to a pure
 * comparator built from the candidate set; the first element after sorting is
 * the selected model. Ties always fall back to the model name so the order is
 * deterministic.
 */
public enum SelectionStrategy {

    COST_OPTIMIZED {
        @Override
        public Comparator<ModelProfile> comparator(List<ModelProfile> candidates, SelectionWeights weights) {
            return Comparator.comparingDouble(ModelProfile::unitCost)
                    .thenComparing(BY_QUALITY_DESC)
                    .thenComparing(ModelProfile::name);
        }
    },

    QUALITY_FIRST {
        @Override
        public Comparator<ModelProfile> comparator(List<ModelProfile> candidates, SelectionWeights weights) {
            return BY_QUALITY_DESC
                    .thenComparingDouble(ModelProfile::unitCost)
                    .thenComparing(ModelProfile::name);
        }
    },

    /**
     * Minimizes {@code costWeight * costRank + qualityWeight * qualityRank},
     * where both ranks are dense ranks inside the candidate set (0 = cheapest,
     * 0 = best quality).
     */
    BALANCED {
        @Override
        public Comparator<ModelProfile> comparator(List<ModelProfile> candidates, SelectionWeights weights) {
            Map<Double, Integer> costRanks = denseRanks(candidates, ModelProfile::unitCost, false);
            Map<Double, Integer> qualityRanks = denseRanks(candidates, p -> p.qualityTier().rank(), true);

            ToDoubleFunction<ModelProfile> score = p -> weights.costWeight() * costRanks.get(p.unitCost())
                    + weights.qualityWeight() * qualityRanks.get((double) p.qualityTier().rank());

            return Comparator.comparingDouble(score)
                    .thenComparingDouble(ModelProfile::unitCost)
                    .thenComparing(ModelProfile::name);
        }
    };

    private static final Comparator<ModelProfile> BY_QUALITY_DESC =
            Comparator.comparingInt((ModelProfile p) -> p.qualityTier().rank()).reversed();

    public abstract Comparator<ModelProfile> comparator(List<ModelProfile> candidates, SelectionWeights weights);

    public static SelectionStrategy fromConfig(String raw) {
        if (raw == null || raw.isBlank()) {
            return BALANCED;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        // Accept the older "quality_optimized" spelling
        if (normalized.equals("QUALITY_OPTIMIZED")) {
            return QUALITY_FIRST;
        }
        return SelectionStrategy.valueOf(normalized);
    }

    private static Map<Double, Integer> denseRanks(List<ModelProfile> candidates,
            ToDoubleFunction<ModelProfile> key, boolean descending) {
        TreeSet<Double> distinct = candidates.stream()
                .map(p -> key.applyAsDouble(p))
                .collect(Collectors.toCollection(TreeSet::new));
        List<Double> ordered = descending ? List.copyOf(distinct.descendingSet()) : List.copyOf(distinct);
        return ordered.stream().collect(Collectors.toMap(Function.identity(), ordered::indexOf));
    }

    /**
     * Relative weights for the BALANCED strategy.
     */
    public record SelectionWeights(double costWeight, double qualityWeight) {

        public static final SelectionWeights EQUAL = new SelectionWeights(0.5, 0.5);

        public SelectionWeights {
            if (costWeight < 0 || qualityWeight < 0) {
                throw new IllegalArgumentException("Selection weights must not be negative");
            }
        }
    }
}
