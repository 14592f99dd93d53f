package com.cvtailor.ai.service.selection;

import com.cvtailor.ai.service.budget.BudgetContext;
import com.cvtailor.ai.service.budget.BudgetLedger;
import com.cvtailor.ai.service.resilience.CircuitBreakerRegistry;
import com.cvtailor.ai.support.MutableClock;
import com.cvtailor.ai.support.Profiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ModelSelector, covering strategy ordering, breaker filtering and budget downgrade.
 */
class ModelSelectorTest {

    private CircuitBreakerRegistry breakers;
    private BudgetLedger ledger;
    private ModelSelector selector;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atNoon();
        ModelRegistry registry = new ModelRegistry(List.of(
                Profiles.chat("gpt-4o", "openai", 0.005, 0.015, QualityTier.PREMIUM),
                Profiles.chat("gpt-4o-mini", "openai", 0.00015, 0.0006, QualityTier.HIGH),
                Profiles.chat("llama-3.3-70b-versatile", "groq", 0.00059, 0.00079, QualityTier.MEDIUM),
                Profiles.embedding("text-embedding-3-small", "openai", 0.00002, 1536)));
        breakers = new CircuitBreakerRegistry(5, Duration.ofSeconds(30), Duration.ofSeconds(60), clock);
        ledger = new BudgetLedger(Map.of("free", 0.50), 0.8, clock);
        selector = new ModelSelector(registry, breakers, ledger, SelectionStrategy.SelectionWeights.EQUAL);
    }

    private static String name(Optional<ModelProfile> profile) {
        return profile.map(ModelProfile::name).orElse(null);
    }

    @Test
    @DisplayName("Cost-optimized should pick the cheapest model")
    void select_costOptimizedShouldPickCheapest() {
        assertEquals("gpt-4o-mini",
                name(selector.select(TaskType.CV_GENERATION, SelectionStrategy.COST_OPTIMIZED, null)));
    }

    @Test
    @DisplayName("Quality-first should pick the premium model")
    void select_qualityFirstShouldPickBestTier() {
        assertEquals("gpt-4o",
                name(selector.select(TaskType.CV_GENERATION, SelectionStrategy.QUALITY_FIRST, null)));
    }

    @Test
    @DisplayName("Balanced should favour the model that is both cheap and good")
    void select_balancedShouldTradeOff() {
        assertEquals("gpt-4o-mini",
                name(selector.select(TaskType.CV_GENERATION, SelectionStrategy.BALANCED, null)));
    }

    @Test
    @DisplayName("Only models supporting the task are considered")
    void select_shouldFilterByTask() {
        assertEquals("text-embedding-3-small",
                name(selector.select(TaskType.EMBEDDING, SelectionStrategy.QUALITY_FIRST, null)));
    }

    @Test
    @DisplayName("Circuit-open models should be skipped")
    void select_shouldSkipOpenBreakers() {
        for (int i = 0; i < 5; i++) {
            breakers.forModel("gpt-4o").recordFailure();
        }

        assertEquals("gpt-4o-mini",
                name(selector.select(TaskType.CV_GENERATION, SelectionStrategy.QUALITY_FIRST, null)));
    }

    @Test
    @DisplayName("Should return empty when every candidate is circuit-open")
    void select_allOpenShouldBeEmpty() {
        for (int i = 0; i < 5; i++) {
            breakers.forModel("text-embedding-3-small").recordFailure();
        }

        assertTrue(selector.select(TaskType.EMBEDDING, SelectionStrategy.BALANCED, null).isEmpty());
    }

    @Test
    @DisplayName("Should downgrade to an affordable model when the preferred one no longer fits")
    void rankCandidates_shouldPutAffordableModelsFirst() {
        BudgetContext budget = BudgetContext.of("alice", "free");
        assertTrue(ledger.admit(budget, 0.45));
        BudgetContext planned = budget.withPlannedTokens(5000, 5000);

        List<ModelProfile> ranked = selector.rankCandidates(TaskType.CV_GENERATION,
                SelectionStrategy.QUALITY_FIRST, planned, Set.of());

        assertEquals("gpt-4o-mini", ranked.get(0).name());
        assertEquals("gpt-4o", ranked.get(ranked.size() - 1).name());
    }

    @Test
    @DisplayName("Excluded models should not be ranked")
    void rankCandidates_shouldHonourExclusions() {
        List<ModelProfile> ranked = selector.rankCandidates(TaskType.CV_GENERATION,
                SelectionStrategy.QUALITY_FIRST, null, Set.of("gpt-4o"));

        assertEquals(List.of("gpt-4o-mini", "llama-3.3-70b-versatile"),
                ranked.stream().map(ModelProfile::name).toList());
    }

    @Test
    @DisplayName("Strategy names from configuration should parse leniently")
    void fromConfig_shouldAcceptConfigSpellings() {
        assertEquals(SelectionStrategy.COST_OPTIMIZED, SelectionStrategy.fromConfig("cost-optimized"));
        assertEquals(SelectionStrategy.QUALITY_FIRST, SelectionStrategy.fromConfig("quality_optimized"));
        assertEquals(SelectionStrategy.BALANCED, SelectionStrategy.fromConfig(null));
    }
}
