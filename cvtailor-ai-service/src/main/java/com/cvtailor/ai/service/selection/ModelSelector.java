package com.cvtailor.ai.service.selection;

import com.cvtailor.ai.service.budget.BudgetContext;
import com.cvtailor.ai.service.budget.BudgetLedger;
import com.cvtailor.ai.service.resilience.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Chooses a model for a task.
 *
 * Candidates must support the task and have a breaker that would let a call
 * through. Survivors are ordered by the strategy; among them, models whose
 * estimated cost fits the principal's remaining daily budget come first, which
 * downgrades to a cheaper model when the preferred one no longer fits.
 */
@Slf4j
public class ModelSelector {

    private final ModelRegistry registry;
    private final CircuitBreakerRegistry breakers;
    private final BudgetLedger ledger;
    private final SelectionStrategy.SelectionWeights weights;

    public ModelSelector(ModelRegistry registry, CircuitBreakerRegistry breakers, BudgetLedger ledger,
            SelectionStrategy.SelectionWeights weights) {
        this.registry = registry;
        this.breakers = breakers;
        this.ledger = ledger;
        this.weights = weights;
    }

    /**
     * @return the preferred model, or empty when every model supporting the
     *         task is circuit-open (or none supports it). Callers must fail the
     *         request in that case.
     */
    public Optional<ModelProfile> select(TaskType task, SelectionStrategy strategy, BudgetContext budget) {
        List<ModelProfile> ranked = rankCandidates(task, strategy, budget, Set.of());
        if (ranked.isEmpty()) {
            log.warn("No available model for task {} (strategy {})", task, strategy);
            return Optional.empty();
        }
        ModelProfile selected = ranked.get(0);
        log.info("Selected model '{}' for task '{}' using strategy '{}'", selected.name(), task, strategy);
        return Optional.of(selected);
    }

    /**
     * Every profile supporting the task in strategy order, ignoring breaker
     * and budget state. Used to look up caches, which cost nothing to read.
     */
    public List<ModelProfile> orderedProfiles(TaskType task, SelectionStrategy strategy) {
        List<ModelProfile> profiles = new ArrayList<>(registry.profilesFor(task));
        profiles.sort(strategy.comparator(List.copyOf(profiles), weights));
        return List.copyOf(profiles);
    }

    /**
     * Full candidate order used by the invoker: the head is what
     * {@link #select} returns, the tail are the alternates tried after a
     * budget denial or a lost half-open trial call.
     */
    public List<ModelProfile> rankCandidates(TaskType task, SelectionStrategy strategy, BudgetContext budget,
            Collection<String> excluded) {
        List<ModelProfile> survivors = registry.profilesFor(task).stream()
                .filter(p -> !excluded.contains(p.name()))
                .filter(p -> breakers.forModel(p.name()).isCallPermitted())
                .toList();
        if (survivors.isEmpty()) {
            return List.of();
        }

        List<ModelProfile> ordered = new ArrayList<>(survivors);
        ordered.sort(strategy.comparator(survivors, weights));

        if (budget == null) {
            return List.copyOf(ordered);
        }

        double remaining = ledger.remaining(budget);
        List<ModelProfile> affordable = new ArrayList<>();
        List<ModelProfile> overBudget = new ArrayList<>();
        for (ModelProfile profile : ordered) {
            double estimate = profile.estimateCost(budget.plannedInputTokens(), budget.plannedOutputTokens());
            if (estimate <= remaining) {
                affordable.add(profile);
            } else {
                overBudget.add(profile);
            }
        }
        if (!overBudget.isEmpty() && !affordable.isEmpty()) {
            log.debug("Budget for {} excludes {} from the front of the order", budget.principal(),
                    overBudget.stream().map(ModelProfile::name).toList());
        }
        affordable.addAll(overBudget);
        return List.copyOf(affordable);
    }
}
