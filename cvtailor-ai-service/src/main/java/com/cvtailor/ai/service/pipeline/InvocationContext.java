package com.cvtailor.ai.service.pipeline;

import com.cvtailor.ai.service.budget.BudgetContext;
import com.cvtailor.ai.service.selection.SelectionStrategy;

/**
 * Per-request settings threaded through every provider call.
 *
 * @param scope cache scope for user-scoped derived outputs and near-duplicate
 *              lookups
 */
public record InvocationContext(BudgetContext budget, SelectionStrategy strategy, String scope,
        CostAccumulator costs) {

    public static InvocationContext of(BudgetContext budget, SelectionStrategy strategy, String scope) {
        return new InvocationContext(budget, strategy, scope, new CostAccumulator());
    }
}
