package com.cvtailor.ai.service.budget;

import java.util.Locale;

/**
 * Who pays for a planned provider call and how large the call is expected to
 * be. Spend is keyed by user when one is known, otherwise by tier.
 *
 * @param userId              paying user, may be null for tier-level jobs
 * @param tier                user classification ("free", "paid"); selects the daily limit
 * @param plannedInputTokens  estimated input size of the next call
 * @param plannedOutputTokens output budget of the next call
 */
public record BudgetContext(String userId, String tier, int plannedInputTokens, int plannedOutputTokens) {

    public static BudgetContext of(String userId, String tier) {
        return new BudgetContext(userId, tier, 0, 0);
    }

    public BudgetContext withPlannedTokens(int inputTokens, int outputTokens) {
        return new BudgetContext(userId, tier, inputTokens, outputTokens);
    }

    public String principal() {
        if (userId != null && !userId.isBlank()) {
            return "user:" + userId;
        }
        return "tier:" + (tier == null ? "unknown" : tier.toLowerCase(Locale.ROOT));
    }
}
