package com.cvtailor.ai.service.budget;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Cumulative spend of one principal on one day, reservations included.
 * Replaced (never mutated) on every admission or reconciliation.
 */
public record BudgetEntry(String principal, LocalDate date, BigDecimal costUsd, int requestCount) {

    static BudgetEntry empty(String principal, LocalDate date) {
        return new BudgetEntry(principal, date, BigDecimal.ZERO, 0);
    }

    BudgetEntry reserve(BigDecimal estimated) {
        return new BudgetEntry(principal, date, costUsd.add(estimated), requestCount + 1);
    }

    BudgetEntry adjust(BigDecimal delta) {
        BigDecimal adjusted = costUsd.add(delta);
        return new BudgetEntry(principal, date, adjusted.signum() < 0 ? BigDecimal.ZERO : adjusted, requestCount);
    }

    public double cost() {
        return costUsd.doubleValue();
    }
}
