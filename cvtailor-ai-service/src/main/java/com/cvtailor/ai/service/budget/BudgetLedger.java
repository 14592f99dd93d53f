package com.cvtailor.ai.service.budget;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Tracks daily spend per principal (user, or tier when no user is known) and
 * admits or rejects planned provider spend.
 *
 * Admission is pessimistic: the estimated cost is reserved before the call and
 * replaced by the provider-reported cost afterwards. Admission and
 * reconciliation for the same (principal, day) are serialized through
 * {@link ConcurrentHashMap#compute}; unrelated keys never contend. A new day
 * starts a new entry, so rollover needs no reset.
 */
@Slf4j
public class BudgetLedger {

    private final Map<Key, BudgetEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> dailyLimits;
    private final BigDecimal mostRestrictiveLimit;
    private final double alertThreshold;
    private final Clock clock;

    private volatile LocalDate lastPurgedDay;

    public BudgetLedger(Map<String, Double> dailyLimitsByTier, double alertThreshold, Clock clock) {
        if (dailyLimitsByTier == null || dailyLimitsByTier.isEmpty()) {
            throw new IllegalArgumentException("At least one tier daily limit must be configured");
        }
        this.dailyLimits = Collections.unmodifiableMap(dailyLimitsByTier.entrySet().stream()
                .collect(Collectors.toMap(
                        e -> e.getKey().toLowerCase(Locale.ROOT),
                        e -> BigDecimal.valueOf(e.getValue()))));
        this.mostRestrictiveLimit = this.dailyLimits.values().stream()
                .min(BigDecimal::compareTo)
                .orElseThrow();
        this.alertThreshold = alertThreshold;
        this.clock = clock;
        this.lastPurgedDay = today();
    }

    /**
     * @return true when {@code estimatedCost} fits the principal's remaining
     *         daily budget; the estimate is then reserved.
     */
    public boolean admit(BudgetContext context, double estimatedCost) {
        return reserve(context, estimatedCost).isPresent();
    }

    /**
     * Same as {@link #admit} but hands back the reservation, so the
     * reconciliation lands on the day the spend was admitted even if the call
     * finishes after midnight.
     */
    public Optional<Reservation> reserve(BudgetContext context, double estimatedCost) {
        if (estimatedCost < 0) {
            throw new IllegalArgumentException("Estimated cost must not be negative: " + estimatedCost);
        }
        purgeIfDayChanged();

        BigDecimal limit = limitFor(context.tier());
        BigDecimal estimate = BigDecimal.valueOf(estimatedCost);
        Key key = new Key(context.principal(), today());
        AtomicBoolean admitted = new AtomicBoolean(false);

        BudgetEntry updated = entries.compute(key, (k, current) -> {
            BudgetEntry entry = current == null ? BudgetEntry.empty(k.principal(), k.date()) : current;
            if (entry.costUsd().add(estimate).compareTo(limit) > 0) {
                return current;
            }
            admitted.set(true);
            return entry.reserve(estimate);
        });

        if (!admitted.get()) {
            log.warn("Budget denied for {}: spent {} + estimated {} exceeds daily limit {}",
                    key.principal(), updated == null ? "0" : updated.costUsd().toPlainString(),
                    estimate.toPlainString(), limit.toPlainString());
            return Optional.empty();
        }

        warnIfCrossedAlert(key, updated.costUsd().subtract(estimate), updated.costUsd(), limit);
        return Optional.of(new Reservation(key.principal(), key.date(), estimate));
    }

    /**
     * Replaces an earlier reservation of {@code estimatedCost} made today with
     * the real cost. The cumulative spend never drops below zero.
     */
    public void reconcile(BudgetContext context, double estimatedCost, double actualCost) {
        reconcile(new Reservation(context.principal(), today(), BigDecimal.valueOf(estimatedCost)), actualCost);
    }

    public void reconcile(Reservation reservation, double actualCost) {
        if (actualCost < 0) {
            throw new IllegalArgumentException("Actual cost must not be negative: " + actualCost);
        }
        BigDecimal delta = BigDecimal.valueOf(actualCost).subtract(reservation.estimatedCost());
        Key key = new Key(reservation.principal(), reservation.date());

        BudgetEntry updated = entries.compute(key, (k, current) -> {
            BudgetEntry entry = current == null ? BudgetEntry.empty(k.principal(), k.date()) : current;
            return entry.adjust(delta);
        });
        log.debug("Reconciled {}: estimated {} actual {} → spent {}", key.principal(),
                reservation.estimatedCost().toPlainString(), actualCost, updated.costUsd().toPlainString());
    }

    public double remaining(BudgetContext context) {
        BigDecimal limit = limitFor(context.tier());
        BigDecimal left = limit.subtract(spentToday(context.principal()));
        return Math.max(0.0, left.doubleValue());
    }

    public double spent(BudgetContext context) {
        return spentToday(context.principal()).doubleValue();
    }

    public Optional<BudgetEntry> entry(BudgetContext context) {
        return Optional.ofNullable(entries.get(new Key(context.principal(), today())));
    }

    public double usagePercentage(BudgetContext context) {
        BigDecimal limit = limitFor(context.tier());
        if (limit.signum() == 0) {
            return 100.0;
        }
        return spentToday(context.principal()).doubleValue() / limit.doubleValue() * 100.0;
    }

    /**
     * Daily limit for a tier; unknown tiers get the smallest configured limit.
     */
    public double dailyLimit(String tier) {
        return limitFor(tier).doubleValue();
    }

    private BigDecimal limitFor(String tier) {
        if (tier == null) {
            return mostRestrictiveLimit;
        }
        return dailyLimits.getOrDefault(tier.toLowerCase(Locale.ROOT), mostRestrictiveLimit);
    }

    private BigDecimal spentToday(String principal) {
        BudgetEntry entry = entries.get(new Key(principal, today()));
        return entry == null ? BigDecimal.ZERO : entry.costUsd();
    }

    private void warnIfCrossedAlert(Key key, BigDecimal before, BigDecimal after, BigDecimal limit) {
        if (limit.signum() == 0) {
            return;
        }
        BigDecimal threshold = limit.multiply(BigDecimal.valueOf(alertThreshold));
        if (before.compareTo(threshold) < 0 && after.compareTo(threshold) >= 0) {
            log.warn("Budget alert: {} reached {}% of its daily limit ({} / {})", key.principal(),
                    Math.round(alertThreshold * 100), after.toPlainString(), limit.toPlainString());
        }
    }

    // Entries of previous days are only needed until their late reconciliations land
    private void purgeIfDayChanged() {
        LocalDate today = today();
        if (today.equals(lastPurgedDay)) {
            return;
        }
        lastPurgedDay = today;
        LocalDate cutoff = today.minusDays(1);
        entries.keySet().removeIf(k -> k.date().isBefore(cutoff));
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private record Key(String principal, LocalDate date) {
    }

    /**
     * Handle for one admitted estimate.
     */
    public record Reservation(String principal, LocalDate date, BigDecimal estimatedCost) {
    }
}
