package com.cvtailor.ai.service.budget;

import com.cvtailor.ai.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BudgetLedger: admission, reconciliation and rollover.
 */
class BudgetLedgerTest {

    private MutableClock clock;
    private BudgetLedger ledger;
    private final BudgetContext alice = BudgetContext.of("alice", "free");

    @BeforeEach
    void setUp() {
        clock = MutableClock.atNoon();
        ledger = new BudgetLedger(Map.of("free", 0.50, "paid", 5.00), 0.8, clock);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Admission
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should admit spend up to the limit and reject beyond it")
    void admit_shouldRespectDailyLimit() {
        assertTrue(ledger.admit(alice, 0.30));
        assertTrue(ledger.admit(alice, 0.20));
        assertFalse(ledger.admit(alice, 0.01));
        assertEquals(0.50, ledger.spent(alice), 1e-9);
        assertEquals(0.0, ledger.remaining(alice), 1e-9);
    }

    @Test
    @DisplayName("Unknown tiers should get the most restrictive limit")
    void dailyLimit_unknownTierShouldBeMostRestrictive() {
        assertEquals(0.50, ledger.dailyLimit("enterprise"), 1e-9);
        assertEquals(0.50, ledger.dailyLimit(null), 1e-9);
        assertEquals(5.00, ledger.dailyLimit("PAID"), 1e-9);
    }

    @Test
    @DisplayName("Users are tracked independently of each other")
    void admit_shouldKeepPrincipalsSeparate() {
        assertTrue(ledger.admit(alice, 0.50));
        assertTrue(ledger.admit(BudgetContext.of("bob", "free"), 0.50));
    }

    @Test
    @DisplayName("Negative estimates are rejected as programming errors")
    void reserve_shouldRejectNegativeEstimate() {
        assertThrows(IllegalArgumentException.class, () -> ledger.reserve(alice, -0.01));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Reconciliation
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Reconcile should replace the estimate with the actual cost")
    void reconcile_shouldApplyActualCost() {
        ledger.admit(alice, 0.10);

        ledger.reconcile(alice, 0.10, 0.04);

        assertEquals(0.04, ledger.spent(alice), 1e-9);
        assertEquals(1, ledger.entry(alice).orElseThrow().requestCount());
    }

    @Test
    @DisplayName("Reconcile should never take the spend below zero")
    void reconcile_shouldNotGoNegative() {
        ledger.admit(alice, 0.01);

        ledger.reconcile(alice, 0.50, 0.0);

        assertEquals(0.0, ledger.spent(alice), 1e-9);
    }

    @Test
    @DisplayName("A late reconciliation should land on the day of the reservation")
    void reconcile_shouldUseReservationDay() {
        BudgetLedger.Reservation reservation = ledger.reserve(alice, 0.40).orElseThrow();
        clock.advance(Duration.ofHours(13));

        ledger.reconcile(reservation, 0.10);

        assertEquals(0.0, ledger.spent(alice), 1e-9);
        assertTrue(ledger.admit(alice, 0.50));
    }

    @Test
    @DisplayName("A new day should start from zero")
    void admit_shouldResetOnRollover() {
        assertTrue(ledger.admit(alice, 0.50));
        assertFalse(ledger.admit(alice, 0.10));

        clock.advance(Duration.ofDays(1));

        assertTrue(ledger.admit(alice, 0.10));
        assertEquals(20.0, ledger.usagePercentage(alice), 1e-6);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Concurrency
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Concurrent admissions must never overshoot the limit")
    void admit_shouldBeAtomicUnderContention() throws Exception {
        int threads = 32;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                if (ledger.admit(alice, 0.05)) {
                    admitted.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(10, admitted.get());
        assertTrue(ledger.spent(alice) <= 0.50 + 1e-9);
    }
}
