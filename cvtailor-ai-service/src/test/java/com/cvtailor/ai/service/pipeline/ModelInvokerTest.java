package com.cvtailor.ai.service.pipeline;

import com.cvtailor.ai.service.budget.BudgetContext;
import com.cvtailor.ai.service.budget.BudgetLedger;
import com.cvtailor.ai.service.monitoring.ModelPerformance;
import com.cvtailor.ai.service.monitoring.PerformanceTracker;
import com.cvtailor.ai.service.resilience.CircuitBreakerRegistry;
import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.service.selection.ModelRegistry;
import com.cvtailor.ai.service.selection.ModelSelector;
import com.cvtailor.ai.service.selection.QualityTier;
import com.cvtailor.ai.service.selection.SelectionStrategy;
import com.cvtailor.ai.service.selection.TaskType;
import com.cvtailor.ai.service.strategy.ProviderClients;
import com.cvtailor.ai.service.strategy.TextGenerationStrategy;
import com.cvtailor.ai.service.strategy.TextGenerationStrategy.CompletionResult;
import com.cvtailor.ai.service.strategy.TokenUsage;
import com.cvtailor.ai.support.MutableClock;
import com.cvtailor.ai.support.Profiles;
import com.cvtailor.common.exception.BudgetExceededException;
import com.cvtailor.common.exception.ProviderCallFailedException;
import com.cvtailor.common.exception.ProviderFailureType;
import com.cvtailor.common.exception.ProviderUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ModelInvoker, covering the guarded call path and its single fallback.
 */
@ExtendWith(MockitoExtension.class)
class ModelInvokerTest {

    private static final ModelProfile GPT_4O =
            Profiles.chat("gpt-4o", "openai", 0.005, 0.015, QualityTier.PREMIUM);
    private static final ModelProfile LLAMA =
            Profiles.chat("llama-3.3-70b-versatile", "groq", 0.00059, 0.00079, QualityTier.MEDIUM);

    @Mock
    private TextGenerationStrategy openai;

    @Mock
    private TextGenerationStrategy groq;

    private CircuitBreakerRegistry breakers;
    private BudgetLedger ledger;
    private ProviderClients clients;
    private ModelSelector selector;
    private PerformanceTracker performance;
    private ExecutorService pool;

    private final BudgetContext budget = BudgetContext.of("alice", "free");
    private InvocationContext context;

    @BeforeEach
    void setUp() {
        when(openai.getProviderName()).thenReturn("openai");
        when(groq.getProviderName()).thenReturn("groq");

        MutableClock clock = MutableClock.atNoon();
        breakers = new CircuitBreakerRegistry(5, Duration.ofSeconds(30), Duration.ofSeconds(60), clock);
        ledger = new BudgetLedger(Map.of("free", 1.00), 0.8, clock);
        clients = new ProviderClients(List.of(), List.of(openai, groq));
        performance = new PerformanceTracker(clock);
        selector = new ModelSelector(new ModelRegistry(List.of(GPT_4O, LLAMA)), breakers, ledger,
                SelectionStrategy.SelectionWeights.EQUAL);
        context = InvocationContext.of(budget, SelectionStrategy.QUALITY_FIRST, "user:alice");
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private ModelInvoker invoker(Executor executor, Duration timeout) {
        return new ModelInvoker(selector, breakers, ledger, clients, performance, executor, timeout);
    }

    private ModelInvoker directInvoker() {
        return invoker(Runnable::run, Duration.ofSeconds(5));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Success path
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should call the preferred model and charge its reported usage")
    void invoke_shouldUsePreferredModel() {
        when(openai.generateText(anyString(), eq(GPT_4O), anyInt()))
                .thenReturn(CompletionResult.success("tailored", new TokenUsage(100, 50)));

        ModelInvoker invoker = directInvoker();
        Invocation<String> result = invoker.invoke(TaskType.CV_GENERATION, context,
                invoker.completion("prompt", 2000));

        assertEquals("tailored", result.value());
        assertEquals("gpt-4o", result.model().name());
        assertFalse(result.fallbackUsed());
        assertEquals(0.00125, result.costUsd(), 1e-9);
        assertEquals(0.00125, ledger.spent(budget), 1e-9);
        assertEquals(0.00125, context.costs().total(), 1e-9);
        verify(groq, never()).generateText(anyString(), any(), anyInt());

        ModelPerformance stats = performance.summary().get("gpt-4o");
        assertEquals(1, stats.calls());
        assertEquals(1.0, stats.successRate());
        assertEquals(150, stats.inputTokens() + stats.outputTokens());
        assertEquals(0.00125, stats.totalCostUsd(), 1e-9);
    }

    @Test
    @DisplayName("Providers reporting no usage should be charged the planned size")
    void invoke_missingUsageShouldFallBackToEstimate() {
        when(openai.generateText(anyString(), eq(GPT_4O), anyInt()))
                .thenReturn(CompletionResult.success("tailored", TokenUsage.NONE));
        ModelInvoker invoker = directInvoker();
        ProviderCall<String> call = invoker.completion("x".repeat(400), 1000);

        Invocation<String> result = invoker.invoke(TaskType.CV_GENERATION, context, call);

        assertEquals(new TokenUsage(100, 1000), result.usage());
        assertEquals(GPT_4O.costFor(new TokenUsage(100, 1000)), ledger.spent(budget), 1e-9);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Fallback
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("A failed call should fall back once to the next model")
    void invoke_shouldFallBackAfterFailure() {
        when(openai.generateText(anyString(), eq(GPT_4O), anyInt()))
                .thenReturn(CompletionResult.failed(ProviderFailureType.TRANSPORT, "502 Bad Gateway"));
        when(groq.generateText(anyString(), eq(LLAMA), anyInt()))
                .thenReturn(CompletionResult.success("from llama", new TokenUsage(100, 50)));

        ModelInvoker invoker = directInvoker();
        Invocation<String> result = invoker.invoke(TaskType.CV_GENERATION, context,
                invoker.completion("prompt", 2000));

        assertEquals("from llama", result.value());
        assertTrue(result.fallbackUsed());
        assertEquals(1, breakers.forModel("gpt-4o").getFailureCount());
        assertEquals(0, breakers.forModel("llama-3.3-70b-versatile").getFailureCount());
    }

    @Test
    @DisplayName("Should give up after the alternate also fails")
    void invoke_shouldStopAfterTwoDispatches() {
        when(openai.generateText(anyString(), eq(GPT_4O), anyInt()))
                .thenReturn(CompletionResult.failed(ProviderFailureType.TRANSPORT, "502"));
        when(groq.generateText(anyString(), eq(LLAMA), anyInt()))
                .thenReturn(CompletionResult.failed(ProviderFailureType.RATE_LIMITED, "429"));

        ModelInvoker invoker = directInvoker();
        ProviderCallFailedException error = assertThrows(ProviderCallFailedException.class,
                () -> invoker.invoke(TaskType.CV_GENERATION, context, invoker.completion("prompt", 2000)));

        assertEquals(ProviderFailureType.RATE_LIMITED, error.getFailureType());
        verify(openai, times(1)).generateText(anyString(), any(), anyInt());
        verify(groq, times(1)).generateText(anyString(), any(), anyInt());
    }

    @Test
    @DisplayName("An unparseable reply should count as a failure and trigger the fallback")
    void invoke_malformedReplyShouldFallBack() {
        when(openai.generateText(anyString(), eq(GPT_4O), anyInt()))
                .thenReturn(CompletionResult.success("not json", new TokenUsage(10, 10)));
        when(groq.generateText(anyString(), eq(LLAMA), anyInt()))
                .thenReturn(CompletionResult.success("{\"ok\":true}", new TokenUsage(10, 10)));

        ModelInvoker invoker = directInvoker();
        ProviderCall<String> call = invoker.completion("prompt", 100).thenParse(reply -> {
            if (!reply.startsWith("{")) {
                throw new IllegalArgumentException("no JSON object");
            }
            return reply;
        });
        Invocation<String> result = invoker.invoke(TaskType.JOB_PARSING, context, call);

        assertEquals("{\"ok\":true}", result.value());
        assertTrue(result.fallbackUsed());
        assertEquals(1, breakers.forModel("gpt-4o").getFailureCount());
        assertEquals(GPT_4O.costFor(new TokenUsage(10, 10)) + LLAMA.costFor(new TokenUsage(10, 10)),
                context.costs().total(), 1e-12);
    }

    @Test
    @DisplayName("A timed-out call should count as a failure and fall back")
    void invoke_timeoutShouldCountAsFailure() {
        pool = Executors.newCachedThreadPool();
        when(openai.generateText(anyString(), eq(GPT_4O), anyInt())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return CompletionResult.success("too late", new TokenUsage(10, 10));
        });
        when(groq.generateText(anyString(), eq(LLAMA), anyInt()))
                .thenReturn(CompletionResult.success("fast", new TokenUsage(10, 10)));

        ModelInvoker invoker = invoker(pool, Duration.ofMillis(100));
        Invocation<String> result = invoker.invoke(TaskType.CV_GENERATION, context,
                invoker.completion("prompt", 100));

        assertEquals("fast", result.value());
        assertTrue(result.fallbackUsed());
        assertEquals(1, breakers.forModel("gpt-4o").getFailureCount());
    }

    @Test
    @DisplayName("A client that throws should be charged nothing on both ledger and request")
    void invoke_throwingClientShouldReleaseReservation() {
        when(openai.generateText(anyString(), eq(GPT_4O), anyInt()))
                .thenThrow(new IllegalStateException("connection reset"));
        when(groq.generateText(anyString(), eq(LLAMA), anyInt()))
                .thenReturn(CompletionResult.success("from llama", new TokenUsage(100, 50)));

        ModelInvoker invoker = directInvoker();
        Invocation<String> result = invoker.invoke(TaskType.CV_GENERATION, context,
                invoker.completion("prompt", 2000));

        double llamaCost = LLAMA.costFor(new TokenUsage(100, 50));
        assertTrue(result.fallbackUsed());
        assertEquals(llamaCost, ledger.spent(budget), 1e-12);
        assertEquals(llamaCost, context.costs().total(), 1e-12);
        assertEquals(1, breakers.forModel("gpt-4o").getFailureCount());
        assertEquals(1L, performance.summary().get("gpt-4o").failures().get(ProviderFailureType.TRANSPORT));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Calls that complete after the caller stopped waiting
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("A timed-out call should still reconcile its real cost when it completes")
    void invoke_timedOutCallShouldReconcileWhenItCompletes() throws Exception {
        pool = Executors.newCachedThreadPool();
        CountDownLatch release = new CountDownLatch(1);
        when(openai.generateText(anyString(), eq(GPT_4O), anyInt())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return CompletionResult.success("too late", new TokenUsage(10, 10));
        });
        when(groq.generateText(anyString(), eq(LLAMA), anyInt()))
                .thenReturn(CompletionResult.success("fast", new TokenUsage(10, 10)));

        ModelInvoker invoker = invoker(pool, Duration.ofMillis(100));
        invoker.invoke(TaskType.CV_GENERATION, context, invoker.completion("prompt", 100));

        double settled = GPT_4O.costFor(new TokenUsage(10, 10)) + LLAMA.costFor(new TokenUsage(10, 10));
        assertTrue(ledger.spent(budget) > settled, "the estimate stays reserved while the call runs");

        release.countDown();
        awaitCondition(() -> Math.abs(ledger.spent(budget) - settled) < 1e-12);

        assertEquals(settled, context.costs().total(), 1e-12);
        assertEquals(1, breakers.forModel("gpt-4o").getFailureCount());
        ModelPerformance stats = performance.summary().get("gpt-4o");
        assertEquals(1, stats.calls());
        assertEquals(0, stats.successes());
        assertEquals(GPT_4O.costFor(new TokenUsage(10, 10)), stats.totalCostUsd(), 1e-12);
    }

    @Test
    @DisplayName("A cancelled caller's call should reconcile its cost and outcome when it completes")
    void invoke_cancelledCallShouldReconcileWhenItCompletes() throws Exception {
        pool = Executors.newCachedThreadPool();
        ExecutorService caller = Executors.newSingleThreadExecutor();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(openai.generateText(anyString(), eq(GPT_4O), anyInt())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return CompletionResult.success("unwanted", new TokenUsage(10, 10));
        });

        ModelInvoker invoker = invoker(pool, Duration.ofSeconds(5));
        Future<Invocation<String>> running = caller.submit(() ->
                invoker.invoke(TaskType.CV_GENERATION, context, invoker.completion("prompt", 100)));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        running.cancel(true);
        release.countDown();

        double actual = GPT_4O.costFor(new TokenUsage(10, 10));
        awaitCondition(() -> Math.abs(ledger.spent(budget) - actual) < 1e-12);
        caller.shutdownNow();

        assertEquals(actual, context.costs().total(), 1e-12);
        assertEquals(1, performance.summary().get("gpt-4o").successes());
        verify(groq, never()).generateText(anyString(), any(), anyInt());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Refusals
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should fail with ProviderUnavailable when every breaker is open")
    void invoke_allBreakersOpenShouldBeUnavailable() {
        for (int i = 0; i < 5; i++) {
            breakers.forModel("gpt-4o").recordFailure();
            breakers.forModel("llama-3.3-70b-versatile").recordFailure();
        }

        ModelInvoker invoker = directInvoker();
        assertThrows(ProviderUnavailableException.class,
                () -> invoker.invoke(TaskType.CV_GENERATION, context, invoker.completion("prompt", 100)));

        verify(openai, never()).generateText(anyString(), any(), anyInt());
        verify(groq, never()).generateText(anyString(), any(), anyInt());
        assertEquals(0.0, ledger.spent(budget), 1e-12);
    }

    @Test
    @DisplayName("Should fail with BudgetExceeded before calling any provider")
    void invoke_exhaustedBudgetShouldNotDispatch() {
        assertTrue(ledger.admit(budget, 1.00));

        ModelInvoker invoker = directInvoker();
        assertThrows(BudgetExceededException.class,
                () -> invoker.invoke(TaskType.CV_GENERATION, context, invoker.completion("prompt", 2000)));

        verify(openai, never()).generateText(anyString(), any(), anyInt());
        verify(groq, never()).generateText(anyString(), any(), anyInt());
    }

    @Test
    @DisplayName("A model without a configured client fails the call instead of throwing")
    void invokeOn_missingClientShouldFail() {
        ModelProfile orphan = Profiles.chat("claude-3", "anthropic", 0.003, 0.015, QualityTier.PREMIUM);

        ModelInvoker invoker = directInvoker();
        ProviderCallFailedException error = assertThrows(ProviderCallFailedException.class,
                () -> invoker.invokeOn(orphan, context, invoker.completion("prompt", 100)));

        assertEquals(ProviderFailureType.TRANSPORT, error.getFailureType());
        assertEquals(1, breakers.forModel("claude-3").getFailureCount());
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
