package com.cvtailor.ai.service.pipeline;

import com.cvtailor.ai.service.budget.BudgetContext;
import com.cvtailor.ai.service.budget.BudgetLedger;
import com.cvtailor.ai.service.monitoring.PerformanceTracker;
import com.cvtailor.ai.service.resilience.CircuitBreaker;
import com.cvtailor.ai.service.resilience.CircuitBreakerRegistry;
import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.service.selection.ModelSelector;
import com.cvtailor.ai.service.selection.TaskType;
import com.cvtailor.ai.service.strategy.EmbeddingStrategy;
import com.cvtailor.ai.service.strategy.ProviderClients;
import com.cvtailor.ai.service.strategy.TextGenerationStrategy;
import com.cvtailor.ai.service.strategy.TokenUsage;
import com.cvtailor.common.exception.BudgetExceededException;
import com.cvtailor.common.exception.InvocationCancelledException;
import com.cvtailor.common.exception.ProviderCallFailedException;
import com.cvtailor.common.exception.ProviderFailureType;
import com.cvtailor.common.exception.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * The guarded call path shared by every provider request:
 * select → reserve budget → claim breaker → dispatch with timeout → record
 * outcome → reconcile cost.
 *
 * A failed dispatch is retried once on a different eligible model. Budget
 * denials and lost half-open trial calls skip to the next candidate without
 * counting as failures.
 */
@Slf4j
public class ModelInvoker {

    static final int MAX_DISPATCHES = 2;

    private final ModelSelector selector;
    private final CircuitBreakerRegistry breakers;
    private final BudgetLedger ledger;
    private final ProviderClients clients;
    private final PerformanceTracker performance;
    private final Executor providerExecutor;
    private final Duration timeout;

    public ModelInvoker(ModelSelector selector, CircuitBreakerRegistry breakers, BudgetLedger ledger,
            ProviderClients clients, PerformanceTracker performance, Executor providerExecutor, Duration timeout) {
        this.selector = selector;
        this.breakers = breakers;
        this.ledger = ledger;
        this.clients = clients;
        this.performance = performance;
        this.providerExecutor = providerExecutor;
        this.timeout = timeout;
    }

    /**
     * Runs {@code call} on the best model for {@code task}, falling back to one
     * alternate after a provider failure.
     */
    public <T> Invocation<T> invoke(TaskType task, InvocationContext context, ProviderCall<T> call) {
        return withFallback(task, context, call.plannedUsage(), model -> invokeOn(model, context, call));
    }

    /**
     * Candidate loop shared by plain calls and cache-aware computations.
     * {@code attempt} signals a skip by throwing {@link BudgetExceededException}
     * or {@link ProviderUnavailableException}, and a dispatched failure by
     * throwing {@link ProviderCallFailedException}.
     */
    public <T> Invocation<T> withFallback(TaskType task, InvocationContext context, TokenUsage plannedUsage,
            Function<ModelProfile, Invocation<T>> attempt) {
        return withFallback(task, context, plannedUsage, Set.of(), attempt);
    }

    public <T> Invocation<T> withFallback(TaskType task, InvocationContext context, TokenUsage plannedUsage,
            Set<String> alreadyExcluded, Function<ModelProfile, Invocation<T>> attempt) {
        BudgetContext planned = context.budget()
                .withPlannedTokens(plannedUsage.inputTokens(), plannedUsage.outputTokens());
        Set<String> excluded = new HashSet<>(alreadyExcluded);
        ProviderCallFailedException lastFailure = null;
        BudgetExceededException budgetDenial = null;
        int failures = 0;

        while (failures < MAX_DISPATCHES) {
            List<ModelProfile> ranked = selector.rankCandidates(task, context.strategy(), planned, excluded);
            boolean failedThisPass = false;

            for (ModelProfile model : ranked) {
                try {
                    Invocation<T> result = attempt.apply(model);
                    if (lastFailure != null) {
                        log.info("Fallback model {} succeeded for {}", model.name(), task);
                        return result.asFallback();
                    }
                    return result;
                } catch (BudgetExceededException e) {
                    budgetDenial = e;
                } catch (ProviderUnavailableException e) {
                    log.debug("{} skipped: {}", model.name(), e.getMessage());
                } catch (ProviderCallFailedException e) {
                    log.warn("Provider call to {} failed ({}): {}", model.name(), e.getFailureType(), e.getMessage());
                    lastFailure = e;
                    excluded.add(model.name());
                    failures++;
                    failedThisPass = true;
                    break;
                }
            }
            if (!failedThisPass) {
                break;
            }
        }

        if (lastFailure != null) {
            throw lastFailure;
        }
        if (budgetDenial != null) {
            throw budgetDenial;
        }
        throw new ProviderUnavailableException("No available model for task " + task);
    }

    /**
     * Runs {@code call} on one fixed model, used when the output must live in
     * that model's vector space.
     */
    public <T> Invocation<T> invokeOn(ModelProfile model, InvocationContext context, ProviderCall<T> call) {
        TokenUsage plannedUsage = call.plannedUsage();
        BudgetContext planned = context.budget()
                .withPlannedTokens(plannedUsage.inputTokens(), plannedUsage.outputTokens());
        BudgetLedger.Reservation reservation = ledger.reserve(planned, model.costFor(plannedUsage))
                .orElseThrow(() -> new BudgetExceededException(planned.principal(),
                        "Daily budget exhausted for " + planned.principal() + " (model " + model.name() + ")"));
        CircuitBreaker breaker = breakers.forModel(model.name());
        if (!breaker.allow()) {
            ledger.reconcile(reservation, 0.0);
            throw new ProviderUnavailableException("Model " + model.name() + " is unavailable (circuit open)");
        }
        return dispatch(model, breaker, reservation, call, context.costs());
    }

    // ═══════════════════════════════════════════════════════
    // Call factories
    // ═══════════════════════════════════════════════════════

    public ProviderCall<float[]> embedding(String text) {
        TokenUsage planned = new TokenUsage(TokenUsage.estimateTokens(text), 0);
        return new ProviderCall<>() {
            @Override
            public TokenUsage plannedUsage() {
                return planned;
            }

            @Override
            public Outcome<float[]> execute(ModelProfile model) {
                Optional<EmbeddingStrategy> embedder = clients.embedderFor(model);
                if (embedder.isEmpty()) {
                    return Outcome.failed(ProviderFailureType.TRANSPORT,
                            "No embedding client for provider " + model.provider());
                }
                EmbeddingStrategy.EmbeddingResult result = embedder.get().generateEmbedding(text, model);
                if (!result.isSuccessful()) {
                    return Outcome.failed(result.getFailureType(), result.getErrorMessage());
                }
                if (model.dimensions() > 0 && result.getDimensions() != model.dimensions()) {
                    return Outcome.failed(ProviderFailureType.MALFORMED_RESPONSE, "Expected " + model.dimensions()
                            + " dimensions from " + model.name() + ", got " + result.getDimensions());
                }
                return Outcome.success(result.getEmbedding(), result.getUsage());
            }
        };
    }

    public ProviderCall<String> completion(String prompt, int maxOutputTokens) {
        TokenUsage planned = new TokenUsage(TokenUsage.estimateTokens(prompt), maxOutputTokens);
        return new ProviderCall<>() {
            @Override
            public TokenUsage plannedUsage() {
                return planned;
            }

            @Override
            public Outcome<String> execute(ModelProfile model) {
                Optional<TextGenerationStrategy> generator = clients.generatorFor(model);
                if (generator.isEmpty()) {
                    return Outcome.failed(ProviderFailureType.TRANSPORT,
                            "No text generation client for provider " + model.provider());
                }
                TextGenerationStrategy.CompletionResult result =
                        generator.get().generateText(prompt, model, maxOutputTokens);
                if (!result.isSuccessful()) {
                    return Outcome.failed(result.getFailureType(), result.getErrorMessage());
                }
                return Outcome.success(result.getText(), result.getUsage());
            }
        };
    }

    // ═══════════════════════════════════════════════════════
    // Dispatch
    // ═══════════════════════════════════════════════════════

    private <T> Invocation<T> dispatch(ModelProfile model, CircuitBreaker breaker,
            BudgetLedger.Reservation reservation, ProviderCall<T> call, CostAccumulator costs) {
        long startedAt = System.nanoTime();
        CompletableFuture<ProviderCall.Outcome<T>> future =
                CompletableFuture.supplyAsync(() -> call.execute(model), providerExecutor);

        ProviderCall.Outcome<T> outcome;
        try {
            outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            breaker.recordFailure();
            performance.recordFailure(model.name(), elapsedMs(startedAt), ProviderFailureType.TIMEOUT, null, 0.0);
            future.whenComplete((late, error) ->
                    settleLate(model, reservation, call, late, false, startedAt, breaker, costs));
            throw new ProviderCallFailedException(model.name(), ProviderFailureType.TIMEOUT,
                    "Call to " + model.name() + " timed out after " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.whenComplete((late, error) ->
                    settleLate(model, reservation, call, late, true, startedAt, breaker, costs));
            throw new InvocationCancelledException("cancelled");
        } catch (ExecutionException e) {
            // No usage was reported, so nothing is charged
            breaker.recordFailure();
            ledger.reconcile(reservation, 0.0);
            performance.recordFailure(model.name(), elapsedMs(startedAt), ProviderFailureType.TRANSPORT, null, 0.0);
            log.error("Provider client for {} threw unexpectedly", model.name(), e.getCause());
            throw new ProviderCallFailedException(model.name(), ProviderFailureType.TRANSPORT,
                    "Call to " + model.name() + " failed", e.getCause());
        }

        if (!outcome.isSuccessful()) {
            breaker.recordFailure();
            double wasted = model.costFor(outcome.usage());
            ledger.reconcile(reservation, wasted);
            costs.add(wasted);
            performance.recordFailure(model.name(), elapsedMs(startedAt), outcome.failureType(), outcome.usage(),
                    wasted);
            throw new ProviderCallFailedException(model.name(), outcome.failureType(), outcome.errorMessage());
        }

        breaker.recordSuccess();
        TokenUsage usage = effectiveUsage(outcome.usage(), call);
        double cost = model.costFor(usage);
        ledger.reconcile(reservation, cost);
        costs.add(cost);
        performance.recordSuccess(model.name(), elapsedMs(startedAt), usage, cost);
        log.debug("Call to {} used {} input / {} output tokens, cost ${}", model.name(), usage.inputTokens(),
                usage.outputTokens(), String.format("%.6f", cost));
        return new Invocation<>(outcome.value(), model, usage, cost, false);
    }

    /**
     * Completion of a call whose caller stopped waiting. The cost is still
     * reconciled; a cancelled caller's breaker outcome is recorded here since
     * nobody else will. A timed-out call was already counted as a failure.
     */
    private <T> void settleLate(ModelProfile model, BudgetLedger.Reservation reservation, ProviderCall<T> call,
            ProviderCall.Outcome<T> late, boolean recordOutcome, long startedAt, CircuitBreaker breaker,
            CostAccumulator costs) {
        if (late == null) {
            ledger.reconcile(reservation, 0.0);
            if (recordOutcome) {
                breaker.recordFailure();
                performance.recordFailure(model.name(), elapsedMs(startedAt), ProviderFailureType.TRANSPORT, null,
                        0.0);
            }
            log.debug("Abandoned call to {} ended exceptionally, nothing charged", model.name());
            return;
        }
        TokenUsage usage = late.isSuccessful() ? effectiveUsage(late.usage(), call) : late.usage();
        double cost = model.costFor(usage);
        ledger.reconcile(reservation, cost);
        costs.add(cost);
        if (!recordOutcome) {
            performance.recordLateCost(model.name(), usage, cost);
        } else if (late.isSuccessful()) {
            breaker.recordSuccess();
            performance.recordSuccess(model.name(), elapsedMs(startedAt), usage, cost);
        } else {
            breaker.recordFailure();
            performance.recordFailure(model.name(), elapsedMs(startedAt), late.failureType(), usage, cost);
        }
        log.info("Reconciled abandoned call to {} at ${}", model.name(), String.format("%.6f", cost));
    }

    private static long elapsedMs(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }

    // Providers that report no usage are charged the planned size
    private static TokenUsage effectiveUsage(TokenUsage reported, ProviderCall<?> call) {
        return reported == null || reported.totalTokens() == 0 ? call.plannedUsage() : reported;
    }
}
