package com.cvtailor.ai.service.pipeline;

import com.cvtailor.ai.service.budget.BudgetContext;
import com.cvtailor.ai.service.cache.ContentCache;
import com.cvtailor.ai.service.matching.SkillMatcher;
import com.cvtailor.ai.service.selection.SelectionStrategy;
import com.cvtailor.ai.service.selection.TaskType;
import com.cvtailor.ai.service.text.ContentHasher;
import com.cvtailor.common.entity.Artifact;
import com.cvtailor.common.entity.GenerationResult;
import com.cvtailor.common.exception.ErrorKind;
import com.cvtailor.common.exception.InvalidInputException;
import com.cvtailor.common.exception.InvocationCancelledException;
import com.cvtailor.common.exception.OrchestrationException;
import com.cvtailor.common.repository.GenerationPersistence;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Generation pipeline, handles the whole flow for one request:
 *
 * validate → parse job requirements → embed job + rank artifacts
 * → generate content → skill gap analysis → persist result
 *
 * Every step failure is terminal for the request and lands on the result as
 * FAILED with an {@link ErrorKind}. Provider retries beyond the single
 * alternate model inside {@link ModelInvoker} are left to whoever resubmits.
 */
@Slf4j
public class GenerationPipeline {

    static final String GENERATION_KIND = "generation";

    private final GenerationPersistence persistence;
    private final JobRequirementsParser requirementsParser;
    private final SimilarityRanker ranker;
    private final CvPromptBuilder promptBuilder;
    private final ModelInvoker invoker;
    private final ContentCache cache;
    private final ExecutorService workers;
    private final Settings settings;
    private final Clock clock;

    private final Cache<String, GenerationResult> terminalResults;
    private final Map<String, CompletableFuture<GenerationResult>> running = new ConcurrentHashMap<>();

    public GenerationPipeline(GenerationPersistence persistence, JobRequirementsParser requirementsParser,
            SimilarityRanker ranker, CvPromptBuilder promptBuilder, ModelInvoker invoker, ContentCache cache,
            ExecutorService workers, Settings settings, Clock clock) {
        this.persistence = persistence;
        this.requirementsParser = requirementsParser;
        this.ranker = ranker;
        this.promptBuilder = promptBuilder;
        this.invoker = invoker;
        this.cache = cache;
        this.workers = workers;
        this.settings = settings;
        this.clock = clock;
        this.terminalResults = Caffeine.newBuilder()
                .expireAfterWrite(settings.resultRetention())
                .maximumSize(settings.resultCapacity())
                .build();
    }

    // ═══════════════════════════════════════════════════════
    // Entry points
    // ═══════════════════════════════════════════════════════

    /**
     * Runs the request on the calling thread. A request id that already
     * reached a terminal state returns the stored result without any provider
     * call; a request id currently running is joined.
     */
    public GenerationResult run(GenerationRequest request) {
        GenerationResult finished = terminalResults.getIfPresent(request.requestId());
        if (finished != null) {
            log.info("Request {} already {}, returning stored result", request.requestId(), finished.getStatus());
            return finished;
        }

        CompletableFuture<GenerationResult> mine = new CompletableFuture<>();
        CompletableFuture<GenerationResult> inProgress = running.putIfAbsent(request.requestId(), mine);
        if (inProgress != null) {
            log.info("Request {} is already running, waiting for it", request.requestId());
            return inProgress.join();
        }

        try {
            GenerationResult result = execute(request);
            terminalResults.put(request.requestId(), result);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            running.remove(request.requestId(), mine);
        }
    }

    /**
     * Runs the request on the worker pool.
     */
    public PipelineHandle submit(GenerationRequest request) {
        CompletableFuture<GenerationResult> result = new CompletableFuture<>();
        AtomicBoolean claimed = new AtomicBoolean(false);

        Future<?> task = workers.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                result.complete(run(request));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });

        return new PipelineHandle(request.requestId(), result, task,
                () -> claimed.compareAndSet(false, true) ? cancelledBeforeStart(request) : null);
    }

    public Optional<GenerationResult> findTerminalResult(String requestId) {
        return Optional.ofNullable(terminalResults.getIfPresent(requestId));
    }

    // ═══════════════════════════════════════════════════════
    // Pipeline
    // ═══════════════════════════════════════════════════════

    private GenerationResult execute(GenerationRequest request) {
        MDC.put("requestId", request.requestId());
        try {
            return executeSteps(request);
        } finally {
            MDC.remove("requestId");
        }
    }

    private GenerationResult executeSteps(GenerationRequest request) {
        long startedAt = clock.millis();
        GenerationResult result = new GenerationResult(request.requestId(), request.documentType());
        result.markAsProcessing();
        persistence.saveResult(request.requestId(), result);

        BudgetContext budget = BudgetContext.of(request.userId(), request.tier());
        SelectionStrategy strategy = request.strategy() != null ? request.strategy() : settings.defaultStrategy();
        InvocationContext context = InvocationContext.of(budget, strategy, budget.principal());

        log.info("\nCV GENERATION PIPELINE");
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("Request: {}", request.requestId());
        log.info("Principal: {} (strategy {})", budget.principal(), strategy);
        log.info("Document: {}", request.documentType());

        try {
            // 1. Validate source content
            log.info("\nSTEP 1: Validating source content...");
            List<Artifact> artifacts = usableArtifacts(request);
            if (request.jobText() == null || request.jobText().isBlank() || artifacts.isEmpty()) {
                throw new InvalidInputException("no content available");
            }
            log.info("   {} artifacts, job text {} chars", artifacts.size(), request.jobText().length());
            checkCancelled();

            // 2. Job requirements
            log.info("\nSTEP 2: Resolving job requirements...");
            JobRequirements requirements = request.requirements() != null
                    ? request.requirements()
                    : requirementsParser.parse(request.jobText(), request.companyName(), request.roleTitle(),
                            context);
            checkCancelled();

            // 3. Embed job description and rank artifacts
            log.info("\nSTEP 3: Ranking artifacts by similarity...");
            SimilarityRanker.Ranking ranking = ranker.rank(request.jobText(), artifacts, context);
            List<Artifact> top = ranking.top(settings.topArtifacts());
            log.info("   Embedding model: {}, top artifacts: {}", ranking.jobEmbedding().model().name(),
                    top.stream().map(Artifact::id).toList());
            checkCancelled();

            // 4. Generate content
            log.info("\nSTEP 4: Generating {} content...", request.documentType());
            String prompt = promptBuilder.build(request.documentType(), requirements, top, request.preferences());
            GeneratedContent generated = generate(request, prompt, context);
            checkCancelled();

            // 5. Skill gap analysis
            log.info("\nSTEP 5: Computing skill match...");
            Set<String> candidateSkills = new LinkedHashSet<>();
            top.forEach(a -> candidateSkills.addAll(a.skills()));
            int score = SkillMatcher.score(candidateSkills, requirements.allSkills());
            Set<String> missing = SkillMatcher.missing(candidateSkills, requirements.gapBasis());
            log.info("   Score {}/10, missing {}", score, missing);

            // 6. Complete
            result.recordGenerationMetadata(generated.model(), top.stream().map(Artifact::id).toList(),
                    ranking.fallbackUsed() || generated.fallbackUsed(), clock.millis() - startedAt);
            result.markAsCompleted(generated.content(), score, missing, context.costs().total());

            log.info("\nPIPELINE COMPLETE");
            log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
            log.info("   Model: {}", generated.model());
            log.info("   Cost: ${}", String.format("%.6f", context.costs().total()));
            log.info("   Time: {} ms", result.getGenerationTimeMs());
            log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━\n");

        } catch (OrchestrationException e) {
            fail(result, e.getKind(), e.getMessage(), context, e);
        } catch (CancellationException e) {
            fail(result, ErrorKind.CANCELLED, "cancelled", context, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error in request {}", request.requestId(), e);
            fail(result, ErrorKind.PROVIDER_CALL_FAILED, "Generation failed due to an internal error", context, e);
        }

        persistence.saveResult(request.requestId(), result);
        return result;
    }

    /**
     * Generated output is user-scoped: it is keyed by the full prompt, which
     * embeds the user's artifacts.
     */
    private GeneratedContent generate(GenerationRequest request, String prompt, InvocationContext context) {
        String fingerprint = ContentHasher.fingerprint(prompt);
        Optional<GeneratedContent> cached = cache.lookupDerived(context.scope(), GENERATION_KIND, fingerprint,
                GeneratedContent.class);
        if (cached.isPresent()) {
            log.info("   Generated content served from cache");
            return cached.get().asCacheHit();
        }

        Invocation<Map<String, Object>> invocation = invoker.invoke(TaskType.CV_GENERATION, context,
                invoker.completion(prompt, settings.maxOutputTokens())
                        .thenParse(reply -> promptBuilder.parseContent(request.documentType(), reply)));

        GeneratedContent generated = new GeneratedContent(invocation.value(), invocation.model().name(),
                invocation.fallbackUsed());
        cache.storeDerived(context.scope(), GENERATION_KIND, fingerprint, generated, invocation.model().name(),
                invocation.costUsd());
        return generated;
    }

    private List<Artifact> usableArtifacts(GenerationRequest request) {
        List<Artifact> artifacts;
        if (request.artifacts() != null) {
            artifacts = request.artifacts();
        } else if (request.userId() != null && !request.userId().isBlank()) {
            artifacts = persistence.loadArtifactSet(request.userId());
        } else {
            // Tier-level request with nothing attached
            artifacts = List.of();
        }
        if (artifacts == null) {
            return List.of();
        }
        return artifacts.stream()
                .filter(a -> !a.embeddingText().isBlank())
                .toList();
    }

    private void fail(GenerationResult result, ErrorKind kind, String message, InvocationContext context,
            Exception cause) {
        log.error("PIPELINE FAILED: {} ({}): {}", result.getRequestId(), kind, message);
        log.debug("Failure cause", cause);
        result.markAsFailed(kind, message, context.costs().total());
    }

    private GenerationResult cancelledBeforeStart(GenerationRequest request) {
        GenerationResult result = new GenerationResult(request.requestId(), request.documentType());
        result.markAsFailed(ErrorKind.CANCELLED, "cancelled", 0.0);
        terminalResults.put(request.requestId(), result);
        persistence.saveResult(request.requestId(), result);
        log.info("Request {} cancelled before it started", request.requestId());
        return result;
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new InvocationCancelledException("cancelled");
        }
    }

    record GeneratedContent(Map<String, Object> content, String model, boolean fallbackUsed) {

        GeneratedContent asCacheHit() {
            return new GeneratedContent(content, model, false);
        }
    }

    /**
     * @param resultRetention how long terminal results are kept for idempotent re-runs
     */
    public record Settings(SelectionStrategy defaultStrategy, int topArtifacts, int maxOutputTokens,
            Duration resultRetention, long resultCapacity) {
    }
}
