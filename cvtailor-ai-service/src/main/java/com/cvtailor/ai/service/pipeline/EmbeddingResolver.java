package com.cvtailor.ai.service.pipeline;

import com.cvtailor.ai.service.budget.BudgetLedger;
import com.cvtailor.ai.service.cache.CacheEntry;
import com.cvtailor.ai.service.cache.ContentCache;
import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.service.selection.ModelSelector;
import com.cvtailor.ai.service.selection.TaskType;
import com.cvtailor.ai.service.strategy.TokenUsage;
import com.cvtailor.ai.service.text.Chunker;
import com.cvtailor.ai.service.text.TextChunk;
import com.cvtailor.ai.service.text.VectorMath;
import com.cvtailor.common.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cache-first embedding of arbitrary text. Long text is chunked and the chunk
 * vectors are averaged; each chunk is one paid call.
 */
@Slf4j
public class EmbeddingResolver {

    private final ContentCache cache;
    private final Chunker chunker;
    private final ModelInvoker invoker;
    private final ModelSelector selector;
    private final BudgetLedger ledger;

    public EmbeddingResolver(ContentCache cache, Chunker chunker, ModelInvoker invoker, ModelSelector selector,
            BudgetLedger ledger) {
        this.cache = cache;
        this.chunker = chunker;
        this.invoker = invoker;
        this.selector = selector;
        this.ledger = ledger;
    }

    /**
     * Embeds with any embedding model. A vector already cached under one of
     * them is reused before a new model is selected.
     */
    public Invocation<float[]> embed(String text, InvocationContext context) {
        return embed(text, context, Set.of());
    }

    public Invocation<float[]> embed(String text, InvocationContext context, Set<String> excludedModels) {
        for (ModelProfile model : selector.orderedProfiles(TaskType.EMBEDDING, context.strategy())) {
            if (excludedModels.contains(model.name())) {
                continue;
            }
            Optional<CacheEntry> hit = cache.lookup(text, model, context.scope());
            if (hit.isPresent()) {
                log.debug("Embedding cache hit under {}", model.name());
                return Invocation.cached(hit.get().getEmbedding(), model);
            }
        }
        TokenUsage planned = new TokenUsage(TokenUsage.estimateTokens(text), 0);
        return invoker.withFallback(TaskType.EMBEDDING, context, planned, excludedModels,
                model -> embedWith(text, model, context));
    }

    /**
     * Embeds with one fixed model so the vector is comparable to others from
     * the same model.
     */
    public Invocation<float[]> embedWith(String text, ModelProfile model, InvocationContext context) {
        AtomicReference<Invocation<float[]>> paid = new AtomicReference<>();
        ContentCache.ComputeOutcome outcome = cache.getOrCompute(text, model, context.scope(), () -> {
            Invocation<float[]> computed = embedChunks(text, model, context);
            paid.set(computed);
            return new ContentCache.ComputedEmbedding(computed.value(), computed.costUsd());
        });

        Invocation<float[]> mine = paid.get();
        if (mine != null && !outcome.computed()) {
            // Another writer stored first: this computation becomes a hit and its charge is taken back
            ledger.reconcile(context.budget(), mine.costUsd(), 0.0);
            context.costs().refund(mine.costUsd());
            log.debug("Lost store race for {}, refunded ${}", model.name(), mine.costUsd());
        }
        if (outcome.computed() && mine != null) {
            return mine;
        }
        return Invocation.cached(outcome.entry().getEmbedding(), model);
    }

    private Invocation<float[]> embedChunks(String text, ModelProfile model, InvocationContext context) {
        List<TextChunk> chunks = chunker.split(text);
        if (chunks.isEmpty()) {
            throw new InvalidInputException("no content available");
        }
        List<float[]> vectors = new ArrayList<>(chunks.size());
        TokenUsage usage = TokenUsage.NONE;
        double cost = 0.0;
        for (TextChunk chunk : chunks) {
            Invocation<float[]> part = invoker.invokeOn(model, context, invoker.embedding(chunk.text()));
            vectors.add(part.value());
            usage = usage.plus(part.usage());
            cost += part.costUsd();
        }
        if (chunks.size() > 1) {
            log.debug("Embedded {} chunks with {}", chunks.size(), model.name());
        }
        return new Invocation<>(VectorMath.mean(vectors), model, usage, cost, false);
    }
}
