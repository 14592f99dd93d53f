package com.cvtailor.ai.service.cache;

import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.service.text.ContentHasher;
import com.cvtailor.ai.service.text.VectorMath;
import com.cvtailor.common.exception.CacheInconsistencyException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.function.Supplier;

/**
 * Stores computed embeddings and derived outputs keyed by content
 * fingerprint, so identical input is paid for once.
 *
 * Embeddings are input-scoped: any caller with the same normalized text and
 * model hits the same entry. Derived outputs (parsed requirements, generated
 * content) carry an explicit scope in their key and are kept in a separate
 * cache. Reads are lock-free; concurrent computations for one key collapse
 * into a single provider call.
 */
@Slf4j
public class ContentCache {

    private final Cache<CacheKey, CacheEntry> embeddings;
    private final Cache<String, DerivedEntry> derived;
    private final Map<CacheKey, CompletableFuture<CacheEntry>> inFlight = new ConcurrentHashMap<>();
    private final Map<String, ConcurrentLinkedDeque<CacheKey>> recentByModel = new ConcurrentHashMap<>();
    private final NearDuplicatePolicy nearDuplicate;
    private final Clock clock;

    private final AtomicLong nearDuplicateHits = new AtomicLong();
    private final AtomicLong inconsistencies = new AtomicLong();
    private final AtomicLong derivedHits = new AtomicLong();
    private final DoubleAdder derivedSavedUsd = new DoubleAdder();

    public ContentCache(long maximumSize, Duration expireAfterAccess, NearDuplicatePolicy nearDuplicate,
            Clock clock) {
        this.embeddings = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(expireAfterAccess)
                .recordStats()
                .build();
        this.derived = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(expireAfterAccess)
                .build();
        this.nearDuplicate = nearDuplicate;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════
    // Embeddings
    // ═══════════════════════════════════════════════════════

    /**
     * Exact lookup. A hit bumps the access counters and costs nothing.
     */
    public Optional<CacheEntry> lookup(String content, ModelProfile model) {
        CacheKey key = new CacheKey(model.name(), ContentHasher.fingerprint(content));
        return usable(key, embeddings.getIfPresent(key), model).map(this::touch);
    }

    /**
     * Exact lookup, then (when enabled) a near-duplicate scan over the most
     * recent entries of the same model.
     */
    public Optional<CacheEntry> lookup(String content, ModelProfile model, String scope) {
        Optional<CacheEntry> exact = lookup(content, model);
        if (exact.isPresent() || !nearDuplicate.enabled()) {
            return exact;
        }
        return findNearDuplicate(content, model, scope).map(this::touch);
    }

    /**
     * Idempotent write. When an entry for the same key already exists it wins
     * and {@link StoreOutcome#stored()} is false: the caller's computation must
     * then be treated as a cache hit and its cost not counted again.
     */
    public StoreOutcome store(String content, ModelProfile model, float[] embedding, double costUsd, String scope) {
        String hash = ContentHasher.fingerprint(content);
        CacheKey key = new CacheKey(model.name(), hash);
        float[] sketch = nearDuplicate.enabled() ? ContentHasher.sketch(content) : null;
        CacheEntry candidate = new CacheEntry(hash, model.name(), embedding, costUsd, scope, sketch, clock.instant());

        CacheEntry winner = embeddings.asMap().putIfAbsent(key, candidate);
        if (winner != null) {
            log.debug("Cache entry for {} ({}) already present, keeping the first writer", shortHash(hash),
                    model.name());
            return new StoreOutcome(winner, false);
        }
        remember(key);
        log.debug("Cached embedding {} ({} dims, model {})", shortHash(hash), candidate.getDimensions(),
                model.name());
        return new StoreOutcome(candidate, true);
    }

    /**
     * Returns the cached embedding or runs {@code computation} exactly once per
     * key, even when several pipelines ask for the same content concurrently.
     * Callers that waited on another caller's computation get a hit. When that
     * computation fails, waiters retry with their own computation: a failure
     * is only ever thrown to the caller whose computation raised it.
     */
    public ComputeOutcome getOrCompute(String content, ModelProfile model, String scope,
            Supplier<ComputedEmbedding> computation) {
        CacheKey key = new CacheKey(model.name(), ContentHasher.fingerprint(content));
        while (true) {
            Optional<CacheEntry> cached = lookup(content, model, scope);
            if (cached.isPresent()) {
                return new ComputeOutcome(cached.get(), false);
            }

            CompletableFuture<CacheEntry> mine = new CompletableFuture<>();
            CompletableFuture<CacheEntry> running = inFlight.putIfAbsent(key, mine);
            if (running != null) {
                CacheEntry shared = await(running);
                if (shared != null) {
                    return new ComputeOutcome(touch(shared), false);
                }
                inFlight.remove(key, running);
                log.debug("Concurrent computation for {} ({}) failed, retrying with this caller's own",
                        shortHash(key.contentHash()), model.name());
                continue;
            }
            return computeAs(mine, key, content, model, scope, computation);
        }
    }

    private ComputeOutcome computeAs(CompletableFuture<CacheEntry> mine, CacheKey key, String content,
            ModelProfile model, String scope, Supplier<ComputedEmbedding> computation) {
        try {
            CacheEntry raced = embeddings.getIfPresent(key);
            if (raced != null) {
                mine.complete(raced);
                return new ComputeOutcome(touch(raced), false);
            }
            ComputedEmbedding computed = computation.get();
            StoreOutcome outcome = store(content, model, computed.embedding(), computed.costUsd(), scope);
            mine.complete(outcome.entry());
            return new ComputeOutcome(outcome.entry(), outcome.stored());
        } catch (RuntimeException e) {
            inFlight.remove(key, mine);
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public void invalidate(String content, ModelProfile model) {
        embeddings.invalidate(new CacheKey(model.name(), ContentHasher.fingerprint(content)));
    }

    // ═══════════════════════════════════════════════════════
    // Derived outputs (scoped)
    // ═══════════════════════════════════════════════════════

    public <T> Optional<T> lookupDerived(String scope, String kind, String fingerprint, Class<T> type) {
        String key = derivedKey(scope, kind, fingerprint);
        DerivedEntry entry = derived.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!type.isInstance(entry.value())) {
            reportInconsistency(new CacheInconsistencyException(fingerprint,
                    "Derived " + kind + " entry holds " + entry.value().getClass().getSimpleName()
                            + ", expected " + type.getSimpleName()));
            derived.invalidate(key);
            return Optional.empty();
        }
        entry.recordAccess();
        derivedHits.incrementAndGet();
        derivedSavedUsd.add(entry.costUsd);
        return Optional.of(type.cast(entry.value()));
    }

    /**
     * Who produced a derived entry, what it cost and how often it was reused.
     */
    public Optional<DerivedMetadata> describeDerived(String scope, String kind, String fingerprint) {
        DerivedEntry entry = derived.getIfPresent(derivedKey(scope, kind, fingerprint));
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new DerivedMetadata(entry.model, entry.costUsd, entry.createdAt,
                entry.accessCount.get()));
    }

    public void storeDerived(String scope, String kind, String fingerprint, Object value, String model,
            double costUsd) {
        derived.asMap().putIfAbsent(derivedKey(scope, kind, fingerprint),
                new DerivedEntry(value, model, costUsd, clock.instant()));
    }

    public CacheStatistics statistics() {
        var stats = embeddings.stats();
        return new CacheStatistics(embeddings.estimatedSize(), derived.estimatedSize(), stats.hitCount(),
                stats.missCount(), nearDuplicateHits.get(), inconsistencies.get(), derivedHits.get(),
                derivedSavedUsd.sum());
    }

    // ═══════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════

    private Optional<CacheEntry> usable(CacheKey key, CacheEntry entry, ModelProfile model) {
        if (entry == null) {
            return Optional.empty();
        }
        try {
            validate(entry, model);
            return Optional.of(entry);
        } catch (CacheInconsistencyException e) {
            reportInconsistency(e);
            embeddings.invalidate(key);
            return Optional.empty();
        }
    }

    private void validate(CacheEntry entry, ModelProfile model) {
        float[] vector = entry.rawEmbedding();
        if (vector == null || vector.length == 0) {
            throw new CacheInconsistencyException(entry.getContentHash(), "Cached embedding has no values");
        }
        if (model.dimensions() > 0 && vector.length != model.dimensions()) {
            throw new CacheInconsistencyException(entry.getContentHash(), "Cached embedding has "
                    + vector.length + " dimensions, model " + model.name() + " produces " + model.dimensions());
        }
        if (!VectorMath.isFinite(vector)) {
            throw new CacheInconsistencyException(entry.getContentHash(), "Cached embedding contains NaN/Inf");
        }
    }

    private void reportInconsistency(CacheInconsistencyException e) {
        inconsistencies.incrementAndGet();
        log.warn("Cache inconsistency for {}: {} (treated as miss)", shortHash(e.getFingerprint()), e.getMessage());
    }

    private Optional<CacheEntry> findNearDuplicate(String content, ModelProfile model, String scope) {
        ConcurrentLinkedDeque<CacheKey> recent = recentByModel.get(model.name());
        if (recent == null) {
            return Optional.empty();
        }
        float[] query = ContentHasher.sketch(content);
        CacheEntry best = null;
        double bestSimilarity = nearDuplicate.threshold();

        Iterator<CacheKey> it = recent.descendingIterator();
        int inspected = 0;
        while (it.hasNext() && inspected < nearDuplicate.candidateLimit()) {
            CacheKey key = it.next();
            inspected++;
            CacheEntry candidate = embeddings.getIfPresent(key);
            if (candidate == null || candidate.sketch() == null) {
                continue;
            }
            if (!nearDuplicate.crossScope() && !sameScope(scope, candidate.getScope())) {
                continue;
            }
            double similarity = VectorMath.cosine(query, candidate.sketch());
            if (similarity >= bestSimilarity && usable(key, candidate, model).isPresent()) {
                best = candidate;
                bestSimilarity = similarity;
            }
        }
        if (best != null) {
            nearDuplicateHits.incrementAndGet();
            log.info("Near-duplicate cache hit {} (similarity {})", shortHash(best.getContentHash()),
                    String.format("%.4f", bestSimilarity));
        }
        return Optional.ofNullable(best);
    }

    private void remember(CacheKey key) {
        if (!nearDuplicate.enabled()) {
            return;
        }
        ConcurrentLinkedDeque<CacheKey> recent = recentByModel.computeIfAbsent(key.model(),
                m -> new ConcurrentLinkedDeque<>());
        recent.addLast(key);
        while (recent.size() > nearDuplicate.candidateLimit()) {
            recent.pollFirst();
        }
    }

    private CacheEntry touch(CacheEntry entry) {
        entry.recordAccess(clock.instant());
        return entry;
    }

    /**
     * Waits for another caller's computation. Returns null when it failed, so
     * the waiter can make its own attempt.
     */
    private static CacheEntry await(CompletableFuture<CacheEntry> running) {
        try {
            return running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a concurrent embedding");
        } catch (ExecutionException | CancellationException e) {
            return null;
        }
    }

    private static boolean sameScope(String a, String b) {
        return a != null && a.equals(b);
    }

    private static String derivedKey(String scope, String kind, String fingerprint) {
        return scope + "|" + kind + "|" + fingerprint;
    }

    private static String shortHash(String hash) {
        return hash == null || hash.length() <= 8 ? String.valueOf(hash) : hash.substring(0, 8) + "...";
    }

    /**
     * @param enabled        master switch; off unless product signs off on it
     * @param threshold      minimum cosine similarity of the lexical sketches
     * @param candidateLimit how many recent entries per model are scanned
     * @param crossScope     allow matches written under another scope (user)
     */
    public record NearDuplicatePolicy(boolean enabled, double threshold, int candidateLimit, boolean crossScope) {

        public static final NearDuplicatePolicy DISABLED = new NearDuplicatePolicy(false, 0.98, 0, false);
    }

    public record StoreOutcome(CacheEntry entry, boolean stored) {
    }

    /**
     * @param computed true when this call paid for the embedding
     */
    public record ComputeOutcome(CacheEntry entry, boolean computed) {
    }

    public record ComputedEmbedding(float[] embedding, double costUsd) {
    }

    /**
     * @param derivedSavedUsd provider cost avoided by derived-output hits
     */
    public record CacheStatistics(long embeddingEntries, long derivedEntries, long hits, long misses,
            long nearDuplicateHits, long inconsistencies, long derivedHits, double derivedSavedUsd) {
    }

    public record DerivedMetadata(String model, double costUsd, Instant createdAt, long accessCount) {
    }

    private static final class DerivedEntry {
        private final Object value;
        private final String model;
        private final double costUsd;
        private final Instant createdAt;
        private final AtomicLong accessCount = new AtomicLong();

        DerivedEntry(Object value, String model, double costUsd, Instant createdAt) {
            this.value = value;
            this.model = model;
            this.costUsd = costUsd;
            this.createdAt = createdAt;
        }

        Object value() {
            return value;
        }

        void recordAccess() {
            accessCount.incrementAndGet();
        }
    }
}
