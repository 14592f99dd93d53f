package com.cvtailor.ai.service.cache;

import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.support.MutableClock;
import com.cvtailor.ai.support.Profiles;
import com.cvtailor.common.exception.InvocationCancelledException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ContentCache, covering exact hits, single-flight computation and validation.
 */
class ContentCacheTest {

    private static final String CV_TEXT = "Built payment services in Java and Spring Boot for five years";

    private final ModelProfile small = Profiles.embedding("text-embedding-3-small", "openai", 0.00002, 3);
    private final ModelProfile large = Profiles.embedding("text-embedding-3-large", "openai", 0.00013, 3);

    private ContentCache cache;

    @BeforeEach
    void setUp() {
        cache = new ContentCache(1000, Duration.ofHours(1), ContentCache.NearDuplicatePolicy.DISABLED,
                MutableClock.atNoon());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Exact lookups
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should hit on normalized content and count the access")
    void lookup_shouldHitOnNormalizedContent() {
        cache.store(CV_TEXT, small, new float[]{0.1f, 0.2f, 0.3f}, 0.0001, "user:1");

        Optional<CacheEntry> hit = cache.lookup("  " + CV_TEXT.replace(" ", "\n "), small);

        assertTrue(hit.isPresent());
        assertEquals(3, hit.get().getDimensions());
        assertEquals(1, hit.get().getAccessCount());
        assertNotNull(hit.get().getLastAccessed());
    }

    @Test
    @DisplayName("Entries are keyed per model")
    void lookup_shouldMissForOtherModel() {
        cache.store(CV_TEXT, small, new float[]{0.1f, 0.2f, 0.3f}, 0.0001, "user:1");

        assertTrue(cache.lookup(CV_TEXT, large).isEmpty());
    }

    @Test
    @DisplayName("Second store of the same content should keep the first entry")
    void store_shouldBeIdempotent() {
        ContentCache.StoreOutcome first = cache.store(CV_TEXT, small, new float[]{1f, 0f, 0f}, 0.01, "user:1");
        ContentCache.StoreOutcome second = cache.store(CV_TEXT, small, new float[]{0f, 1f, 0f}, 0.01, "user:2");

        assertTrue(first.stored());
        assertFalse(second.stored());
        assertSame(first.entry(), second.entry());
        assertArrayEquals(new float[]{1f, 0f, 0f}, cache.lookup(CV_TEXT, small).orElseThrow().getEmbedding());
        assertEquals(1, cache.statistics().embeddingEntries());
    }

    @Test
    @DisplayName("Returned embeddings are copies")
    void getEmbedding_shouldNotExposeInternalArray() {
        cache.store(CV_TEXT, small, new float[]{1f, 2f, 3f}, 0.0, "user:1");

        cache.lookup(CV_TEXT, small).orElseThrow().getEmbedding()[0] = 99f;

        assertEquals(1f, cache.lookup(CV_TEXT, small).orElseThrow().getEmbedding()[0]);
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Single-flight computation
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Concurrent requests for the same content should compute and charge once")
    void getOrCompute_shouldComputeOnceUnderContention() throws Exception {
        int threads = 12;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger computations = new AtomicInteger();
        List<Future<ContentCache.ComputeOutcome>> futures = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return cache.getOrCompute(CV_TEXT, small, "user:1", () -> {
                    computations.incrementAndGet();
                    sleepQuietly(50);
                    return new ContentCache.ComputedEmbedding(new float[]{0.5f, 0.5f, 0.5f}, 0.0002);
                });
            }));
        }
        start.countDown();

        int paid = 0;
        CacheEntry first = null;
        for (Future<ContentCache.ComputeOutcome> future : futures) {
            ContentCache.ComputeOutcome outcome = future.get(5, TimeUnit.SECONDS);
            if (outcome.computed()) {
                paid++;
            }
            if (first == null) {
                first = outcome.entry();
            }
            assertSame(first, outcome.entry());
        }
        pool.shutdown();

        assertEquals(1, computations.get());
        assertEquals(1, paid);
        assertEquals(1, cache.statistics().embeddingEntries());
    }

    @Test
    @DisplayName("A failed computation should not leave an entry behind")
    void getOrCompute_failureShouldNotCache() {
        assertThrows(IllegalStateException.class, () -> cache.getOrCompute(CV_TEXT, small, "user:1", () -> {
            throw new IllegalStateException("provider down");
        }));

        assertTrue(cache.lookup(CV_TEXT, small).isEmpty());
        ContentCache.ComputeOutcome retry = cache.getOrCompute(CV_TEXT, small, "user:1",
                () -> new ContentCache.ComputedEmbedding(new float[]{1f, 1f, 1f}, 0.0));
        assertTrue(retry.computed());
    }

    @Test
    @DisplayName("A waiter should not inherit another caller's failure and should compute on its own")
    void getOrCompute_waiterShouldRetryAfterOtherCallerFails() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        AtomicInteger secondComputations = new AtomicInteger();

        Future<ContentCache.ComputeOutcome> first = pool.submit(() ->
                cache.getOrCompute(CV_TEXT, small, "user:1", () -> {
                    firstEntered.countDown();
                    awaitQuietly(releaseFirst);
                    throw new InvocationCancelledException("cancelled");
                }));
        assertTrue(firstEntered.await(5, TimeUnit.SECONDS));

        Future<ContentCache.ComputeOutcome> second = pool.submit(() ->
                cache.getOrCompute(CV_TEXT, small, "user:2", () -> {
                    secondComputations.incrementAndGet();
                    return new ContentCache.ComputedEmbedding(new float[]{0.3f, 0.3f, 0.3f}, 0.0002);
                }));
        sleepQuietly(100);
        assertFalse(second.isDone());
        releaseFirst.countDown();

        ExecutionException firstError = assertThrows(ExecutionException.class,
                () -> first.get(5, TimeUnit.SECONDS));
        assertInstanceOf(InvocationCancelledException.class, firstError.getCause());

        ContentCache.ComputeOutcome outcome = second.get(5, TimeUnit.SECONDS);
        pool.shutdown();

        assertTrue(outcome.computed());
        assertEquals(1, secondComputations.get());
        assertArrayEquals(new float[]{0.3f, 0.3f, 0.3f}, cache.lookup(CV_TEXT, small).orElseThrow().getEmbedding());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Inconsistent entries
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Entry with the wrong dimensionality should be evicted and treated as a miss")
    void lookup_wrongDimensionsShouldBeMiss() {
        cache.store(CV_TEXT, small, new float[]{0.1f, 0.2f}, 0.0, "user:1");

        assertTrue(cache.lookup(CV_TEXT, small).isEmpty());
        assertEquals(1, cache.statistics().inconsistencies());
        assertEquals(0, cache.statistics().embeddingEntries());
    }

    @Test
    @DisplayName("Entry with NaN values should be treated as a miss")
    void lookup_nonFiniteShouldBeMiss() {
        cache.store(CV_TEXT, small, new float[]{0.1f, Float.NaN, 0.3f}, 0.0, "user:1");

        assertTrue(cache.lookup(CV_TEXT, small).isEmpty());
        assertEquals(1, cache.statistics().inconsistencies());
    }

    @Test
    @DisplayName("Derived entry of an unexpected type should be treated as a miss")
    void lookupDerived_typeMismatchShouldBeMiss() {
        cache.storeDerived("global", "job-requirements", "abc", "not a requirements object", "gpt-4o", 0.01);

        assertTrue(cache.lookupDerived("global", "job-requirements", "abc", Integer.class).isEmpty());
        assertTrue(cache.lookupDerived("global", "job-requirements", "abc", String.class).isEmpty());
        assertEquals(1, cache.statistics().inconsistencies());
    }

    @Test
    @DisplayName("Derived entries are isolated by scope")
    void lookupDerived_shouldRespectScope() {
        cache.storeDerived("user:1", "generation", "fp", "content", "gpt-4o", 0.01);

        assertEquals(Optional.of("content"), cache.lookupDerived("user:1", "generation", "fp", String.class));
        assertTrue(cache.lookupDerived("user:2", "generation", "fp", String.class).isEmpty());
    }

    @Test
    @DisplayName("Derived hits should be counted with the cost they avoided")
    void lookupDerived_shouldTrackReuse() {
        cache.storeDerived("user:1", "generation", "fp", "content", "gpt-4o", 0.02);

        cache.lookupDerived("user:1", "generation", "fp", String.class);
        cache.lookupDerived("user:1", "generation", "fp", String.class);

        ContentCache.DerivedMetadata metadata = cache.describeDerived("user:1", "generation", "fp").orElseThrow();
        assertEquals("gpt-4o", metadata.model());
        assertEquals(0.02, metadata.costUsd(), 1e-12);
        assertEquals(2, metadata.accessCount());
        assertEquals(MutableClock.atNoon().instant(), metadata.createdAt());
        assertEquals(2, cache.statistics().derivedHits());
        assertEquals(0.04, cache.statistics().derivedSavedUsd(), 1e-12);
        assertTrue(cache.describeDerived("user:2", "generation", "fp").isEmpty());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Near-duplicate reuse
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Near-duplicate reuse is off by default")
    void lookup_nearDuplicateDisabledShouldMiss() {
        cache.store(CV_TEXT, small, new float[]{1f, 2f, 3f}, 0.0, "user:1");

        assertTrue(cache.lookup(CV_TEXT + ".", small, "user:1").isEmpty());
    }

    @Test
    @DisplayName("When enabled, near-duplicates should hit within the same scope only")
    void lookup_nearDuplicateShouldStayInScope() {
        ContentCache nearCache = new ContentCache(1000, Duration.ofHours(1),
                new ContentCache.NearDuplicatePolicy(true, 0.9, 50, false), MutableClock.atNoon());
        nearCache.store(CV_TEXT, small, new float[]{1f, 2f, 3f}, 0.0, "user:1");

        assertTrue(nearCache.lookup(CV_TEXT + ".", small, "user:1").isPresent());
        assertTrue(nearCache.lookup(CV_TEXT + ".", small, "user:2").isEmpty());
        assertTrue(nearCache.lookup("Enjoys mountain hiking at weekends", small, "user:1").isEmpty());
        assertEquals(1, nearCache.statistics().nearDuplicateHits());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
