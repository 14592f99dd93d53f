package com.cvtailor.ai.service.cache;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One cached embedding. Immutable once written except for the access
 * counters.
 */
public class CacheEntry {

    private final String contentHash;
    private final String model;
    private final float[] embedding;
    private final double costUsd;
    private final String scope;
    private final float[] sketch;
    private final Instant createdAt;

    private final AtomicLong accessCount = new AtomicLong(0);
    private volatile Instant lastAccessed;

    CacheEntry(String contentHash, String model, float[] embedding, double costUsd, String scope,
            float[] sketch, Instant createdAt) {
        this.contentHash = contentHash;
        this.model = model;
        this.embedding = embedding == null ? null : embedding.clone();
        this.costUsd = costUsd;
        this.scope = scope;
        this.sketch = sketch;
        this.createdAt = createdAt;
        this.lastAccessed = createdAt;
    }

    void recordAccess(Instant now) {
        accessCount.incrementAndGet();
        lastAccessed = now;
    }

    public String getContentHash() {
        return contentHash;
    }

    public String getModel() {
        return model;
    }

    public float[] getEmbedding() {
        return embedding == null ? null : embedding.clone();
    }

    public int getDimensions() {
        return embedding == null ? 0 : embedding.length;
    }

    // Cost paid once when the entry was computed; hits cost nothing
    public double getCostUsd() {
        return costUsd;
    }

    public String getScope() {
        return scope;
    }

    float[] sketch() {
        return sketch;
    }

    float[] rawEmbedding() {
        return embedding;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public long getAccessCount() {
        return accessCount.get();
    }

    public Instant getLastAccessed() {
        return lastAccessed;
    }
}
