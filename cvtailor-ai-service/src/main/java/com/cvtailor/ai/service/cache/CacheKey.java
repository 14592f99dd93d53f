package com.cvtailor.ai.service.cache;

/**
 * Embeddings from different models live in different vector spaces, so the
 * model name is part of the key next to the content fingerprint.
 */
public record CacheKey(String model, String contentHash) {
}
