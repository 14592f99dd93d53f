package com.cvtailor.ai.service.strategy;

import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.common.exception.ProviderFailureType;

/**
 * Provider client for embeddings.
 *
 * CONCEPT: Strategy Pattern for Embeddings
 * - One implementation per provider API; the model is chosen per call
 * - Provider-side failures come back as a failed result, never as an exception
 */
public interface EmbeddingStrategy {

    /**
     * Convert text to an embedding vector with the given model
     */
    EmbeddingResult generateEmbedding(String text, ModelProfile model);

    /**
     * Provider key this client serves ("google", "openai")
     */
    String getProviderName();

    /**
     * Result of embedding generation, encapsulates success/failure states
     */
    class EmbeddingResult {
        private final float[] embedding;
        private final TokenUsage usage;
        private final String errorMessage;
        private final ProviderFailureType failureType;

        private EmbeddingResult(float[] embedding, TokenUsage usage, String errorMessage,
                ProviderFailureType failureType) {
            this.embedding = embedding;
            this.usage = usage;
            this.errorMessage = errorMessage;
            this.failureType = failureType;
        }

        public static EmbeddingResult success(float[] embedding, TokenUsage usage) {
            return new EmbeddingResult(embedding, usage == null ? TokenUsage.NONE : usage, null, null);
        }

        public static EmbeddingResult failed(ProviderFailureType failureType, String errorMessage) {
            return new EmbeddingResult(null, TokenUsage.NONE, errorMessage, failureType);
        }

        public float[] getEmbedding() {
            return embedding;
        }

        public TokenUsage getUsage() {
            return usage;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public ProviderFailureType getFailureType() {
            return failureType;
        }

        public boolean isSuccessful() {
            return failureType == null;
        }

        public int getDimensions() {
            return embedding != null ? embedding.length : 0;
        }
    }
}
