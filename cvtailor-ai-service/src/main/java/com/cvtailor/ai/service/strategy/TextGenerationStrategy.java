package com.cvtailor.ai.service.strategy;

import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.common.exception.ProviderFailureType;

/**
 * Provider client for text generation (job parsing, CV content).
 *
 * CONCEPT: Strategy Pattern
 * - Common contract for every chat/completion API
 * - The caller picks the model; the client only knows how to talk to its API
 */
public interface TextGenerationStrategy {

    /**
     * Generate text from a prompt, capped at {@code maxOutputTokens}
     */
    CompletionResult generateText(String prompt, ModelProfile model, int maxOutputTokens);

    /**
     * Provider key this client serves ("google", "groq", "openai")
     */
    String getProviderName();

    /**
     * Result of one completion call, encapsulates success/failure states
     */
    class CompletionResult {
        private final String text;
        private final TokenUsage usage;
        private final String errorMessage;
        private final ProviderFailureType failureType;

        private CompletionResult(String text, TokenUsage usage, String errorMessage,
                ProviderFailureType failureType) {
            this.text = text;
            this.usage = usage;
            this.errorMessage = errorMessage;
            this.failureType = failureType;
        }

        public static CompletionResult success(String text, TokenUsage usage) {
            return new CompletionResult(text, usage == null ? TokenUsage.NONE : usage, null, null);
        }

        public static CompletionResult failed(ProviderFailureType failureType, String errorMessage) {
            return new CompletionResult(null, TokenUsage.NONE, errorMessage, failureType);
        }

        public String getText() {
            return text;
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
    }
}
