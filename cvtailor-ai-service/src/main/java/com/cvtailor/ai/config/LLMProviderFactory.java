package com.cvtailor.ai.config;

import com.cvtailor.ai.service.GoogleEmbeddingsService;
import com.cvtailor.ai.service.GoogleTextGenerationService;
import com.cvtailor.ai.service.OpenAiCompatibleEmbeddingsService;
import com.cvtailor.ai.service.OpenAiCompatibleTextGenerationService;
import com.cvtailor.ai.service.strategy.EmbeddingStrategy;
import com.cvtailor.ai.service.strategy.TextGenerationStrategy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;

/**
 * Factory for provider clients
 *
 * CONCEPT: Factory Pattern
 * - Provider name + endpoint settings → the right strategy implementation
 * - Models are not bound here; every client serves all models of its provider
 */
@Slf4j
public class LLMProviderFactory {

    private LLMProviderFactory() {
    }

    /**
     * @param provider "google", "groq" or "openai"
     * @throws IllegalArgumentException if provider is not supported
     */
    public static TextGenerationStrategy createTextGenerator(
            String provider, String apiKey, String baseUrl, Duration timeout) {

        return switch (provider.toLowerCase(Locale.ROOT)) {
            case "google" -> {
                log.info("Factory: Creating Google Gemini text generation client");
                yield new GoogleTextGenerationService(apiKey, baseUrl, timeout);
            }
            case "groq", "openai" -> {
                log.info("Factory: Creating OpenAI-compatible text generation client for {}", provider);
                yield new OpenAiCompatibleTextGenerationService(provider.toLowerCase(Locale.ROOT), apiKey, baseUrl, timeout);
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported text generation provider: '" + provider + "'. " +
                            "Supported providers: google, groq, openai. " +
                            "Check 'cvtailor.models[].provider' in application.yml.");
        };
    }

    /**
     * @param provider "google" or "openai"
     * @throws IllegalArgumentException if provider is not supported
     */
    public static EmbeddingStrategy createEmbeddingGenerator(
            String provider, String apiKey, String baseUrl, Duration timeout) {

        return switch (provider.toLowerCase(Locale.ROOT)) {
            case "google" -> {
                log.info("Factory: Creating Google embedding client");
                yield new GoogleEmbeddingsService(apiKey, baseUrl, timeout);
            }
            case "openai" -> {
                log.info("Factory: Creating OpenAI embedding client");
                yield new OpenAiCompatibleEmbeddingsService("openai", apiKey, baseUrl, timeout);
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported embedding provider: '" + provider + "'. " +
                            "Supported providers: google, openai. " +
                            "Check 'cvtailor.models[].provider' in application.yml.");
        };
    }
}
