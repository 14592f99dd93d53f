package com.cvtailor.ai.service;

import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.service.strategy.EmbeddingStrategy;
import com.cvtailor.ai.service.strategy.TokenUsage;
import com.cvtailor.common.exception.ProviderFailureType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Google Embeddings implementation of EmbeddingStrategy
 *
 * CONCEPT: Strategy Pattern, Concrete Strategy for Embeddings
 * - Talks to the Gemini embedContent endpoint
 * - No @Service annotation, instantiated by LLMProviderFactory
 * - The API does not report token usage, so usage is estimated from the text
 */
@Slf4j
public class GoogleEmbeddingsService implements EmbeddingStrategy {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final Duration timeout;

    public GoogleEmbeddingsService(String apiKey, String baseUrl, Duration timeout) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(5 * 1024 * 1024))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getProviderName() {
        return "google";
    }

    @Override
    public EmbeddingResult generateEmbedding(String text, ModelProfile model) {
        try {
            log.debug("[google/{}] Embedding {} characters", model.name(), text.length());

            Map<String, Object> requestBody = Map.of(
                    "model", "models/" + model.name(),
                    "content", Map.of(
                            "parts", List.of(Map.of("text", text))));

            String response = webClient
                    .post()
                    .uri(baseUrl + "/models/" + model.name() + ":embedContent?key=" + apiKey)
                    .header("Content-Type", "application/json")
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();

            return parseEmbeddingResponse(response, text);

        } catch (Exception e) {
            ProviderFailureType type = ProviderErrors.classify(e);
            log.error("[google/{}] Embedding call failed ({}): {}", model.name(), type, e.getMessage());
            return EmbeddingResult.failed(type, "Embedding call failed: " + ProviderErrors.describe(e));
        }
    }

    /**
     * Parse Google's response: {"embedding": {"values": [...]}}
     */
    @SuppressWarnings("unchecked")
    EmbeddingResult parseEmbeddingResponse(String response, String text) {
        try {
            Map<String, Object> responseMap = objectMapper.readValue(response, Map.class);

            Map<String, Object> embedding = (Map<String, Object>) responseMap.get("embedding");
            if (embedding == null) {
                return EmbeddingResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "No embedding in response");
            }

            List<Number> values = (List<Number>) embedding.get("values");
            if (values == null || values.isEmpty()) {
                return EmbeddingResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "No embedding values found");
            }

            float[] vector = new float[values.size()];
            for (int i = 0; i < values.size(); i++) {
                vector[i] = values.get(i).floatValue();
            }

            log.debug("[google] Embedding generated: {} dimensions", vector.length);
            return EmbeddingResult.success(vector, new TokenUsage(TokenUsage.estimateTokens(text), 0));

        } catch (Exception e) {
            log.error("Failed to parse embedding response: {}", e.getMessage());
            return EmbeddingResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "Parse error: " + e.getMessage());
        }
    }
}
