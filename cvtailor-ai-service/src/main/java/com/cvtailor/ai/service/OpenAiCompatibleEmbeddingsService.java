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
 * Embeddings client for the OpenAI /embeddings endpoint
 * (text-embedding-3-small / -large).
 */
@Slf4j
public class OpenAiCompatibleEmbeddingsService implements EmbeddingStrategy {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final String apiKey;
    private final String baseUrl;
    private final Duration timeout;

    public OpenAiCompatibleEmbeddingsService(String providerName, String apiKey, String baseUrl,
            Duration timeout) {
        this.providerName = providerName;
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
        return providerName;
    }

    @Override
    public EmbeddingResult generateEmbedding(String text, ModelProfile model) {
        try {
            log.debug("[{}/{}] Embedding {} characters", providerName, model.name(), text.length());

            String response = webClient
                    .post()
                    .uri(baseUrl + "/embeddings")
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .bodyValue(Map.of("model", model.name(), "input", text))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();

            return parseEmbeddingResponse(response);

        } catch (Exception e) {
            ProviderFailureType type = ProviderErrors.classify(e);
            log.error("[{}/{}] Embedding call failed ({}): {}", providerName, model.name(), type, e.getMessage());
            return EmbeddingResult.failed(type, "Embedding call failed: " + ProviderErrors.describe(e));
        }
    }

    /**
     * Parse {"data": [{"embedding": [...]}], "usage": {"prompt_tokens": N}}
     */
    @SuppressWarnings("unchecked")
    EmbeddingResult parseEmbeddingResponse(String response) {
        try {
            Map<String, Object> responseMap = objectMapper.readValue(response, Map.class);

            List<Map<String, Object>> data = (List<Map<String, Object>>) responseMap.get("data");
            if (data == null || data.isEmpty()) {
                return EmbeddingResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "No data in response");
            }

            List<Number> values = (List<Number>) data.get(0).get("embedding");
            if (values == null || values.isEmpty()) {
                return EmbeddingResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "No embedding values found");
            }

            float[] vector = new float[values.size()];
            for (int i = 0; i < values.size(); i++) {
                vector[i] = values.get(i).floatValue();
            }

            TokenUsage usage = TokenUsage.NONE;
            Map<String, Object> usageMap = (Map<String, Object>) responseMap.get("usage");
            if (usageMap != null) {
                usage = new TokenUsage(ProviderErrors.intValue(usageMap.get("prompt_tokens")), 0);
            }
            return EmbeddingResult.success(vector, usage);

        } catch (Exception e) {
            log.error("Failed to parse {} embedding response: {}", providerName, e.getMessage());
            return EmbeddingResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "Parse error: " + e.getMessage());
        }
    }
}
