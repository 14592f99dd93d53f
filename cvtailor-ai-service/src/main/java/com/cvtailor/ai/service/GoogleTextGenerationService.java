package com.cvtailor.ai.service;

import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.service.strategy.TextGenerationStrategy;
import com.cvtailor.ai.service.strategy.TokenUsage;
import com.cvtailor.common.exception.ProviderFailureType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini implementation of TextGenerationStrategy
 *
 * CONCEPT: Strategy Pattern, Concrete Strategy
 * - Calls generateContent with JSON output requested
 * - No @Service annotation, instantiated by LLMProviderFactory
 * - Token usage comes from usageMetadata
 */
@Slf4j
public class GoogleTextGenerationService implements TextGenerationStrategy {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final Duration timeout;

    public GoogleTextGenerationService(String apiKey, String baseUrl, Duration timeout) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getProviderName() {
        return "google";
    }

    @Override
    public CompletionResult generateText(String prompt, ModelProfile model, int maxOutputTokens) {
        try {
            log.info("[google/{}] Calling for text generation...", model.name());
            log.debug("Prompt length: {} characters", prompt.length());

            Map<String, Object> requestBody = Map.of(
                    "contents", List.of(
                            Map.of("parts", List.of(
                                    Map.of("text", prompt)))),
                    "generationConfig", Map.of(
                            "temperature", 0.3,
                            "maxOutputTokens", maxOutputTokens,
                            "responseMimeType", "application/json"));

            String response = webClient
                    .post()
                    .uri(baseUrl + "/models/" + model.name() + ":generateContent?key=" + apiKey)
                    .header("Content-Type", "application/json")
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();

            return parseGenerationResponse(response);

        } catch (Exception e) {
            ProviderFailureType type = ProviderErrors.classify(e);
            log.error("[google/{}] Text generation failed ({}): {}", model.name(), type, e.getMessage());
            return CompletionResult.failed(type, "Text generation failed: " + ProviderErrors.describe(e));
        }
    }

    /**
     * Parse Google's response: candidates[0].content.parts[0].text plus
     * usageMetadata
     */
    @SuppressWarnings("unchecked")
    CompletionResult parseGenerationResponse(String response) {
        try {
            Map<String, Object> responseMap = objectMapper.readValue(response, Map.class);

            List<Map<String, Object>> candidates = (List<Map<String, Object>>) responseMap.get("candidates");
            if (candidates == null || candidates.isEmpty()) {
                return CompletionResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "No candidates in response");
            }

            Map<String, Object> content = (Map<String, Object>) candidates.get(0).get("content");
            if (content == null) {
                return CompletionResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "No content in candidate");
            }

            List<Map<String, Object>> parts = (List<Map<String, Object>>) content.get("parts");
            if (parts == null || parts.isEmpty()) {
                return CompletionResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "No parts in content");
            }

            String generatedText = (String) parts.get(0).get("text");
            if (generatedText == null || generatedText.trim().isEmpty()) {
                return CompletionResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "Empty generated text");
            }

            TokenUsage usage = TokenUsage.NONE;
            Map<String, Object> metadata = (Map<String, Object>) responseMap.get("usageMetadata");
            if (metadata != null) {
                usage = new TokenUsage(ProviderErrors.intValue(metadata.get("promptTokenCount")),
                        ProviderErrors.intValue(metadata.get("candidatesTokenCount")));
                log.debug("Token usage - Prompt: {}, Completion: {}", usage.inputTokens(), usage.outputTokens());
            }

            return CompletionResult.success(generatedText.trim(), usage);

        } catch (Exception e) {
            log.error("Failed to parse generation response: {}", e.getMessage());
            return CompletionResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "Parse error: " + e.getMessage());
        }
    }
}
