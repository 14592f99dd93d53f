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
 * Chat-completions client for OpenAI-compatible APIs (Groq, OpenAI).
 *
 * CONCEPT: OpenAI-compatible Chat Completions API
 * - Request: messages array with role + content
 * - Response: choices[0].message.content plus a usage block
 * - One instance per provider key, differing only in base URL and API key
 */
@Slf4j
public class OpenAiCompatibleTextGenerationService implements TextGenerationStrategy {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String providerName;
    private final String apiKey;
    private final String baseUrl;
    private final Duration timeout;

    public OpenAiCompatibleTextGenerationService(String providerName, String apiKey, String baseUrl,
            Duration timeout) {
        this.providerName = providerName;
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
        return providerName;
    }

    @Override
    public CompletionResult generateText(String prompt, ModelProfile model, int maxOutputTokens) {
        try {
            log.info("[{}/{}] Calling for text generation...", providerName, model.name());
            log.debug("Prompt length: {} characters", prompt.length());

            Map<String, Object> requestBody = Map.of(
                    "model", model.name(),
                    "messages", List.of(
                            Map.of(
                                    "role", "user",
                                    "content", prompt)),
                    "temperature", 0.3,
                    "max_tokens", maxOutputTokens,
                    "response_format", Map.of("type", "json_object"),
                    "stream", false);

            String response = webClient
                    .post()
                    .uri(baseUrl + "/chat/completions")
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();

            return parseCompletionResponse(response);

        } catch (Exception e) {
            ProviderFailureType type = ProviderErrors.classify(e);
            log.error("[{}/{}] Text generation failed ({}): {}", providerName, model.name(), type, e.getMessage());
            return CompletionResult.failed(type, "Text generation failed: " + ProviderErrors.describe(e));
        }
    }

    /**
     * Parse an OpenAI-format response:
     * {
     * "choices": [{ "message": { "role": "assistant", "content": "..." } }],
     * "usage": { "prompt_tokens": X, "completion_tokens": Y }
     * }
     */
    @SuppressWarnings("unchecked")
    CompletionResult parseCompletionResponse(String response) {
        try {
            Map<String, Object> responseMap = objectMapper.readValue(response, Map.class);

            if (responseMap.containsKey("error")) {
                Map<String, Object> error = (Map<String, Object>) responseMap.get("error");
                String code = String.valueOf(error.get("code"));
                ProviderFailureType type = "rate_limit_exceeded".equals(code)
                        ? ProviderFailureType.RATE_LIMITED
                        : ProviderFailureType.TRANSPORT;
                return CompletionResult.failed(type, providerName + " API error: " + error.get("message"));
            }

            List<Map<String, Object>> choices = (List<Map<String, Object>>) responseMap.get("choices");
            if (choices == null || choices.isEmpty()) {
                return CompletionResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "No choices in response");
            }

            Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
            if (message == null) {
                return CompletionResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "No message in choice");
            }

            String generatedText = (String) message.get("content");
            if (generatedText == null || generatedText.trim().isEmpty()) {
                return CompletionResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "Empty generated text");
            }

            TokenUsage usage = TokenUsage.NONE;
            if (responseMap.containsKey("usage")) {
                Map<String, Object> usageMap = (Map<String, Object>) responseMap.get("usage");
                usage = new TokenUsage(ProviderErrors.intValue(usageMap.get("prompt_tokens")),
                        ProviderErrors.intValue(usageMap.get("completion_tokens")));
                log.debug("Token usage - Prompt: {}, Completion: {}, Total: {}",
                        usage.inputTokens(), usage.outputTokens(), usage.totalTokens());
            }

            return CompletionResult.success(generatedText.trim(), usage);

        } catch (Exception e) {
            log.error("Failed to parse {} response: {}", providerName, e.getMessage());
            return CompletionResult.failed(ProviderFailureType.MALFORMED_RESPONSE, "Parse error: " + e.getMessage());
        }
    }
}
