package com.cvtailor.ai.config;

import com.cvtailor.ai.service.selection.ModelProfile;
import com.cvtailor.ai.service.selection.ModelRegistry;
import com.cvtailor.ai.service.selection.TaskType;
import com.cvtailor.ai.service.strategy.EmbeddingStrategy;
import com.cvtailor.ai.service.strategy.ProviderClients;
import com.cvtailor.ai.service.strategy.TextGenerationStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Spring Configuration for provider clients
 *
 * HOW THIS WORKS:
 * 1. The model registry names a provider for every model
 * 2. This class creates one client per provider that some model needs
 * 3. Credentials and base URLs are read here, nowhere else
 */
@Slf4j
@Configuration
public class LLMProviderConfig {

    // ═══════════════════════════════════════════════════════
    // Google Configuration
    // ═══════════════════════════════════════════════════════

    @Value("${google.genai.api-key:}")
    private String googleApiKey;

    @Value("${google.genai.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String googleBaseUrl;

    // ═══════════════════════════════════════════════════════
    // Groq Configuration
    // ═══════════════════════════════════════════════════════

    @Value("${groq.api-key:}")
    private String groqApiKey;

    @Value("${groq.base-url:https://api.groq.com/openai/v1}")
    private String groqBaseUrl;

    // ═══════════════════════════════════════════════════════
    // OpenAI Configuration
    // ═══════════════════════════════════════════════════════

    @Value("${openai.api-key:}")
    private String openaiApiKey;

    @Value("${openai.base-url:https://api.openai.com/v1}")
    private String openaiBaseUrl;

    @Bean
    public ProviderClients providerClients(ModelRegistry registry, OrchestrationProperties properties) {
        Duration timeout = properties.getPipeline().getProviderTimeout();

        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("CONFIGURING PROVIDER CLIENTS");

        List<EmbeddingStrategy> embedders = providersFor(registry, TaskType.EMBEDDING).stream()
                .map(provider -> {
                    Endpoint endpoint = endpoint(provider);
                    return LLMProviderFactory.createEmbeddingGenerator(provider, endpoint.apiKey(),
                            endpoint.baseUrl(), timeout);
                })
                .toList();

        List<TextGenerationStrategy> generators =
                providersFor(registry, TaskType.JOB_PARSING, TaskType.CV_GENERATION).stream()
                        .map(provider -> {
                            Endpoint endpoint = endpoint(provider);
                            return LLMProviderFactory.createTextGenerator(provider, endpoint.apiKey(),
                                    endpoint.baseUrl(), timeout);
                        })
                        .toList();

        log.info("   Embedding providers: {}", embedders.stream().map(EmbeddingStrategy::getProviderName).toList());
        log.info("   Generation providers: {}",
                generators.stream().map(TextGenerationStrategy::getProviderName).toList());
        log.info("   Provider timeout: {}s", timeout.toSeconds());
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");

        return new ProviderClients(embedders, generators);
    }

    private static Set<String> providersFor(ModelRegistry registry, TaskType... tasks) {
        Set<String> providers = new TreeSet<>();
        Stream.of(tasks)
                .flatMap(task -> registry.profilesFor(task).stream())
                .map(ModelProfile::provider)
                .map(name -> name.toLowerCase(Locale.ROOT))
                .forEach(providers::add);
        return providers;
    }

    private Endpoint endpoint(String provider) {
        Endpoint endpoint = switch (provider) {
            case "google" -> new Endpoint(googleApiKey, googleBaseUrl);
            case "groq" -> new Endpoint(groqApiKey, groqBaseUrl);
            case "openai" -> new Endpoint(openaiApiKey, openaiBaseUrl);
            default -> throw new IllegalArgumentException("Unknown provider: " + provider);
        };
        log.info("   {} API key loaded: {}", provider,
                endpoint.apiKey() != null && endpoint.apiKey().length() > 4
                        ? endpoint.apiKey().substring(0, 4) + "..."
                        : "EMPTY OR NULL");
        return endpoint;
    }

    private record Endpoint(String apiKey, String baseUrl) {
    }
}
