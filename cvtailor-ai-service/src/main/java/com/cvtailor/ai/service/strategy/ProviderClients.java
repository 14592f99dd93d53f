package com.cvtailor.ai.service.strategy;

import com.cvtailor.ai.service.selection.ModelProfile;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Provider clients keyed by provider name, resolved per model.
 */
public class ProviderClients {

    private final Map<String, EmbeddingStrategy> embedders;
    private final Map<String, TextGenerationStrategy> generators;

    public ProviderClients(Collection<EmbeddingStrategy> embedders, Collection<TextGenerationStrategy> generators) {
        this.embedders = embedders.stream()
                .collect(Collectors.toUnmodifiableMap(e -> key(e.getProviderName()), Function.identity()));
        this.generators = generators.stream()
                .collect(Collectors.toUnmodifiableMap(g -> key(g.getProviderName()), Function.identity()));
    }

    public Optional<EmbeddingStrategy> embedderFor(ModelProfile model) {
        return Optional.ofNullable(embedders.get(key(model.provider())));
    }

    public Optional<TextGenerationStrategy> generatorFor(ModelProfile model) {
        return Optional.ofNullable(generators.get(key(model.provider())));
    }

    private static String key(String provider) {
        return provider.toLowerCase(Locale.ROOT);
    }
}
