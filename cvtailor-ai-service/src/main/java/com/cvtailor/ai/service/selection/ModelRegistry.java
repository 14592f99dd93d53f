package com.cvtailor.ai.service.selection;

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of configured model profiles. Built once at startup from
 * {@code cvtailor.models} and read-only afterwards.
 */
@Slf4j
public class ModelRegistry {

    private final Map<String, ModelProfile> profiles;

    public ModelRegistry(List<ModelProfile> profiles) {
        Map<String, ModelProfile> byName = new LinkedHashMap<>();
        for (ModelProfile profile : profiles) {
            if (byName.putIfAbsent(profile.name(), profile) != null) {
                throw new IllegalArgumentException("Duplicate model profile: " + profile.name());
            }
        }
        this.profiles = Map.copyOf(byName);
        log.info("Model registry loaded with {} profiles: {}", this.profiles.size(), byName.keySet());
    }

    public Optional<ModelProfile> find(String name) {
        return Optional.ofNullable(profiles.get(name));
    }

    /**
     * All profiles that support the task, ordered by name.
     */
    public List<ModelProfile> profilesFor(TaskType task) {
        return profiles.values().stream()
                .filter(p -> p.supports(task))
                .sorted(Comparator.comparing(ModelProfile::name))
                .toList();
    }

    public List<ModelProfile> all() {
        return profiles.values().stream()
                .sorted(Comparator.comparing(ModelProfile::name))
                .toList();
    }
}
