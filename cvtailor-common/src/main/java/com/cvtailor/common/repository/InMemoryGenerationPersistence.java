package com.cvtailor.common.repository;

import com.cvtailor.common.entity.Artifact;
import com.cvtailor.common.entity.GenerationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local {@link GenerationPersistence}. Used when the outer application
 * does not register its own store, and by tests.
 */
@Slf4j
public class InMemoryGenerationPersistence implements GenerationPersistence {

    private final Map<String, GenerationResult> results = new ConcurrentHashMap<>();
    private final Map<String, List<Artifact>> artifactsByUser = new ConcurrentHashMap<>();

    @Override
    public void saveResult(String requestId, GenerationResult result) {
        results.put(requestId, result);
        log.debug("Saved result {} ({})", requestId, result.getStatus());
    }

    @Override
    public List<Artifact> loadArtifactSet(String userId) {
        if (userId == null) {
            return List.of();
        }
        return List.copyOf(artifactsByUser.getOrDefault(userId, List.of()));
    }

    public void addArtifact(Artifact artifact) {
        artifactsByUser.computeIfAbsent(artifact.userId(), k -> new CopyOnWriteArrayList<>()).add(artifact);
    }

    public Optional<GenerationResult> findResult(String requestId) {
        return Optional.ofNullable(results.get(requestId));
    }
}
