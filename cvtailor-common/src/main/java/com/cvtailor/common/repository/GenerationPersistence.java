package com.cvtailor.common.repository;

import com.cvtailor.common.entity.Artifact;
import com.cvtailor.common.entity.GenerationResult;

import java.util.List;

/**
 * Storage collaborator for the generation pipeline. The orchestration core
 * does not assume a storage engine; the outer application supplies the bean.
 */
public interface GenerationPersistence {

    // Called once per state change (processing, then terminal)
    void saveResult(String requestId, GenerationResult result);

    // All artifacts owned by the user, with declared skills and text content; empty for a null user
    List<Artifact> loadArtifactSet(String userId);
}
