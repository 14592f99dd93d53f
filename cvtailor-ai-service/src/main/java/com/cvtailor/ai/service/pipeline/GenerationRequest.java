package com.cvtailor.ai.service.pipeline;

import com.cvtailor.ai.service.selection.SelectionStrategy;
import com.cvtailor.common.entity.Artifact;
import com.cvtailor.common.entity.DocumentType;
import lombok.Builder;

import java.util.List;

/**
 * One "tailor my CV to this posting" invocation.
 *
 * @param requestId    idempotency key; a terminal id is never re-executed
 * @param artifacts    evidence to rank; null means load the user's set from persistence
 * @param requirements pre-parsed posting; null means parse {@code jobText}
 * @param strategy     model selection strategy; null means the configured default
 */
@Builder(toBuilder = true)
public record GenerationRequest(
        String requestId,
        String userId,
        String tier,
        String jobText,
        String companyName,
        String roleTitle,
        List<Artifact> artifacts,
        DocumentType documentType,
        GenerationPreferences preferences,
        JobRequirements requirements,
        SelectionStrategy strategy
) {
    public GenerationRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId is required");
        }
        documentType = documentType == null ? DocumentType.CV : documentType;
        preferences = preferences == null ? GenerationPreferences.DEFAULT : preferences;
        artifacts = artifacts == null ? null : List.copyOf(artifacts);
    }
}
