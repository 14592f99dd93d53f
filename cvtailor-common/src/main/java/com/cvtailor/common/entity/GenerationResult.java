package com.cvtailor.common.entity;

import com.cvtailor.common.exception.ErrorKind;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one generation request.
 *
 * Lifecycle: PENDING → PROCESSING → COMPLETED | FAILED. The terminal state is
 * set exactly once; any later attempt to change it throws.
 */
public class GenerationResult {

    private final String requestId;
    private final DocumentType documentType;

    private Status status = Status.PENDING;

    // Produced content
    private Map<String, Object> content = Map.of();
    private Integer skillMatchScore;
    private Set<String> missingSkills = Set.of();

    // Failure information
    private ErrorKind errorKind;
    private String errorMessage;

    // Generation metadata
    private double costUsd;
    private String modelUsed;
    private List<Long> artifactsUsed = List.of();
    private boolean fallbackUsed;
    private Long generationTimeMs;

    private final LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;

    public enum Status {
        PENDING, // Created, not dispatched yet
        PROCESSING, // Pipeline running
        COMPLETED, // Content produced
        FAILED // Terminal failure, see errorKind / errorMessage
    }

    public GenerationResult(String requestId, DocumentType documentType) {
        this.requestId = requestId;
        this.documentType = documentType;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    // Business Logic Methods
    public synchronized void markAsProcessing() {
        if (status != Status.PENDING) {
            throw new IllegalStateException(
                    "Request " + requestId + " cannot start processing from state " + status);
        }
        this.status = Status.PROCESSING;
        this.updatedAt = LocalDateTime.now();
    }

    public synchronized void markAsCompleted(Map<String, Object> content, int skillMatchScore,
            Set<String> missingSkills, double costUsd) {
        ensureNotTerminal();
        this.status = Status.COMPLETED;
        this.content = content == null ? Map.of() : Map.copyOf(content);
        this.skillMatchScore = skillMatchScore;
        this.missingSkills = missingSkills == null ? Set.of() : new LinkedHashSet<>(missingSkills);
        this.costUsd = costUsd;
        this.completedAt = LocalDateTime.now();
        this.updatedAt = this.completedAt;
    }

    public synchronized void markAsFailed(ErrorKind errorKind, String errorMessage, double costUsd) {
        ensureNotTerminal();
        this.status = Status.FAILED;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
        this.costUsd = costUsd;
        this.completedAt = LocalDateTime.now();
        this.updatedAt = this.completedAt;
    }

    private void ensureNotTerminal() {
        if (isTerminal()) {
            throw new IllegalStateException(
                    "Request " + requestId + " already reached terminal state " + status);
        }
    }

    // Helper Methods
    public synchronized boolean isTerminal() {
        return status == Status.COMPLETED || status == Status.FAILED;
    }

    public synchronized void recordGenerationMetadata(String modelUsed, List<Long> artifactsUsed,
            boolean fallbackUsed, long generationTimeMs) {
        this.modelUsed = modelUsed;
        this.artifactsUsed = artifactsUsed == null ? List.of() : List.copyOf(artifactsUsed);
        this.fallbackUsed = fallbackUsed;
        this.generationTimeMs = generationTimeMs;
        this.updatedAt = LocalDateTime.now();
    }

    // Getters
    public String getRequestId() {
        return requestId;
    }

    public DocumentType getDocumentType() {
        return documentType;
    }

    public synchronized Status getStatus() {
        return status;
    }

    public synchronized Map<String, Object> getContent() {
        return content;
    }

    public synchronized Integer getSkillMatchScore() {
        return skillMatchScore;
    }

    public synchronized Set<String> getMissingSkills() {
        return Set.copyOf(missingSkills);
    }

    public synchronized ErrorKind getErrorKind() {
        return errorKind;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    public synchronized double getCostUsd() {
        return costUsd;
    }

    public synchronized String getModelUsed() {
        return modelUsed;
    }

    public synchronized List<Long> getArtifactsUsed() {
        return artifactsUsed;
    }

    public synchronized boolean isFallbackUsed() {
        return fallbackUsed;
    }

    public synchronized Long getGenerationTimeMs() {
        return generationTimeMs;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public synchronized LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public synchronized LocalDateTime getCompletedAt() {
        return completedAt;
    }

    @Override
    public synchronized String toString() {
        return "GenerationResult{requestId=" + requestId + ", status=" + status
                + ", score=" + skillMatchScore + ", error=" + errorKind + "}";
    }
}
