package com.cvtailor.ai.service.selection;

import java.util.Locale;

/**
 * Kind of provider work a model can be selected for.
 */
public enum TaskType {

    EMBEDDING, // Text → vector, used for cache keys and similarity ranking
    JOB_PARSING, // Job posting → structured requirements
    CV_GENERATION; // Requirements + artifacts → tailored document content

    /**
     * Accepts config spellings: "cv_generation", "cv-generation", "CV_GENERATION".
     */
    public static TaskType fromConfig(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task type must not be blank");
        }
        return TaskType.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
