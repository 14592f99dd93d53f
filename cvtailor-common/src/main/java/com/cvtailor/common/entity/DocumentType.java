package com.cvtailor.common.entity;

import java.util.Locale;

/**
 * Kinds of tailored document the generation pipeline can produce.
 *
 * Used across the pipeline:
 * - CvPromptBuilder picks the requested output sections by type
 * - GenerationResult records which type was produced
 */
public enum DocumentType {

    CV, // Full tailored resume
    COVER_LETTER; // Letter addressed to the posting

    /**
     * Normalize a free-text document type ("cv", "Cover Letter", "resume") into
     * the enum. Anything unrecognized falls back to CV.
     */
    public static DocumentType fromString(String raw) {
        if (raw == null || raw.isBlank())
            return CV;

        String normalized = raw.trim().toLowerCase(Locale.ROOT)
                .replace("-", " ")
                .replace("_", " ");

        if (normalized.contains("cover") || normalized.contains("letter")) {
            return COVER_LETTER;
        }
        return CV;
    }
}
