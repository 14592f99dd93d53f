package com.cvtailor.ai.service.pipeline;

import java.util.List;

/**
 * User-facing knobs rendered into the generation prompt.
 *
 * @param tone       "professional", "conversational", ...
 * @param length     "concise", "balanced", "detailed"
 * @param focusAreas themes to emphasise, e.g. "leadership", "backend"
 */
public record GenerationPreferences(String tone, String length, List<String> focusAreas) {

    public static final GenerationPreferences DEFAULT =
            new GenerationPreferences("professional", "balanced", List.of("general"));

    public GenerationPreferences {
        tone = tone == null || tone.isBlank() ? "professional" : tone;
        length = length == null || length.isBlank() ? "balanced" : length;
        focusAreas = focusAreas == null || focusAreas.isEmpty() ? List.of("general") : List.copyOf(focusAreas);
    }
}
