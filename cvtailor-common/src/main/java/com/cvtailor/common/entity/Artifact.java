package com.cvtailor.common.entity;

import java.util.List;

/**
 * A piece of evidence from the candidate's profile: a project, a role, a
 * publication. Loaded through {@link com.cvtailor.common.repository.GenerationPersistence}.
 *
 * @param id          stable identifier, also used as the ranking tie-break
 * @param userId      owner
 * @param title       short title ("Payments platform rewrite")
 * @param artifactType free-form category (project, experience, education...)
 * @param description human-written summary
 * @param skills      declared skills / technologies
 * @param textContent full text used for embedding; may be blank
 */
public record Artifact(
        Long id,
        String userId,
        String title,
        String artifactType,
        String description,
        List<String> skills,
        String textContent
) {
    public Artifact {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    /**
     * Text that represents this artifact for similarity ranking. Falls back to
     * title + description + skills when no full text was extracted.
     */
    public String embeddingText() {
        if (textContent != null && !textContent.isBlank()) {
            return textContent;
        }
        StringBuilder sb = new StringBuilder();
        if (title != null) sb.append(title).append('\n');
        if (description != null) sb.append(description).append('\n');
        if (!skills.isEmpty()) sb.append(String.join(", ", skills));
        return sb.toString().trim();
    }
}
