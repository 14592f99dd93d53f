package com.cvtailor.ai.service.pipeline;

import com.cvtailor.common.entity.Artifact;
import com.cvtailor.common.entity.DocumentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CvPromptBuilderTest {

    private final CvPromptBuilder builder = new CvPromptBuilder();

    private final JobRequirements requirements = new JobRequirements("Backend Engineer", "senior",
            List.of("Java"), List.of("Kafka"), List.of("Design APIs"));

    @Test
    @DisplayName("CV prompt should include requirements, artifacts, preferences and section keys")
    void build_shouldAssembleCvPrompt() {
        Artifact artifact = new Artifact(7L, "u-1", "Payments platform", "project", "Rewrite",
                List.of("Java"), "x".repeat(2000));

        String prompt = builder.build(DocumentType.CV, requirements, List.of(artifact), GenerationPreferences.DEFAULT);

        assertTrue(prompt.contains("professional CV"));
        assertTrue(prompt.contains("Backend Engineer"));
        assertTrue(prompt.contains("Payments platform"));
        assertTrue(prompt.contains("professional_summary, key_skills, experience, projects, education, certifications"));
        assertTrue(prompt.contains("\"tone\" : \"professional\""));
        assertFalse(prompt.contains("x".repeat(1501)), "artifact text is truncated");
    }

    @Test
    @DisplayName("Cover letter prompt should ask for cover letter sections")
    void build_shouldAssembleCoverLetterPrompt() {
        String prompt = builder.build(DocumentType.COVER_LETTER, requirements, List.of(), GenerationPreferences.DEFAULT);

        assertTrue(prompt.contains("professional cover letter"));
        assertTrue(prompt.contains("opening, body_paragraphs, closing"));
    }

    @Test
    @DisplayName("Should keep only known sections in document order")
    void parseContent_shouldFilterSections() {
        Map<String, Object> content = builder.parseContent(DocumentType.CV,
                "{\"experience\": [], \"professional_summary\": \"Engineer\", \"hobbies\": \"chess\"}");

        assertEquals(List.of("professional_summary", "experience"), List.copyOf(content.keySet()));
    }

    @Test
    @DisplayName("Reply without the leading section should be rejected")
    void parseContent_shouldRequireLeadingSection() {
        assertThrows(IllegalArgumentException.class,
                () -> builder.parseContent(DocumentType.CV, "{\"key_skills\": [\"Java\"]}"));
        assertThrows(IllegalArgumentException.class,
                () -> builder.parseContent(DocumentType.COVER_LETTER, "{\"professional_summary\": \"x\"}"));
    }
}
