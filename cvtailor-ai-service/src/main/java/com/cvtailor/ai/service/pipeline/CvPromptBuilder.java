package com.cvtailor.ai.service.pipeline;

import com.cvtailor.common.entity.Artifact;
import com.cvtailor.common.entity.DocumentType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the generation prompt from parsed requirements, the top-ranked
 * artifacts and the user's preferences, and validates the structured reply.
 */
public class CvPromptBuilder {

    static final List<String> CV_SECTIONS = List.of(
            "professional_summary", "key_skills", "experience", "projects", "education", "certifications");
    static final List<String> COVER_LETTER_SECTIONS = List.of(
            "opening", "body_paragraphs", "closing");

    private static final int ARTIFACT_TEXT_LIMIT = 1500;

    public String build(DocumentType type, JobRequirements requirements, List<Artifact> artifacts,
            GenerationPreferences preferences) {
        String document = type == DocumentType.COVER_LETTER ? "cover letter" : "CV";
        return """
                Generate a professional %s based on job requirements and user artifacts.

                Job Requirements:
                %s

                User Artifacts (most relevant first):
                %s

                Preferences:
                %s

                Return a JSON object with exactly these keys: %s.
                Ensure all content is grounded in the provided artifacts. Do NOT fabricate employers, dates,
                degrees or skills that the artifacts do not mention.
                """.formatted(
                document,
                StructuredOutput.toJson(describe(requirements)),
                StructuredOutput.toJson(artifacts.stream().map(CvPromptBuilder::describe).toList()),
                StructuredOutput.toJson(describe(preferences)),
                String.join(", ", sectionsFor(type)));
    }

    /**
     * @throws IllegalArgumentException when the reply is not JSON or lacks the
     *                                  leading section of the document type
     */
    public Map<String, Object> parseContent(DocumentType type, String reply) {
        Map<String, Object> json = StructuredOutput.parseObject(reply);
        List<String> sections = sectionsFor(type);
        String required = sections.get(0);
        if (json.get(required) == null) {
            throw new IllegalArgumentException("reply is missing '" + required + "'");
        }
        Map<String, Object> content = new LinkedHashMap<>();
        for (String section : sections) {
            if (json.containsKey(section)) {
                content.put(section, json.get(section));
            }
        }
        return content;
    }

    static List<String> sectionsFor(DocumentType type) {
        return type == DocumentType.COVER_LETTER ? COVER_LETTER_SECTIONS : CV_SECTIONS;
    }

    private static Map<String, Object> describe(JobRequirements requirements) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (requirements.roleTitle() != null) out.put("role_title", requirements.roleTitle());
        if (requirements.seniorityLevel() != null) out.put("seniority_level", requirements.seniorityLevel());
        out.put("must_have_skills", requirements.mustHaveSkills());
        out.put("nice_to_have_skills", requirements.niceToHaveSkills());
        out.put("key_responsibilities", requirements.keyResponsibilities());
        return out;
    }

    private static Map<String, Object> describe(Artifact artifact) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", artifact.id());
        out.put("title", artifact.title());
        out.put("type", artifact.artifactType());
        out.put("description", artifact.description());
        out.put("skills", artifact.skills());
        String text = artifact.textContent();
        if (text != null && !text.isBlank()) {
            out.put("content", text.length() > ARTIFACT_TEXT_LIMIT ? text.substring(0, ARTIFACT_TEXT_LIMIT) : text);
        }
        return out;
    }

    private static Map<String, Object> describe(GenerationPreferences preferences) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tone", preferences.tone());
        out.put("length", preferences.length());
        out.put("focus_areas", preferences.focusAreas());
        return out;
    }
}
