package com.cvtailor.ai.service.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SkillMatcher, covering scoring, gap detection and fuzzy matching.
 */
class SkillMatcherTest {

    @Test
    @DisplayName("Two of three requirements met should round to 7")
    void score_shouldRoundRatio() {
        assertEquals(7, SkillMatcher.score(List.of("Python", "Django", "JavaScript"),
                List.of("Python", "Django", "React")));
    }

    @Test
    @DisplayName("No candidate skills should score 0")
    void score_noSkillsShouldBeZero() {
        assertEquals(0, SkillMatcher.score(List.of(), List.of("Python")));
    }

    @Test
    @DisplayName("No requirements should score 0")
    void score_noRequirementsShouldBeZero() {
        assertEquals(0, SkillMatcher.score(List.of("Python"), List.of()));
        assertEquals(0, SkillMatcher.score(List.of("Python"), null));
    }

    @Test
    @DisplayName("All requirements met should score 10")
    void score_fullMatchShouldBeTen() {
        assertEquals(10, SkillMatcher.score(List.of("java", "Spring Boot"), List.of("Java", "Spring")));
    }

    @Test
    @DisplayName("Missing should list unmet requirements in order")
    void missing_shouldReturnUnmetRequirements() {
        Set<String> missing = SkillMatcher.missing(List.of("Python", "Django"),
                List.of("Python", "Django", "React", "TypeScript"));

        assertEquals(List.of("React", "TypeScript"), List.copyOf(missing));
    }

    @Test
    @DisplayName("Null and blank skills should be ignored")
    void missing_shouldIgnoreBlankEntries() {
        Set<String> missing = SkillMatcher.missing(Arrays.asList("Python", null, " "),
                Arrays.asList("python ", "", null, "Go"));

        assertEquals(Set.of("Go"), missing);
    }

    @Test
    @DisplayName("Containment should match in both directions, ignoring case")
    void matches_shouldBeBidirectional() {
        assertTrue(SkillMatcher.matches("Spring", "spring boot"));
        assertTrue(SkillMatcher.matches("PostgreSQL", "SQL"));
        assertFalse(SkillMatcher.matches("Java", "Kotlin"));
        assertFalse(SkillMatcher.matches("", "Java"));
    }
}
