package com.cvtailor.ai.service.matching;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Pure functions comparing a candidate's declared skills to a job's
 * requirements.
 *
 * A candidate skill matches a requirement when, ignoring case, either string
 * contains the other ("Spring" matches "Spring Boot" and vice versa).
 */
public final class SkillMatcher {

    private SkillMatcher() {
    }

    /**
     * @return round(matched / required * 10), 0 when there are no requirements
     */
    public static int score(Collection<String> candidateSkills, Collection<String> requiredSkills) {
        List<String> required = clean(requiredSkills);
        if (required.isEmpty()) {
            return 0;
        }
        List<String> candidates = clean(candidateSkills);
        long matched = required.stream()
                .filter(requirement -> matchesAny(requirement, candidates))
                .count();
        return (int) Math.round(matched * 10.0 / required.size());
    }

    /**
     * Requirements no candidate skill satisfies, in the order given and with
     * their original casing.
     */
    public static Set<String> missing(Collection<String> candidateSkills, Collection<String> requiredSkills) {
        List<String> candidates = clean(candidateSkills);
        Set<String> missing = new LinkedHashSet<>();
        for (String requirement : clean(requiredSkills)) {
            if (!matchesAny(requirement, candidates)) {
                missing.add(requirement);
            }
        }
        return missing;
    }

    public static boolean matches(String candidateSkill, String requirement) {
        String candidate = candidateSkill.trim().toLowerCase(Locale.ROOT);
        String required = requirement.trim().toLowerCase(Locale.ROOT);
        if (candidate.isEmpty() || required.isEmpty()) {
            return false;
        }
        return candidate.contains(required) || required.contains(candidate);
    }

    private static boolean matchesAny(String requirement, List<String> candidates) {
        for (String candidate : candidates) {
            if (matches(candidate, requirement)) {
                return true;
            }
        }
        return false;
    }

    // Drops null and blank entries; duplicates are kept so the ratio reflects the list as given
    private static List<String> clean(Collection<String> skills) {
        if (skills == null) {
            return List.of();
        }
        return skills.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
