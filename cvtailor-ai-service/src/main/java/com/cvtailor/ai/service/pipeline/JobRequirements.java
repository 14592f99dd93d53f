package com.cvtailor.ai.service.pipeline;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured view of a job posting.
 */
public record JobRequirements(
        String roleTitle,
        String seniorityLevel,
        List<String> mustHaveSkills,
        List<String> niceToHaveSkills,
        List<String> keyResponsibilities
) {
    public JobRequirements {
        mustHaveSkills = mustHaveSkills == null ? List.of() : List.copyOf(mustHaveSkills);
        niceToHaveSkills = niceToHaveSkills == null ? List.of() : List.copyOf(niceToHaveSkills);
        keyResponsibilities = keyResponsibilities == null ? List.of() : List.copyOf(keyResponsibilities);
    }

    public static JobRequirements ofSkills(List<String> mustHave, List<String> niceToHave) {
        return new JobRequirements(null, null, mustHave, niceToHave, List.of());
    }

    /**
     * Must-have followed by nice-to-have; the basis of the match score.
     */
    public List<String> allSkills() {
        List<String> all = new ArrayList<>(mustHaveSkills);
        all.addAll(niceToHaveSkills);
        return List.copyOf(all);
    }

    /**
     * Requirements reported as missing: must-have, or everything when the
     * posting lists no must-haves.
     */
    public List<String> gapBasis() {
        return mustHaveSkills.isEmpty() ? allSkills() : mustHaveSkills;
    }
}
