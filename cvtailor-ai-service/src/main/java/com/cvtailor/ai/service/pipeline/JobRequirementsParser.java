package com.cvtailor.ai.service.pipeline;

import com.cvtailor.ai.service.cache.ContentCache;
import com.cvtailor.ai.service.selection.TaskType;
import com.cvtailor.ai.service.text.ContentHasher;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Turns raw job-posting text into {@link JobRequirements} with a
 * JOB_PARSING model. Results are input-scoped: the same posting parsed for
 * two users is paid for once.
 */
@Slf4j
public class JobRequirementsParser {

    static final String GLOBAL_SCOPE = "global";
    static final String DERIVED_KIND = "job-requirements";

    private final ModelInvoker invoker;
    private final ContentCache cache;
    private final int maxOutputTokens;

    public JobRequirementsParser(ModelInvoker invoker, ContentCache cache, int maxOutputTokens) {
        this.invoker = invoker;
        this.cache = cache;
        this.maxOutputTokens = maxOutputTokens;
    }

    public JobRequirements parse(String jobText, String companyName, String roleTitle, InvocationContext context) {
        String fingerprint = ContentHasher.fingerprint(jobText, nullToEmpty(companyName), nullToEmpty(roleTitle));
        Optional<JobRequirements> cached = cache.lookupDerived(GLOBAL_SCOPE, DERIVED_KIND, fingerprint,
                JobRequirements.class);
        if (cached.isPresent()) {
            log.info("   Job requirements served from cache");
            return cached.get();
        }

        String prompt = buildPrompt(jobText, companyName, roleTitle);
        Invocation<JobRequirements> parsed = invoker.invoke(TaskType.JOB_PARSING, context,
                invoker.completion(prompt, maxOutputTokens).thenParse(JobRequirementsParser::fromReply));

        cache.storeDerived(GLOBAL_SCOPE, DERIVED_KIND, fingerprint, parsed.value(), parsed.model().name(),
                parsed.costUsd());
        log.info("   Parsed requirements with {}: {} must-have, {} nice-to-have", parsed.model().name(),
                parsed.value().mustHaveSkills().size(), parsed.value().niceToHaveSkills().size());
        return parsed.value();
    }

    String buildPrompt(String jobText, String companyName, String roleTitle) {
        return """
                Parse this job description and extract structured information:

                Company: %s
                Role: %s
                Job Description:
                %s

                Extract the following information and return as valid JSON:
                {
                  "role_title": "The job title/position",
                  "seniority_level": "junior, mid, senior, lead, principal, etc.",
                  "must_have_skills": ["required skills and technologies"],
                  "nice_to_have_skills": ["preferred skills"],
                  "key_responsibilities": ["top 5 main responsibilities"]
                }

                Return only valid JSON, no additional text.
                """.formatted(nullToEmpty(companyName), nullToEmpty(roleTitle), jobText);
    }

    /**
     * @throws IllegalArgumentException when the reply carries no skill lists
     */
    static JobRequirements fromReply(String reply) {
        Map<String, Object> json = StructuredOutput.parseObject(reply);
        if (!json.containsKey("must_have_skills") && !json.containsKey("nice_to_have_skills")) {
            throw new IllegalArgumentException("reply has no skill lists");
        }
        return new JobRequirements(
                StructuredOutput.string(json, "role_title"),
                StructuredOutput.string(json, "seniority_level"),
                StructuredOutput.strings(json, "must_have_skills"),
                StructuredOutput.strings(json, "nice_to_have_skills"),
                StructuredOutput.strings(json, "key_responsibilities"));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
