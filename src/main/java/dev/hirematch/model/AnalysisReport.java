package dev.hirematch.model;

import java.util.List;
import java.util.Map;

/**
 * Everything produced for one candidate/job pair.
 */
public record AnalysisReport(
        CategorySkills candidateSkills,
        CategorySkills requiredSkills,
        SkillMatchResult skillMatch,
        SkillsScore skillsScore,
        ExperienceScore experienceScore,
        EducationScore educationScore,
        OverallResult overall,
        Map<String, List<String>> skillRecommendations,
        Map<String, SkillDepth> skillDepth) {
}
