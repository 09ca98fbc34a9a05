package dev.hirematch.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SkillsScore(
        double technicalSkills,
        double skillDepth,
        double skillRelevance,
        double totalScore,
        Details details,
        String error) implements ScoreBreakdown {

    public record Details(int exactMatchesCount, int missingSkillsCount, double overallMatchPercentage) {
    }

    public static SkillsScore failed(String error) {
        return new SkillsScore(0, 0, 0, 0, new Details(0, 0, 0), error);
    }
}
