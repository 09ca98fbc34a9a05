package dev.hirematch.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExperienceScore(
        double yearsOfExperience,
        double roleRelevance,
        double industryMatch,
        double careerProgression,
        double totalScore,
        int detectedYears,
        String error) implements ScoreBreakdown {

    public static ExperienceScore failed(String error) {
        return new ExperienceScore(0, 0, 0, 0, 0, 0, error);
    }
}
