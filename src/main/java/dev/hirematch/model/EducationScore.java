package dev.hirematch.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EducationScore(
        double degreeMatch,
        double fieldRelevance,
        double certifications,
        double totalScore,
        String error) implements ScoreBreakdown {

    public static EducationScore failed(String error) {
        return new EducationScore(0, 0, 0, 0, error);
    }
}
