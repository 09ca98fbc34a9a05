package dev.hirematch.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Final hiring signal combining all factor scores.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OverallResult(
        double overallScore,
        ComponentScores componentScores,
        Recommendation recommendation,
        List<String> riskFactors,
        List<String> strengths,
        ConfidenceLevel decisionConfidence,
        String error) {

    public OverallResult {
        riskFactors = riskFactors != null ? List.copyOf(riskFactors) : List.of();
        strengths = strengths != null ? List.copyOf(strengths) : List.of();
    }

    public record ComponentScores(double skills, double experience, double education, double achievements) {
    }

    public record Recommendation(
            HiringDecision decision,
            ConfidenceLevel confidence,
            String reasoning,
            double score) {
    }

    public boolean hasError() {
        return error != null;
    }

    public static OverallResult failed(String error) {
        return new OverallResult(
                0,
                new ComponentScores(0, 0, 0, 0),
                new Recommendation(HiringDecision.DONT_HIRE, ConfidenceLevel.LOW,
                        "Scoring could not be completed", 0),
                List.of(),
                List.of(),
                ConfidenceLevel.LOW,
                error);
    }
}
