package dev.hirematch.model;

/**
 * Score cutoffs separating Strong Hire, Hire and the lower recommendations.
 *
 * @param hireThreshold       minimum overall score for Hire
 * @param strongHireThreshold minimum overall score for Strong Hire
 */
public record RecommendationThresholds(double hireThreshold, double strongHireThreshold) {

    public static final RecommendationThresholds DEFAULT = new RecommendationThresholds(70, 85);

    public RecommendationThresholds {
        if (Double.isNaN(hireThreshold) || Double.isNaN(strongHireThreshold)
                || hireThreshold < 0 || strongHireThreshold > 100 || hireThreshold > strongHireThreshold) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 <= hire <= strongHire <= 100, got hire=" + hireThreshold
                            + ", strongHire=" + strongHireThreshold);
        }
    }
}
