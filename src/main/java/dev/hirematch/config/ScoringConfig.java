package dev.hirematch.config;

import dev.hirematch.model.RecommendationThresholds;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for recommendation thresholds and overall factor weights.
 * Loaded from application.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private double hireThreshold = 70;
    private double strongHireThreshold = 85;
    private Weights weights = new Weights();

    /**
     * Snapshot of the configured thresholds, validated.
     */
    public RecommendationThresholds toThresholds() {
        return new RecommendationThresholds(hireThreshold, strongHireThreshold);
    }

    @Data
    public static class Weights {
        private double skills = 0.35;
        private double experience = 0.30;
        private double education = 0.15;
        private double achievements = 0.10;
        // Declared alongside the others but not part of the overall score.
        private double culturalFit = 0.10;
    }
}
