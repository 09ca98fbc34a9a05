package dev.hirematch.model;

import java.util.Map;
import java.util.Set;

/**
 * Per-category and aggregate comparison of a candidate's skills against the required ones.
 *
 * @param exactMatches   skills both required and held, per category with a requirement
 * @param missingSkills  required skills the candidate lacks, per category with a requirement
 * @param categoryScores percentage of required skills held, per category with a requirement
 * @param overallScore   percentage of all required skills held, 0 when nothing is required
 * @param totalRequired  number of required skills across categories
 * @param totalMatched   number of required skills held across categories
 */
public record SkillMatchResult(
        Map<String, Set<String>> exactMatches,
        Map<String, Set<String>> missingSkills,
        Map<String, Double> categoryScores,
        double overallScore,
        int totalRequired,
        int totalMatched) {

    public SkillMatchResult {
        exactMatches = exactMatches != null ? Map.copyOf(exactMatches) : Map.of();
        missingSkills = missingSkills != null ? Map.copyOf(missingSkills) : Map.of();
        categoryScores = categoryScores != null ? Map.copyOf(categoryScores) : Map.of();
    }

    public static SkillMatchResult empty() {
        return new SkillMatchResult(Map.of(), Map.of(), Map.of(), 0.0, 0, 0);
    }

    public int exactMatchCount() {
        return exactMatches.values().stream().mapToInt(Set::size).sum();
    }

    public int missingCount() {
        return missingSkills.values().stream().mapToInt(Set::size).sum();
    }
}
