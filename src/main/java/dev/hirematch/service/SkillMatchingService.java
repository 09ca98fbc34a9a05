package dev.hirematch.service;

import dev.hirematch.model.CategorySkills;
import dev.hirematch.model.SkillMatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Compares a candidate's skills against a job's required skills.
 */
@Slf4j
@Service
public class SkillMatchingService {

    /**
     * Calculate per-category and overall match statistics.
     * Categories without required skills are skipped entirely.
     *
     * @param candidate skills extracted from the candidate profile
     * @param required  skills extracted from the job description
     * @return match statistics, never null
     */
    public SkillMatchResult matchSkills(CategorySkills candidate, CategorySkills required) {
        CategorySkills candidateSkills = candidate != null ? candidate : CategorySkills.empty();
        CategorySkills requiredSkills = required != null ? required : CategorySkills.empty();

        Map<String, Set<String>> exactMatches = new HashMap<>();
        Map<String, Set<String>> missingSkills = new HashMap<>();
        Map<String, Double> categoryScores = new HashMap<>();
        int totalRequired = 0;
        int totalMatched = 0;

        Set<String> allCategories = new HashSet<>(candidateSkills.categories());
        allCategories.addAll(requiredSkills.categories());

        for (String category : allCategories) {
            Set<String> requiredInCategory = requiredSkills.get(category);
            if (requiredInCategory.isEmpty()) {
                continue;
            }
            Set<String> candidateInCategory = candidateSkills.get(category);

            Set<String> matched = new LinkedHashSet<>(requiredInCategory);
            matched.retainAll(candidateInCategory);

            Set<String> missing = new LinkedHashSet<>(requiredInCategory);
            missing.removeAll(candidateInCategory);

            exactMatches.put(category, Set.copyOf(matched));
            missingSkills.put(category, Set.copyOf(missing));
            categoryScores.put(category, matched.size() * 100.0 / requiredInCategory.size());

            totalRequired += requiredInCategory.size();
            totalMatched += matched.size();
        }

        double overallScore = totalRequired > 0 ? totalMatched * 100.0 / totalRequired : 0.0;

        log.debug("Skill match: {}/{} required skills matched ({}%)",
                totalMatched, totalRequired, String.format("%.1f", overallScore));

        return new SkillMatchResult(exactMatches, missingSkills, categoryScores,
                overallScore, totalRequired, totalMatched);
    }
}
