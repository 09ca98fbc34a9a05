package dev.hirematch.service;

import dev.hirematch.model.SkillDepth;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Development advice for missing skills and depth estimates for claimed ones.
 */
@Service
public class SkillAdvisoryService {

    private static final int DEPTH_WINDOW = 50;

    private static final Map<String, List<String>> CATEGORY_ADVICE = Map.of(
            "programming_languages", List.of(
                    "Consider online coding bootcamps or courses",
                    "Practice with coding challenges on platforms like LeetCode or HackerRank",
                    "Build personal projects to demonstrate proficiency"),
            "web_technologies", List.of(
                    "Complete framework-specific tutorials and documentation",
                    "Build full-stack web applications",
                    "Contribute to open-source projects"),
            "cloud_platforms", List.of(
                    "Obtain cloud certifications (AWS, Azure, GCP)",
                    "Practice with free tier cloud services",
                    "Deploy personal projects to cloud platforms"),
            "data_science", List.of(
                    "Complete data science courses or bootcamps",
                    "Work on Kaggle competitions",
                    "Build and showcase data analysis projects"));

    // Checked in declaration order, strongest first
    private static final Map<SkillDepth, List<String>> DEPTH_INDICATORS = new LinkedHashMap<>();

    static {
        DEPTH_INDICATORS.put(SkillDepth.EXPERT, List.of(
                "expert", "lead", "senior", "architect", "advanced", "10+ years", "extensive"));
        DEPTH_INDICATORS.put(SkillDepth.PROFICIENT, List.of(
                "proficient", "experienced", "solid", "strong", "5+ years", "commercial"));
        DEPTH_INDICATORS.put(SkillDepth.INTERMEDIATE, List.of(
                "intermediate", "working knowledge", "familiar", "some experience", "2+ years"));
        DEPTH_INDICATORS.put(SkillDepth.BEGINNER, List.of(
                "basic", "beginner", "learning", "exposure", "introduction", "started"));
    }

    /**
     * Recommendations per category that has missing skills.
     *
     * @param missingSkills missing skills by category, as in a skill match result
     * @return advice by category, sorted by category name
     */
    public Map<String, List<String>> recommendations(Map<String, ? extends Collection<String>> missingSkills) {
        Map<String, List<String>> result = new TreeMap<>();
        if (missingSkills == null) {
            return result;
        }
        missingSkills.forEach((category, skills) -> {
            if (skills == null || skills.isEmpty()) {
                return;
            }
            result.put(category, CATEGORY_ADVICE.getOrDefault(category,
                    List.of("Develop " + category + " skills through relevant courses and practice")));
        });
        return result;
    }

    /**
     * Estimate experience depth for each skill from phrases around its first mention in the text.
     */
    public Map<String, SkillDepth> analyzeDepth(String text, Set<String> skills) {
        Map<String, SkillDepth> depths = new TreeMap<>();
        if (skills == null) {
            return depths;
        }
        String textLower = text != null ? text.toLowerCase() : "";

        for (String skill : skills) {
            depths.put(skill, depthOf(textLower, skill.toLowerCase()));
        }
        return depths;
    }

    private SkillDepth depthOf(String textLower, String skill) {
        int position = textLower.indexOf(skill);
        if (position < 0) {
            return SkillDepth.MENTIONED;
        }
        String surrounding = textLower.substring(
                Math.max(0, position - DEPTH_WINDOW),
                Math.min(textLower.length(), position + DEPTH_WINDOW));

        for (Map.Entry<SkillDepth, List<String>> level : DEPTH_INDICATORS.entrySet()) {
            for (String indicator : level.getValue()) {
                if (surrounding.contains(indicator)) {
                    return level.getKey();
                }
            }
        }
        return SkillDepth.MENTIONED;
    }
}
