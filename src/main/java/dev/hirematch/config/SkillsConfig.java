package dev.hirematch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Skill categories and synonym tables.
 * Loaded under the 'skills' prefix; the built-in tables apply when nothing is configured.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "skills")
public class SkillsConfig {

    private Map<String, List<String>> categories = defaultCategories();
    private Map<String, List<String>> synonyms = defaultSynonyms();

    public static Map<String, List<String>> defaultCategories() {
        Map<String, List<String>> categories = new LinkedHashMap<>();
        categories.put("programming_languages", List.of(
                "python", "java", "javascript", "typescript", "c++", "c#", "go",
                "rust", "swift", "kotlin", "scala", "ruby", "php", "r", "matlab"));
        categories.put("web_technologies", List.of(
                "html", "css", "react", "angular", "vue", "node.js", "express",
                "django", "flask", "spring", "asp.net", "laravel", "rails"));
        categories.put("databases", List.of(
                "mysql", "postgresql", "mongodb", "redis", "elasticsearch",
                "oracle", "sql server", "sqlite", "cassandra", "dynamodb"));
        categories.put("cloud_platforms", List.of(
                "aws", "azure", "gcp", "google cloud", "docker", "kubernetes",
                "terraform", "ansible", "jenkins", "gitlab", "github actions"));
        categories.put("data_science", List.of(
                "pandas", "numpy", "scikit-learn", "tensorflow", "pytorch",
                "spark", "hadoop", "tableau", "power bi", "jupyter"));
        categories.put("soft_skills", List.of(
                "leadership", "communication", "problem solving", "teamwork",
                "project management", "analytical thinking", "creativity"));
        return categories;
    }

    public static Map<String, List<String>> defaultSynonyms() {
        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        synonyms.put("javascript", List.of("js", "node", "nodejs", "node.js"));
        synonyms.put("typescript", List.of("ts"));
        synonyms.put("python", List.of("py"));
        synonyms.put("postgresql", List.of("postgres", "psql"));
        synonyms.put("mongodb", List.of("mongo"));
        synonyms.put("kubernetes", List.of("k8s"));
        synonyms.put("aws", List.of("amazon web services"));
        synonyms.put("gcp", List.of("google cloud platform"));
        synonyms.put("azure", List.of("microsoft azure"));
        return synonyms;
    }
}
