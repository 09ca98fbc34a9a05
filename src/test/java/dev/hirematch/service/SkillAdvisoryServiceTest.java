package dev.hirematch.service;

import dev.hirematch.model.SkillDepth;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SkillAdvisoryServiceTest {

    private SkillAdvisoryService advisoryService;

    @BeforeEach
    void setUp() {
        advisoryService = new SkillAdvisoryService();
    }

    @Nested
    @DisplayName("Recommendations")
    class RecommendationTests {

        @Test
        @DisplayName("Should give category specific advice")
        void shouldGiveCategoryAdvice() {
            Map<String, List<String>> advice = advisoryService.recommendations(
                    Map.of("cloud_platforms", Set.of("aws")));

            assertThat(advice).containsOnlyKeys("cloud_platforms");
            assertThat(advice.get("cloud_platforms")).containsExactly(
                    "Obtain cloud certifications (AWS, Azure, GCP)",
                    "Practice with free tier cloud services",
                    "Deploy personal projects to cloud platforms");
        }

        @Test
        @DisplayName("Should fall back to generic advice for other categories")
        void shouldFallBackToGenericAdvice() {
            Map<String, List<String>> advice = advisoryService.recommendations(
                    Map.of("databases", Set.of("mongodb")));

            assertThat(advice.get("databases"))
                    .containsExactly("Develop databases skills through relevant courses and practice");
        }

        @Test
        @DisplayName("Should skip categories with nothing missing")
        void shouldSkipEmptyCategories() {
            Map<String, List<String>> advice = advisoryService.recommendations(
                    Map.of("databases", Set.of(), "programming_languages", Set.of("go")));

            assertThat(advice).containsOnlyKeys("programming_languages");
        }

        @Test
        @DisplayName("Should order categories by name")
        void shouldOrderCategories() {
            Map<String, List<String>> advice = advisoryService.recommendations(Map.of(
                    "web_technologies", Set.of("react"),
                    "data_science", Set.of("pandas"),
                    "cloud_platforms", Set.of("aws")));

            assertThat(advice.keySet()).containsExactly("cloud_platforms", "data_science", "web_technologies");
        }

        @Test
        @DisplayName("Should return nothing for null input")
        void shouldHandleNull() {
            assertThat(advisoryService.recommendations(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Skill depth")
    class DepthTests {

        @ParameterizedTest(name = "''{0}'' should rate python as {1}")
        @CsvSource({
                "'Expert in Python and distributed systems', EXPERT",
                "'Proficient with Python for scripting', PROFICIENT",
                "'Working knowledge of Python', INTERMEDIATE",
                "'Currently learning Python on weekends', BEGINNER",
                "'Python', MENTIONED"
        })
        void shouldRateDepth(String text, SkillDepth expected) {
            assertThat(advisoryService.analyzeDepth(text, Set.of("python")))
                    .containsEntry("python", expected);
        }

        @Test
        @DisplayName("Should prefer the strongest indicator in the window")
        void shouldPreferStrongest() {
            Map<String, SkillDepth> depth = advisoryService.analyzeDepth(
                    "Basic exposure at first, now a senior Java developer", Set.of("java"));

            assertThat(depth).containsEntry("java", SkillDepth.EXPERT);
        }

        @Test
        @DisplayName("Should ignore indicators outside the window")
        void shouldIgnoreDistantIndicators() {
            String text = "Expert chef" + " ".repeat(80) + "also writes some Go";

            assertThat(advisoryService.analyzeDepth(text, Set.of("go")))
                    .containsEntry("go", SkillDepth.MENTIONED);
        }

        @Test
        @DisplayName("Should mark skills absent from the text as mentioned")
        void shouldMarkAbsentAsMentioned() {
            assertThat(advisoryService.analyzeDepth("Expert in Rust", Set.of("kotlin")))
                    .containsEntry("kotlin", SkillDepth.MENTIONED);
        }

        @Test
        @DisplayName("Should handle null text and skills")
        void shouldHandleNulls() {
            assertThat(advisoryService.analyzeDepth(null, Set.of("java")))
                    .containsEntry("java", SkillDepth.MENTIONED);
            assertThat(advisoryService.analyzeDepth("Expert in Java", null)).isEmpty();
        }
    }
}
