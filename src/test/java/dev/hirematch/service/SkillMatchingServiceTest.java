package dev.hirematch.service;

import dev.hirematch.model.CategorySkills;
import dev.hirematch.model.SkillMatchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SkillMatchingServiceTest {

    private SkillMatchingService matchingService;

    @BeforeEach
    void setUp() {
        matchingService = new SkillMatchingService();
    }

    private CategorySkills skills(Map<String, Set<String>> byCategory) {
        return CategorySkills.of(byCategory);
    }

    @Nested
    @DisplayName("Match statistics")
    class StatisticsTests {

        @Test
        @DisplayName("Should compute exact, missing and category scores")
        void shouldComputeMatchStatistics() {
            CategorySkills candidate = skills(Map.of("programming_languages", Set.of("python", "java")));
            CategorySkills required = skills(Map.of("programming_languages", Set.of("python", "javascript")));

            SkillMatchResult result = matchingService.matchSkills(candidate, required);

            assertThat(result.exactMatches().get("programming_languages")).containsExactly("python");
            assertThat(result.missingSkills().get("programming_languages")).containsExactly("javascript");
            assertThat(result.categoryScores().get("programming_languages")).isEqualTo(50.0);
            assertThat(result.overallScore()).isEqualTo(50.0);
            assertThat(result.totalRequired()).isEqualTo(2);
            assertThat(result.totalMatched()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should aggregate across categories")
        void shouldAggregateAcrossCategories() {
            CategorySkills candidate = skills(Map.of(
                    "programming_languages", Set.of("python", "java"),
                    "databases", Set.of("postgresql")));
            CategorySkills required = skills(Map.of(
                    "programming_languages", Set.of("python", "javascript"),
                    "databases", Set.of("postgresql", "mongodb"),
                    "cloud_platforms", Set.of("aws")));

            SkillMatchResult result = matchingService.matchSkills(candidate, required);

            assertThat(result.categoryScores())
                    .containsEntry("programming_languages", 50.0)
                    .containsEntry("databases", 50.0)
                    .containsEntry("cloud_platforms", 0.0);
            assertThat(result.overallScore()).isCloseTo(40.0, within(1e-9));
            assertThat(result.exactMatchCount()).isEqualTo(2);
            assertThat(result.missingCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Identical non-empty sets should score 100")
        void identicalSetsShouldScoreFullMarks() {
            CategorySkills same = skills(Map.of(
                    "programming_languages", Set.of("python", "go"),
                    "soft_skills", Set.of("leadership")));

            SkillMatchResult result = matchingService.matchSkills(same, same);

            assertThat(result.overallScore()).isEqualTo(100.0);
            assertThat(result.categoryScores().values()).containsOnly(100.0);
            assertThat(result.missingCount()).isZero();
        }
    }

    @Nested
    @DisplayName("Category handling")
    class CategoryTests {

        @Test
        @DisplayName("Should skip categories that are not required")
        void shouldSkipUnrequiredCategories() {
            CategorySkills candidate = skills(Map.of(
                    "programming_languages", Set.of("python"),
                    "data_science", Set.of("pandas", "numpy")));
            CategorySkills required = skills(Map.of("programming_languages", Set.of("python")));

            SkillMatchResult result = matchingService.matchSkills(candidate, required);

            assertThat(result.categoryScores()).containsOnlyKeys("programming_languages");
            assertThat(result.exactMatches()).doesNotContainKey("data_science");
            assertThat(result.missingSkills()).doesNotContainKey("data_science");
            assertThat(result.overallScore()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Should score zero when nothing is required")
        void shouldScoreZeroWithoutRequirements() {
            CategorySkills candidate = skills(Map.of("programming_languages", Set.of("python")));

            SkillMatchResult result = matchingService.matchSkills(candidate, CategorySkills.empty());

            assertThat(result.overallScore()).isZero();
            assertThat(result.categoryScores()).isEmpty();
            assertThat(result.totalRequired()).isZero();
        }

        @Test
        @DisplayName("Should treat null inputs as empty")
        void shouldHandleNullInputs() {
            SkillMatchResult result = matchingService.matchSkills(null, null);

            assertThat(result.overallScore()).isZero();
            assertThat(result.exactMatches()).isEmpty();
        }
    }

    @Test
    @DisplayName("Adding a required skill to the candidate should never lower the category score")
    void shouldBeMonotonic() {
        CategorySkills required = skills(Map.of("databases", Set.of("mysql", "redis", "mongodb")));
        CategorySkills before = skills(Map.of("databases", Set.of("mysql")));
        CategorySkills after = skills(Map.of("databases", Set.of("mysql", "redis")));

        double scoreBefore = matchingService.matchSkills(before, required).categoryScores().get("databases");
        double scoreAfter = matchingService.matchSkills(after, required).categoryScores().get("databases");

        assertThat(scoreAfter).isGreaterThanOrEqualTo(scoreBefore);
        assertThat(scoreBefore).isBetween(0.0, 100.0);
        assertThat(scoreAfter).isBetween(0.0, 100.0);
    }

    @Test
    @DisplayName("Should produce identical results for identical inputs")
    void shouldBeDeterministic() {
        CategorySkills candidate = skills(Map.of("cloud_platforms", Set.of("aws", "docker")));
        CategorySkills required = skills(Map.of("cloud_platforms", Set.of("aws", "kubernetes")));

        assertThat(matchingService.matchSkills(candidate, required))
                .isEqualTo(matchingService.matchSkills(candidate, required));
    }

    @Test
    @DisplayName("Should ignore null and blank skills in the inputs")
    void shouldIgnoreNullAndBlankSkills() {
        Set<String> withGaps = new HashSet<>(Arrays.asList("python", null, " "));
        CategorySkills candidate = skills(Map.of("programming_languages", withGaps));
        Set<String> onlyNull = new HashSet<>(Arrays.asList((String) null));
        CategorySkills required = skills(Map.of("programming_languages", withGaps, "databases", onlyNull));

        SkillMatchResult result = matchingService.matchSkills(candidate, required);

        assertThat(candidate.get("programming_languages")).containsExactly("python");
        assertThat(required.categories()).containsExactly("programming_languages");
        assertThat(result.totalRequired()).isEqualTo(1);
        assertThat(result.overallScore()).isEqualTo(100.0);
    }
}
