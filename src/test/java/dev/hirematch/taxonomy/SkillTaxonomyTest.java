package dev.hirematch.taxonomy;

import dev.hirematch.config.SkillsConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SkillTaxonomyTest {

    @Nested
    @DisplayName("Default tables")
    class DefaultTablesTests {

        private final SkillTaxonomy taxonomy = SkillTaxonomy.defaults();

        @Test
        @DisplayName("Should expose all default categories")
        void shouldExposeDefaultCategories() {
            assertThat(taxonomy.categories()).containsExactly(
                    "programming_languages", "web_technologies", "databases",
                    "cloud_platforms", "data_science", "soft_skills");
        }

        @Test
        @DisplayName("Should resolve the owning category of a skill")
        void shouldResolveCategory() {
            assertThat(taxonomy.categoryOf("postgresql")).contains("databases");
            assertThat(taxonomy.categoryOf("machine learning")).isEmpty();
            assertThat(taxonomy.contains("cloud_platforms", "kubernetes")).isTrue();
            assertThat(taxonomy.contains("databases", "kubernetes")).isFalse();
        }

        @Test
        @DisplayName("Every synonym entry should point at a categorized skill")
        void synonymsShouldBelongToCategories() {
            taxonomy.synonymTable().keySet()
                    .forEach(canonical -> assertThat(taxonomy.categoryOf(canonical)).isPresent());
            assertThat(taxonomy.synonymsOf("javascript")).contains("js", "node.js");
        }

        @Test
        @DisplayName("Should be immutable")
        void shouldBeImmutable() {
            assertThatThrownBy(() -> taxonomy.skillsIn("databases").add("foxpro"))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> taxonomy.asMap().remove("databases"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("Should build the same tables from the default configuration")
        void shouldBuildFromConfig() {
            SkillTaxonomy fromConfig = SkillTaxonomy.from(new SkillsConfig());

            assertThat(fromConfig.asMap()).isEqualTo(taxonomy.asMap());
            assertThat(fromConfig.size()).isEqualTo(taxonomy.size());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Should reject a skill listed under two categories")
        void shouldRejectDuplicateSkill() {
            Map<String, List<String>> categories = Map.of(
                    "databases", List.of("redis"),
                    "cloud_platforms", List.of("redis"));

            assertThatThrownBy(() -> SkillTaxonomy.of(categories, Map.of()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("redis");
        }

        @Test
        @DisplayName("Should reject synonyms for an uncategorized skill")
        void shouldRejectOrphanSynonyms() {
            Map<String, List<String>> categories = Map.of("programming_languages", List.of("python"));
            Map<String, List<String>> synonyms = Map.of("machine learning", List.of("ml"));

            assertThatThrownBy(() -> SkillTaxonomy.of(categories, synonyms))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("machine learning");
        }

        @Test
        @DisplayName("Should normalize configured entries and drop blanks")
        void shouldNormalizeEntries() {
            Map<String, List<String>> categories = Map.of(
                    "programming_languages", List.of(" Python 3 ", "Advanced Java", ""),
                    "empty", List.of());

            SkillTaxonomy taxonomy = SkillTaxonomy.of(categories, Map.of("python", List.of(" PY ")));

            assertThat(taxonomy.skillsIn("programming_languages")).containsExactly("python", "java");
            assertThat(taxonomy.categories()).doesNotContain("empty");
            assertThat(taxonomy.synonymsOf("python")).containsExactly("py");
        }
    }
}
