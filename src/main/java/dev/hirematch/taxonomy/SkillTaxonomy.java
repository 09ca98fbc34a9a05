package dev.hirematch.taxonomy;

import dev.hirematch.config.SkillsConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable category to canonical skill table plus the synonym table.
 * Every canonical skill belongs to exactly one category, and every synonym entry points at such a skill.
 */
@Slf4j
public final class SkillTaxonomy {

    private final Map<String, Set<String>> categories;
    private final Map<String, List<String>> synonyms;
    private final Map<String, String> categoryBySkill;

    private SkillTaxonomy(Map<String, Set<String>> categories, Map<String, List<String>> synonyms,
            Map<String, String> categoryBySkill) {
        this.categories = categories;
        this.synonyms = synonyms;
        this.categoryBySkill = categoryBySkill;
    }

    /**
     * Build the taxonomy from configuration.
     *
     * @throws IllegalStateException if a skill is listed under two categories or a synonym
     *                               entry refers to a skill no category owns
     */
    public static SkillTaxonomy from(SkillsConfig config) {
        return of(config.getCategories(), config.getSynonyms());
    }

    public static SkillTaxonomy defaults() {
        return of(SkillsConfig.defaultCategories(), SkillsConfig.defaultSynonyms());
    }

    public static SkillTaxonomy of(Map<String, List<String>> rawCategories, Map<String, List<String>> rawSynonyms) {
        Map<String, Set<String>> categories = new LinkedHashMap<>();
        Map<String, String> categoryBySkill = new HashMap<>();

        if (rawCategories != null) {
            for (Map.Entry<String, List<String>> entry : rawCategories.entrySet()) {
                String category = entry.getKey().strip().toLowerCase();
                Set<String> skills = new LinkedHashSet<>();
                for (String raw : nullSafe(entry.getValue())) {
                    String skill = SkillNormalizer.normalize(raw);
                    if (skill.isEmpty()) {
                        continue;
                    }
                    String owner = categoryBySkill.putIfAbsent(skill, category);
                    if (owner != null && !owner.equals(category)) {
                        throw new IllegalStateException(
                                "Skill '" + skill + "' is listed under both '" + owner + "' and '" + category + "'");
                    }
                    skills.add(skill);
                }
                if (!skills.isEmpty()) {
                    categories.put(category, Collections.unmodifiableSet(skills));
                }
            }
        }

        Map<String, List<String>> synonyms = new LinkedHashMap<>();
        if (rawSynonyms != null) {
            for (Map.Entry<String, List<String>> entry : rawSynonyms.entrySet()) {
                String canonical = SkillNormalizer.normalize(entry.getKey());
                if (!categoryBySkill.containsKey(canonical)) {
                    throw new IllegalStateException(
                            "Synonyms declared for '" + canonical + "' which belongs to no skill category");
                }
                List<String> forms = nullSafe(entry.getValue()).stream()
                        .map(form -> form.toLowerCase().strip())
                        .filter(form -> !form.isEmpty())
                        .distinct()
                        .toList();
                synonyms.put(canonical, forms);
            }
        }

        log.debug("Skill taxonomy built: {} categories, {} skills, {} synonym entries",
                categories.size(), categoryBySkill.size(), synonyms.size());

        return new SkillTaxonomy(
                Collections.unmodifiableMap(categories),
                Collections.unmodifiableMap(synonyms),
                Collections.unmodifiableMap(categoryBySkill));
    }

    private static List<String> nullSafe(List<String> values) {
        return values != null ? values : List.of();
    }

    public Set<String> categories() {
        return categories.keySet();
    }

    /**
     * Canonical skills of a category, empty for an unknown category.
     */
    public Set<String> skillsIn(String category) {
        return categories.getOrDefault(category, Set.of());
    }

    public Optional<String> categoryOf(String skill) {
        return Optional.ofNullable(categoryBySkill.get(skill));
    }

    public boolean contains(String category, String skill) {
        return skillsIn(category).contains(skill);
    }

    public List<String> synonymsOf(String skill) {
        return synonyms.getOrDefault(skill, List.of());
    }

    public Map<String, Set<String>> asMap() {
        return categories;
    }

    public Map<String, List<String>> synonymTable() {
        return synonyms;
    }

    public int size() {
        return categoryBySkill.size();
    }
}
