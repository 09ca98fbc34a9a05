package dev.hirematch.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Canonical skills found in a text, grouped by category.
 * Only categories with at least one skill are present; null and blank skills are dropped.
 */
public record CategorySkills(Map<String, Set<String>> byCategory) {

    private static final CategorySkills EMPTY = new CategorySkills(Map.of());

    public CategorySkills {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        if (byCategory != null) {
            byCategory.forEach((category, skills) -> {
                if (category == null || skills == null) {
                    return;
                }
                Set<String> kept = new LinkedHashSet<>();
                for (String skill : skills) {
                    if (skill != null && !skill.isBlank()) {
                        kept.add(skill);
                    }
                }
                if (!kept.isEmpty()) {
                    copy.put(category, Collections.unmodifiableSet(kept));
                }
            });
        }
        byCategory = Collections.unmodifiableMap(copy);
    }

    public static CategorySkills empty() {
        return EMPTY;
    }

    public static CategorySkills of(Map<String, Set<String>> byCategory) {
        return new CategorySkills(byCategory);
    }

    public Set<String> get(String category) {
        return byCategory.getOrDefault(category, Set.of());
    }

    public Set<String> categories() {
        return byCategory.keySet();
    }

    public int totalSkills() {
        return byCategory.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isEmpty() {
        return byCategory.isEmpty();
    }

    @JsonValue
    public Map<String, Set<String>> asMap() {
        return byCategory;
    }
}
