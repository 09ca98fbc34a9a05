package dev.hirematch.service;

import dev.hirematch.model.CategorySkills;
import dev.hirematch.taxonomy.SkillTaxonomy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Finds taxonomy skills and their synonyms in free text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkillExtractionService {

    private final SkillTaxonomy taxonomy;

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    /**
     * Extract canonical skills from text, grouped by category.
     * <p>
     * Overlapping terms such as "c" and "c++" are not disambiguated: every term whose
     * bounded form occurs is reported.
     *
     * @param text candidate profile or job description, may be null
     * @return skills found, never null
     */
    public CategorySkills extractSkills(String text) {
        if (text == null || text.isBlank()) {
            return CategorySkills.empty();
        }

        String textLower = text.toLowerCase();
        Map<String, Set<String>> found = new LinkedHashMap<>();

        // 1. Canonical names
        for (String category : taxonomy.categories()) {
            for (String skill : taxonomy.skillsIn(category)) {
                if (isMentioned(textLower, skill)) {
                    found.computeIfAbsent(category, k -> new LinkedHashSet<>()).add(skill);
                }
            }
        }

        // 2. Alternate spellings, recorded under the canonical name
        for (Map.Entry<String, List<String>> entry : taxonomy.synonymTable().entrySet()) {
            String canonical = entry.getKey();
            for (String synonym : entry.getValue()) {
                if (isMentioned(textLower, synonym)) {
                    taxonomy.categoryOf(canonical).ifPresent(category ->
                            found.computeIfAbsent(category, k -> new LinkedHashSet<>()).add(canonical));
                    break;
                }
            }
        }

        CategorySkills result = CategorySkills.of(found);
        log.debug("Extracted {} skills across {} categories", result.totalSkills(), result.categories().size());
        return result;
    }

    /**
     * Check if text contains a term with word boundaries, so "java" does not match "javascript".
     */
    private boolean isMentioned(String textLower, String term) {
        if (term == null || term.isBlank()) {
            return false;
        }
        String regex = "\\b" + Pattern.quote(term.toLowerCase()) + "\\b";
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(regex, Pattern::compile);
        return pattern.matcher(textLower).find();
    }
}
