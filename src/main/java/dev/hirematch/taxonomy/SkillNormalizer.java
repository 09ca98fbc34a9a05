package dev.hirematch.taxonomy;

import java.util.regex.Pattern;

/**
 * Canonicalizes free-form skill strings so they can be compared reliably.
 */
public final class SkillNormalizer {

    private static final Pattern LEADING_QUALIFIER =
            Pattern.compile("^(expert|advanced|proficient|experienced)\\s+");
    private static final Pattern TRAILING_QUALIFIER =
            Pattern.compile("\\s+(experience|experiences|skill|skills)$");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\s*\\([^)]*\\)");
    private static final Pattern TRAILING_VERSION = Pattern.compile("\\s+\\d+(\\.\\d+)?\\+?$");

    private SkillNormalizer() {
    }

    /**
     * Normalize a raw skill name.
     * <p>
     * "Advanced JavaScript Skills" becomes "javascript", "React.js (5+ years)" becomes "react.js"
     * and "Java 17" becomes "java".
     *
     * @param raw skill as written, may be null
     * @return the normalized skill, never null
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String skill = raw.toLowerCase().strip();
        skill = LEADING_QUALIFIER.matcher(skill).replaceFirst("");
        skill = TRAILING_QUALIFIER.matcher(skill).replaceFirst("");
        skill = PARENTHETICAL.matcher(skill).replaceAll("");
        skill = TRAILING_VERSION.matcher(skill).replaceFirst("");
        return skill.strip();
    }
}
