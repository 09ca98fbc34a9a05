package dev.hirematch.model;

/**
 * How much experience a text claims for a skill, judged from phrases near its mention.
 */
public enum SkillDepth {
    EXPERT,
    PROFICIENT,
    INTERMEDIATE,
    BEGINNER,
    MENTIONED
}
