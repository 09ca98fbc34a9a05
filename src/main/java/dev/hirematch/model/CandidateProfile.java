package dev.hirematch.model;

import lombok.Builder;

/**
 * Candidate input: the full profile text plus optional sections pre-extracted upstream.
 * A section that is absent or blank resolves to the full profile text.
 */
@Builder
public record CandidateProfile(
        String profileText,
        String workExperience,
        String education,
        String achievements) {

    public CandidateProfile {
        profileText = profileText != null ? profileText : "";
    }

    public static CandidateProfile of(String profileText) {
        return new CandidateProfile(profileText, null, null, null);
    }

    /**
     * Merge the optional sections of an upstream analysis into a profile.
     */
    public static CandidateProfile from(String profileText, ResumeAnalysis analysis) {
        if (analysis == null) {
            return of(profileText);
        }
        return new CandidateProfile(profileText, analysis.workExperience(), analysis.education(),
                analysis.achievements());
    }

    public String resolvedWorkExperience() {
        return orProfile(workExperience);
    }

    public String resolvedEducation() {
        return orProfile(education);
    }

    public String resolvedAchievements() {
        return orProfile(achievements);
    }

    private String orProfile(String section) {
        return section != null && !section.isBlank() ? section : profileText;
    }
}
