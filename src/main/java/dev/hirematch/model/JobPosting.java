package dev.hirematch.model;

import lombok.Builder;

/**
 * Job input: the full description text plus an optional educational requirements section.
 * An absent or blank section resolves to the full description.
 */
@Builder
public record JobPosting(String descriptionText, String educationalRequirements) {

    public JobPosting {
        descriptionText = descriptionText != null ? descriptionText : "";
    }

    public static JobPosting of(String descriptionText) {
        return new JobPosting(descriptionText, null);
    }

    public String resolvedEducationalRequirements() {
        return educationalRequirements != null && !educationalRequirements.isBlank()
                ? educationalRequirements
                : descriptionText;
    }
}
