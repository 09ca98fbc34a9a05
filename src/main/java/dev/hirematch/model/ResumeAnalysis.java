package dev.hirematch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured resume fields produced by an upstream analysis layer.
 * Every field is optional; unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResumeAnalysis(
        @JsonProperty("work_experience") String workExperience,
        @JsonProperty("education") String education,
        @JsonProperty("achievements") String achievements,
        @JsonProperty("relevant_roles") List<String> relevantRoles,
        @JsonProperty("industries") List<String> industries) {

    public ResumeAnalysis {
        relevantRoles = relevantRoles != null ? List.copyOf(relevantRoles) : List.of();
        industries = industries != null ? List.copyOf(industries) : List.of();
    }
}
