package dev.hirematch.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HiringDecision {
    STRONG_HIRE("Strong Hire"),
    HIRE("Hire"),
    MAYBE("Maybe"),
    DONT_HIRE("Don't Hire");

    private final String label;

    HiringDecision(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
