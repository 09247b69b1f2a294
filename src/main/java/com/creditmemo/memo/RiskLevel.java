package com.creditmemo.memo;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts either the display label ("High") or the constant name.
     */
    public static RiskLevel fromLabel(String value) {
        for (RiskLevel candidate : values()) {
            if (candidate.label.equalsIgnoreCase(value.trim()) || candidate.name().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown risk level: " + value);
    }
}
