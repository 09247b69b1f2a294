package com.creditmemo.memo;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Final SOX verdict of a credit memo.
 */
public enum SoxStatus {
    COMPLIANT("SOX Compliant"),
    VIOLATION("SOX Violation");

    private final String label;

    SoxStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Accepts either the display label ("SOX Violation") or the constant name.
     */
    public static SoxStatus fromLabel(String value) {
        for (SoxStatus candidate : values()) {
            if (candidate.label.equalsIgnoreCase(value.trim()) || candidate.name().equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown SOX status: " + value);
    }
}
