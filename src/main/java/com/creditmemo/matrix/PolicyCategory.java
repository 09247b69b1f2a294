package com.creditmemo.matrix;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Policy category of a credit memo. Selects which approval matrix applies.
 */
public enum PolicyCategory {
    /**
     * Promotional credits (campaigns, promotions).
     */
    PROMOTIONAL("Promotional"),

    /**
     * Credits granted under a customer contract.
     */
    CONTRACT("Contract"),

    /**
     * Everything else.
     */
    OTHER("Other");

    private final String label;

    PolicyCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Matrix key as supplied by the ingestion layer ("promotional", "contract", "other").
     */
    public String getKey() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<PolicyCategory> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (PolicyCategory category : values()) {
            if (category.getKey().equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
