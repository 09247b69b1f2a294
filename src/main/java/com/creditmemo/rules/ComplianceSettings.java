package com.creditmemo.rules;

import com.creditmemo.common.exception.InvalidSettingsException;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Thresholds and keyword sets applied during one validation run.
 */
@Value
public class ComplianceSettings {

    public static final int DEFAULT_SLA_DAYS = 5;
    public static final int DEFAULT_MISSING_LEVELS_FOR_HIGH = 2;
    public static final List<String> DEFAULT_KEYWORDS_PROMOTIONAL = List.of("promotional", "promotion");
    public static final List<String> DEFAULT_KEYWORDS_CONTRACT = List.of("contract");

    /**
     * Business days allowed between approval and memo creation.
     */
    @JsonProperty("sla_days")
    int slaDays;

    /**
     * Number of missing approval levels at which risk becomes High.
     */
    @JsonProperty("missing_levels_for_high")
    int missingLevelsForHigh;

    @JsonProperty("keywords_promotional")
    List<String> keywordsPromotional;

    @JsonProperty("keywords_contract")
    List<String> keywordsContract;

    @Builder(toBuilder = true)
    private ComplianceSettings(int slaDays, int missingLevelsForHigh,
                               List<String> keywordsPromotional, List<String> keywordsContract) {
        if (slaDays < 1) {
            throw new InvalidSettingsException("sla_days", "must be at least 1, got " + slaDays);
        }
        if (missingLevelsForHigh < 1) {
            throw new InvalidSettingsException("missing_levels_for_high",
                "must be at least 1, got " + missingLevelsForHigh);
        }
        this.slaDays = slaDays;
        this.missingLevelsForHigh = missingLevelsForHigh;
        this.keywordsPromotional = normalize(keywordsPromotional, DEFAULT_KEYWORDS_PROMOTIONAL);
        this.keywordsContract = normalize(keywordsContract, DEFAULT_KEYWORDS_CONTRACT);
    }

    public static ComplianceSettings defaults() {
        return ComplianceSettings.builder()
            .slaDays(DEFAULT_SLA_DAYS)
            .missingLevelsForHigh(DEFAULT_MISSING_LEVELS_FOR_HIGH)
            .build();
    }

    private static List<String> normalize(List<String> keywords, List<String> fallback) {
        if (keywords == null) {
            return fallback;
        }
        return keywords.stream()
            .filter(Objects::nonNull)
            .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
            .filter(keyword -> !keyword.isEmpty())
            .distinct()
            .collect(Collectors.toUnmodifiableList());
    }
}
