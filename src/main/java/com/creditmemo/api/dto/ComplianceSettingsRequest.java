package com.creditmemo.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.util.List;

/**
 * Per-run overrides of the configured compliance settings. Absent values
 * keep the configured defaults.
 */
@Data
public class ComplianceSettingsRequest {

    @Positive(message = "sla_days must be positive")
    @JsonProperty("sla_days")
    private Integer slaDays;

    @Positive(message = "missing_levels_for_high must be positive")
    @JsonProperty("missing_levels_for_high")
    private Integer missingLevelsForHigh;

    @JsonProperty("keywords_promotional")
    private List<String> keywordsPromotional;

    @JsonProperty("keywords_contract")
    private List<String> keywordsContract;
}
