package com.creditmemo.config;

import com.creditmemo.rules.ComplianceSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "credit-memo.compliance")
public class ComplianceProperties {

    // Business days allowed between approval and CM creation
    private int slaDays = ComplianceSettings.DEFAULT_SLA_DAYS;

    // Missing approval levels at or above which risk is High instead of Medium
    private int missingLevelsForHigh = ComplianceSettings.DEFAULT_MISSING_LEVELS_FOR_HIGH;

    private List<String> keywordsPromotional = new ArrayList<>(ComplianceSettings.DEFAULT_KEYWORDS_PROMOTIONAL);

    private List<String> keywordsContract = new ArrayList<>(ComplianceSettings.DEFAULT_KEYWORDS_CONTRACT);

    // Evaluate memos on the common fork-join pool. Output order is unaffected.
    private boolean parallel = false;

    /**
     * Settings used when a request does not override them.
     */
    public ComplianceSettings toSettings() {
        return ComplianceSettings.builder()
            .slaDays(slaDays)
            .missingLevelsForHigh(missingLevelsForHigh)
            .keywordsPromotional(keywordsPromotional)
            .keywordsContract(keywordsContract)
            .build();
    }
}
