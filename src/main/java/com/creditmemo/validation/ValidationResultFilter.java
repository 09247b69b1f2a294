package com.creditmemo.validation;

import com.creditmemo.memo.RiskLevel;
import com.creditmemo.memo.SoxStatus;
import com.creditmemo.memo.ValidatedCreditMemo;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Narrows a result table the way the review screen does: by memo id
 * substring (case-insensitive), SOX status and risk level. Empty criteria
 * match everything.
 */
@Value
@Builder
public class ValidationResultFilter {

    String memo;
    Set<SoxStatus> statuses;
    Set<RiskLevel> riskLevels;

    public static ValidationResultFilter none() {
        return ValidationResultFilter.builder().build();
    }

    public boolean isEmpty() {
        return (memo == null || memo.isBlank())
            && (statuses == null || statuses.isEmpty())
            && (riskLevels == null || riskLevels.isEmpty());
    }

    public List<ValidatedCreditMemo> apply(List<ValidatedCreditMemo> results) {
        if (isEmpty()) {
            return results;
        }
        return results.stream()
            .filter(this::matches)
            .collect(Collectors.toList());
    }

    public boolean matches(ValidatedCreditMemo result) {
        if (memo != null && !memo.isBlank()) {
            String id = result.getRecord().getMemo();
            if (id == null || !id.toLowerCase(Locale.ROOT).contains(memo.trim().toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        if (statuses != null && !statuses.isEmpty()
            && !statuses.contains(result.getOutcome().getSoxStatus())) {
            return false;
        }
        return riskLevels == null || riskLevels.isEmpty()
            || riskLevels.contains(result.getOutcome().getRiskLevel());
    }
}
