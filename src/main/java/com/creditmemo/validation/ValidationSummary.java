package com.creditmemo.validation;

import com.creditmemo.memo.MemoFieldParser;
import com.creditmemo.memo.RiskLevel;
import com.creditmemo.memo.SoxStatus;
import com.creditmemo.memo.ValidatedCreditMemo;
import com.creditmemo.memo.ValidationOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Headline figures of a validation run, as shown on the audit dashboard.
 */
@Value
@Builder
public class ValidationSummary {

    int totalMemos;
    int compliant;
    int violations;
    BigDecimal compliantPct;
    BigDecimal violationPct;
    int highRisk;
    int mediumRisk;
    int overSla;
    int duplicateMemos;
    int separationOfDutiesViolations;

    /**
     * Sum of all parseable memo amounts.
     */
    BigDecimal totalAmount;

    public static ValidationSummary of(List<ValidatedCreditMemo> results) {
        int compliant = 0;
        int violations = 0;
        int highRisk = 0;
        int mediumRisk = 0;
        int overSla = 0;
        int duplicates = 0;
        int sodViolations = 0;
        BigDecimal totalAmount = BigDecimal.ZERO;

        for (ValidatedCreditMemo result : results) {
            ValidationOutcome outcome = result.getOutcome();
            if (outcome.getSoxStatus() == SoxStatus.COMPLIANT) {
                compliant++;
            } else if (outcome.getSoxStatus() == SoxStatus.VIOLATION) {
                violations++;
            }
            if (outcome.getRiskLevel() == RiskLevel.HIGH) {
                highRisk++;
            } else if (outcome.getRiskLevel() == RiskLevel.MEDIUM) {
                mediumRisk++;
            }
            if (outcome.getTimelineStatus() != null && outcome.getTimelineStatus().startsWith("Over")) {
                overSla++;
            }
            if (ValidationOutcome.YES.equals(outcome.getDuplicateMemo())) {
                duplicates++;
            }
            if (ValidationOutcome.SOD_VIOLATION.equals(outcome.getDesignationLevelCheck())) {
                sodViolations++;
            }
            Optional<BigDecimal> amount = MemoFieldParser.parseAmount(result.getRecord().getAmount());
            if (amount.isPresent()) {
                totalAmount = totalAmount.add(amount.get());
            }
        }

        return ValidationSummary.builder()
            .totalMemos(results.size())
            .compliant(compliant)
            .violations(violations)
            .compliantPct(percentage(compliant, results.size()))
            .violationPct(percentage(violations, results.size()))
            .highRisk(highRisk)
            .mediumRisk(mediumRisk)
            .overSla(overSla)
            .duplicateMemos(duplicates)
            .separationOfDutiesViolations(sodViolations)
            .totalAmount(totalAmount)
            .build();
    }

    private static BigDecimal percentage(int count, int total) {
        if (total == 0) {
            return BigDecimal.ZERO.setScale(1, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(count * 100L)
            .divide(BigDecimal.valueOf(total), 1, RoundingMode.HALF_UP);
    }
}
