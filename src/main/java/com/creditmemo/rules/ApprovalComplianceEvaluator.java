package com.creditmemo.rules;

import com.creditmemo.memo.RiskLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Compares the level a memo requires with the level of its approver.
 *
 * Checks run in precedence order and the first failing one decides:
 * missing amount or matrix, missing designation, unknown designation,
 * insufficient level.
 */
@Component
public class ApprovalComplianceEvaluator {

    static final String MISSING_AMOUNT_OR_MATRIX = "Missing amount or matrix not available";
    static final String MISSING_DESIGNATION = "Approver designation missing";

    private static final String LEVEL_SEPARATOR = "–";

    public ApprovalCheck evaluate(Optional<BigDecimal> amount, Optional<Integer> requiredLevel,
                                  ApproverLevel approverLevel, String designation,
                                  ComplianceSettings settings) {
        if (amount.isEmpty() || requiredLevel.isEmpty()) {
            return ApprovalCheck.violation(RiskLevel.HIGH, MISSING_AMOUNT_OR_MATRIX);
        }

        switch (approverLevel.getKind()) {
            case UNRESOLVED:
                return ApprovalCheck.violation(RiskLevel.HIGH, MISSING_DESIGNATION);
            case NOT_FOUND:
                return ApprovalCheck.violation(RiskLevel.HIGH,
                    String.format("Designation '%s' not found in matrix", designation));
            default:
                break;
        }

        int required = requiredLevel.get();
        int actual = approverLevel.getLevel();
        if (actual >= required) {
            return ApprovalCheck.pending();
        }

        int missingCount = required - actual;
        RiskLevel risk = missingCount >= settings.getMissingLevelsForHigh() ? RiskLevel.HIGH : RiskLevel.MEDIUM;
        String missingLevels = IntStream.rangeClosed(actual + 1, required)
            .mapToObj(String::valueOf)
            .collect(Collectors.joining(LEVEL_SEPARATOR));
        return ApprovalCheck.violation(risk, "Level " + missingLevels + " Missing");
    }
}
