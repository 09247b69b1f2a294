package com.creditmemo.rules.designation;

import com.creditmemo.matrix.ApprovalMatrix;
import com.creditmemo.matrix.ApprovalMatrixEntry;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Approver designation appears inside a matrix designation,
 * e.g. "CFO" inside "CFO / Finance Director".
 */
@Component
@Order(3)
public class ReverseSubstringMatch implements DesignationMatchStrategy {

    @Override
    public Optional<ApprovalMatrixEntry> match(String designation, ApprovalMatrix matrix) {
        return matrix.getEntries().stream()
            .filter(entry -> entry.getNormalizedDesignation().contains(designation))
            .findFirst();
    }

    @Override
    public String getStrategyName() {
        return "ReverseSubstring";
    }
}
