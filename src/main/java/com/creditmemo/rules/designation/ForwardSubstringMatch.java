package com.creditmemo.rules.designation;

import com.creditmemo.matrix.ApprovalMatrix;
import com.creditmemo.matrix.ApprovalMatrixEntry;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Matrix designation appears inside the approver designation,
 * e.g. "Finance Manager" inside "Senior Finance Manager - West".
 */
@Component
@Order(2)
public class ForwardSubstringMatch implements DesignationMatchStrategy {

    @Override
    public Optional<ApprovalMatrixEntry> match(String designation, ApprovalMatrix matrix) {
        return matrix.getEntries().stream()
            .filter(entry -> designation.contains(entry.getNormalizedDesignation()))
            .findFirst();
    }

    @Override
    public String getStrategyName() {
        return "ForwardSubstring";
    }
}
