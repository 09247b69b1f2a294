package com.creditmemo.rules.designation;

import com.creditmemo.matrix.ApprovalMatrix;
import com.creditmemo.matrix.ApprovalMatrixEntry;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Matrix designation equals the approver designation.
 */
@Component
@Order(1)
public class ExactDesignationMatch implements DesignationMatchStrategy {

    @Override
    public Optional<ApprovalMatrixEntry> match(String designation, ApprovalMatrix matrix) {
        return matrix.getEntries().stream()
            .filter(entry -> entry.getNormalizedDesignation().equals(designation))
            .findFirst();
    }

    @Override
    public String getStrategyName() {
        return "Exact";
    }
}
