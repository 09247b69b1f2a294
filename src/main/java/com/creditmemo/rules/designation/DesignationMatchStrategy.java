package com.creditmemo.rules.designation;

import com.creditmemo.matrix.ApprovalMatrix;
import com.creditmemo.matrix.ApprovalMatrixEntry;

import java.util.Optional;

/**
 * One step of the designation lookup cascade.
 *
 * Strategies are tried in {@link org.springframework.core.annotation.Order} order
 * and the first one returning a row decides the approver level.
 */
public interface DesignationMatchStrategy {

    /**
     * Find the first matrix row matching the designation.
     *
     * @param designation trimmed, lower-cased approver designation, never empty
     * @param matrix      matrix of the memo's category
     * @return the matching row, or empty when this strategy does not match
     */
    Optional<ApprovalMatrixEntry> match(String designation, ApprovalMatrix matrix);

    /**
     * Get the name of this strategy.
     */
    String getStrategyName();
}
