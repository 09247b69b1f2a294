package com.creditmemo.rules;

import com.creditmemo.matrix.ApprovalMatrix;
import com.creditmemo.matrix.ApprovalMatrixEntry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Resolves the minimum approval level a memo amount requires.
 */
@Component
public class RequiredLevelResolver {

    /**
     * @param amount parsed memo amount, empty when it could not be parsed
     * @param matrix matrix of the memo's category, empty when it was not loaded
     * @return level of the lowest tier covering the amount, empty when undefined
     */
    public Optional<Integer> resolve(Optional<BigDecimal> amount, Optional<ApprovalMatrix> matrix) {
        if (amount.isEmpty() || matrix.isEmpty()) {
            return Optional.empty();
        }
        return matrix.get().findTierFor(amount.get())
            .map(ApprovalMatrixEntry::getLevel);
    }
}
