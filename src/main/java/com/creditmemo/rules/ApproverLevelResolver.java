package com.creditmemo.rules;

import com.creditmemo.matrix.ApprovalMatrix;
import com.creditmemo.matrix.ApprovalMatrixEntry;
import com.creditmemo.rules.designation.DesignationMatchStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves a free-text approver designation to an approval level by running
 * the match strategies in order against the category's matrix.
 */
@Component
@Slf4j
public class ApproverLevelResolver {

    private final List<DesignationMatchStrategy> strategies;

    public ApproverLevelResolver(List<DesignationMatchStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
        for (DesignationMatchStrategy strategy : this.strategies) {
            log.debug("Registered designation match strategy: {}", strategy.getStrategyName());
        }
    }

    public ApproverLevel resolve(String designation, Optional<ApprovalMatrix> matrix) {
        String normalized = designation == null ? "" : designation.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty() || matrix.isEmpty()) {
            return ApproverLevel.unresolved();
        }

        for (DesignationMatchStrategy strategy : strategies) {
            Optional<ApprovalMatrixEntry> match = strategy.match(normalized, matrix.get());
            if (match.isPresent()) {
                log.debug("Designation '{}' matched '{}' by {}", designation,
                    match.get().getDesignation(), strategy.getStrategyName());
                return ApproverLevel.of(match.get().getLevel());
            }
        }
        return ApproverLevel.notFound();
    }
}
