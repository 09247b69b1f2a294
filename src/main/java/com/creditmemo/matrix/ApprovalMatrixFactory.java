package com.creditmemo.matrix;

import com.creditmemo.common.exception.InvalidMatrixException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the immutable matrix set of a run from loader rows.
 */
@Component
@Slf4j
public class ApprovalMatrixFactory {

    public ApprovalMatrixSet fromTiers(Map<String, List<MatrixTier>> tiersByCategory) {
        if (tiersByCategory == null || tiersByCategory.isEmpty()) {
            log.warn("No approval matrices supplied, every memo will lack a required level");
            return ApprovalMatrixSet.empty();
        }

        Map<PolicyCategory, ApprovalMatrix> matrices = new EnumMap<>(PolicyCategory.class);
        tiersByCategory.forEach((key, tiers) -> {
            PolicyCategory category = PolicyCategory.fromKey(key)
                .orElseThrow(() -> new InvalidMatrixException("Unknown matrix category: " + key));
            if (matrices.containsKey(category)) {
                throw new InvalidMatrixException("Duplicate matrix for category: " + category.getKey());
            }
            matrices.put(category, toMatrix(category, tiers));
        });

        for (PolicyCategory category : PolicyCategory.values()) {
            if (!matrices.containsKey(category)) {
                log.warn("No approval matrix for category {}", category.getKey());
            }
        }
        return ApprovalMatrixSet.of(matrices);
    }

    public ApprovalMatrix toMatrix(PolicyCategory category, List<MatrixTier> tiers) {
        List<ApprovalMatrixEntry> entries = new ArrayList<>();
        if (tiers != null) {
            for (MatrixTier tier : tiers) {
                entries.add(toEntry(category, tier));
            }
        }
        ApprovalMatrix matrix = ApprovalMatrix.of(category, entries);
        log.debug("Built {} matrix with {} tiers", category.getKey(), matrix.getEntries().size());
        return matrix;
    }

    private ApprovalMatrixEntry toEntry(PolicyCategory category, MatrixTier tier) {
        if (tier == null) {
            throw new InvalidMatrixException("Empty tier in " + category.getKey() + " matrix");
        }
        Integer level = tier.getLevel() != null
            ? tier.getLevel()
            : AmountRangeParser.parseLevel(tier.getLevelText()).orElseThrow(() ->
                new InvalidMatrixException(String.format("No approver level in %s matrix row '%s'",
                    category.getKey(), tier.getDesignation())));

        BigDecimal upperLimit = tier.getUpperLimit() != null
            ? tier.getUpperLimit()
            : AmountRangeParser.parseUpperLimit(tier.getAmountRange()).orElse(null);

        return ApprovalMatrixEntry.of(level, tier.getDesignation(), upperLimit);
    }
}
