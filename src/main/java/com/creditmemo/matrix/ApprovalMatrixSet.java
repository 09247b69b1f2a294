package com.creditmemo.matrix;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The matrices of one validation run, keyed by policy category.
 * A category may be absent when its matrix could not be loaded.
 */
public final class ApprovalMatrixSet {

    private final Map<PolicyCategory, ApprovalMatrix> matrices;

    private ApprovalMatrixSet(Map<PolicyCategory, ApprovalMatrix> matrices) {
        this.matrices = Collections.unmodifiableMap(matrices);
    }

    public static ApprovalMatrixSet of(ApprovalMatrix... matrices) {
        Map<PolicyCategory, ApprovalMatrix> byCategory = new EnumMap<>(PolicyCategory.class);
        for (ApprovalMatrix matrix : matrices) {
            byCategory.put(matrix.getCategory(), matrix);
        }
        return new ApprovalMatrixSet(byCategory);
    }

    public static ApprovalMatrixSet of(Map<PolicyCategory, ApprovalMatrix> matrices) {
        Map<PolicyCategory, ApprovalMatrix> byCategory = new EnumMap<>(PolicyCategory.class);
        byCategory.putAll(matrices);
        return new ApprovalMatrixSet(byCategory);
    }

    public static ApprovalMatrixSet empty() {
        return new ApprovalMatrixSet(new EnumMap<>(PolicyCategory.class));
    }

    public Optional<ApprovalMatrix> forCategory(PolicyCategory category) {
        return Optional.ofNullable(matrices.get(category));
    }

    public boolean contains(PolicyCategory category) {
        return matrices.containsKey(category);
    }
}
