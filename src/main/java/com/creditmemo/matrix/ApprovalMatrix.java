package com.creditmemo.matrix;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable approval matrix of a single policy category.
 *
 * Entries are kept sorted by upper limit (open-ended tier last), then by level,
 * so the first entry covering an amount is the minimum tier for it.
 */
@EqualsAndHashCode
@ToString
public final class ApprovalMatrix {

    static final Comparator<ApprovalMatrixEntry> TIER_ORDER = Comparator
        .<ApprovalMatrixEntry, BigDecimal>comparing(ApprovalMatrixEntry::getUpperLimit,
            Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparingInt(ApprovalMatrixEntry::getLevel);

    private final PolicyCategory category;
    private final List<ApprovalMatrixEntry> entries;

    private ApprovalMatrix(PolicyCategory category, List<ApprovalMatrixEntry> entries) {
        this.category = category;
        this.entries = entries;
    }

    public static ApprovalMatrix of(PolicyCategory category, List<ApprovalMatrixEntry> entries) {
        List<ApprovalMatrixEntry> sorted = new ArrayList<>(entries);
        sorted.sort(TIER_ORDER);
        return new ApprovalMatrix(category, Collections.unmodifiableList(sorted));
    }

    public static ApprovalMatrix of(PolicyCategory category, ApprovalMatrixEntry... entries) {
        return of(category, List.of(entries));
    }

    public PolicyCategory getCategory() {
        return category;
    }

    public List<ApprovalMatrixEntry> getEntries() {
        return entries;
    }

    /**
     * Lowest tier whose ceiling is at or above the amount.
     */
    public Optional<ApprovalMatrixEntry> findTierFor(BigDecimal amount) {
        return entries.stream()
            .filter(entry -> entry.covers(amount))
            .findFirst();
    }
}
