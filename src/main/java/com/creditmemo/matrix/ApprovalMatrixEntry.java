package com.creditmemo.matrix;

import com.creditmemo.common.exception.InvalidMatrixException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * One tier of an approval matrix: the approver level and designation allowed
 * to approve amounts up to and including {@code upperLimit}.
 *
 * A null upper limit denotes the open-ended top tier.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApprovalMatrixEntry {

    int level;
    String designation;
    BigDecimal upperLimit;

    public static ApprovalMatrixEntry of(int level, String designation, BigDecimal upperLimit) {
        if (level <= 0) {
            throw new InvalidMatrixException("Approver level must be positive, got " + level);
        }
        if (designation == null || designation.trim().isEmpty()) {
            throw new InvalidMatrixException("Designation is required for level " + level);
        }
        return new ApprovalMatrixEntry(level, designation, upperLimit);
    }

    public static ApprovalMatrixEntry of(int level, String designation, String upperLimit) {
        return of(level, designation, new BigDecimal(upperLimit));
    }

    public static ApprovalMatrixEntry unbounded(int level, String designation) {
        return of(level, designation, (BigDecimal) null);
    }

    @JsonIgnore
    public boolean isUnbounded() {
        return upperLimit == null;
    }

    /**
     * Whether this tier's ceiling is at or above the given amount.
     */
    public boolean covers(BigDecimal amount) {
        return isUnbounded() || upperLimit.compareTo(amount) >= 0;
    }

    /**
     * Designation trimmed and case-folded for matching.
     */
    @JsonIgnore
    public String getNormalizedDesignation() {
        return designation.trim().toLowerCase(Locale.ROOT);
    }
}
