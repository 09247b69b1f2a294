package com.creditmemo.validation;

import com.creditmemo.memo.ValidatedCreditMemo;
import com.creditmemo.rules.ComplianceSettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Result of validating a batch of credit memos.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ValidationReport {

    private String runId;
    private Instant validatedAt;
    private ComplianceSettings settings;
    private ValidationSummary summary;

    /**
     * Augmented memo table, in input order.
     */
    private List<ValidatedCreditMemo> results;
}
