package com.creditmemo.api.dto;

import com.creditmemo.matrix.MatrixTier;
import com.creditmemo.memo.CreditMemoRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * DTO for validating a batch of credit memos.
 */
@Data
public class ValidateCreditMemosRequest {

    @NotNull(message = "Records are required")
    private List<CreditMemoRecord> records;

    /**
     * Matrix rows keyed by category: promotional, contract, other.
     * A missing category leaves its memos without a required level.
     */
    private Map<String, List<@Valid MatrixTier>> matrices;

    @Valid
    private ComplianceSettingsRequest settings;
}
