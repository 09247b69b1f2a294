package com.creditmemo.matrix;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A raw approval matrix row as delivered by the loader.
 *
 * Either the typed columns ({@code level}, {@code upperLimit}) or their
 * sheet-text forms ({@code levelText}, {@code amountRange}) may be supplied;
 * typed values win when both are present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatrixTier {

    private Integer level;

    /**
     * Level as written in the sheet, e.g. "Level 2".
     */
    private String levelText;

    @NotBlank(message = "Designation is required")
    private String designation;

    private BigDecimal upperLimit;

    /**
     * Amount range as written in the sheet, e.g. "10,001 - 50,000".
     */
    private String amountRange;
}
