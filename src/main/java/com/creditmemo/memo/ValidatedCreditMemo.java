package com.creditmemo.memo;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A credit memo row with its validation columns, serialized as one flat row.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidatedCreditMemo {

    @JsonUnwrapped
    private CreditMemoRecord record;

    @JsonUnwrapped
    private ValidationOutcome outcome;
}
