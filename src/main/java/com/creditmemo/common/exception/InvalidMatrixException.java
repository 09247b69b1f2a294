package com.creditmemo.common.exception;

/**
 * Thrown when an approval matrix tier cannot be built from the supplied rows.
 */
public class InvalidMatrixException extends CreditMemoEngineException {

    public InvalidMatrixException(String message) {
        super(message);
    }
}
