package com.creditmemo.common.exception;

/**
 * Base exception for all credit memo engine exceptions.
 */
public class CreditMemoEngineException extends RuntimeException {

    public CreditMemoEngineException(String message) {
        super(message);
    }

    public CreditMemoEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
