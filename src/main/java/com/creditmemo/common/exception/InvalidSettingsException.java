package com.creditmemo.common.exception;

/**
 * Thrown when compliance settings are out of range.
 */
public class InvalidSettingsException extends CreditMemoEngineException {

    private final String setting;

    public InvalidSettingsException(String setting, String reason) {
        super("Invalid setting " + setting + ": " + reason);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
