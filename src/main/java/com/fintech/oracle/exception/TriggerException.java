package com.fintech.oracle.exception;

/**
 * Errors raised synchronously by trigger management. Never partially applied.
 */
public abstract class TriggerException extends OracleException {

    private final String triggerId;

    protected TriggerException(ErrorCode errorCode, String triggerId, String message) {
        super(errorCode, message);
        this.triggerId = triggerId;
    }

    protected TriggerException(ErrorCode errorCode, String triggerId, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.triggerId = triggerId;
    }

    public String getTriggerId() {
        return triggerId;
    }
}
