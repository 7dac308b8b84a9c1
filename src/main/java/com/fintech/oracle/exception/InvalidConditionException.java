package com.fintech.oracle.exception;

/**
 * A price-alert condition did not match {@code "SYMBOL above|below THRESHOLD"}.
 */
public class InvalidConditionException extends TriggerException {

    public InvalidConditionException(String triggerId, String message) {
        super(ErrorCode.INVALID_CONDITION, triggerId, message);
    }

    public InvalidConditionException(String triggerId, String message, Throwable cause) {
        super(ErrorCode.INVALID_CONDITION, triggerId, message, cause);
    }
}
