package com.fintech.oracle.exception;

/**
 * Root of all oracle and automation errors. Unchecked, carries an {@link ErrorCode}.
 */
public abstract class OracleException extends RuntimeException {

    private final ErrorCode errorCode;

    protected OracleException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected OracleException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
