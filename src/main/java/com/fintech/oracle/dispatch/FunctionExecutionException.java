package com.fintech.oracle.dispatch;

/**
 * A function execution request failed at the transport or runtime level.
 */
public class FunctionExecutionException extends RuntimeException {

    private final String functionId;

    public FunctionExecutionException(String functionId, String message, Throwable cause) {
        super(message, cause);
        this.functionId = functionId;
    }

    public String getFunctionId() {
        return functionId;
    }
}
