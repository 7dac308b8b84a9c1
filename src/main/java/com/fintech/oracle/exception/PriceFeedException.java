package com.fintech.oracle.exception;

/**
 * Errors raised by price fetching, aggregation and feed registration.
 */
public abstract class PriceFeedException extends OracleException {

    private final String symbol;

    protected PriceFeedException(ErrorCode errorCode, String symbol, String message) {
        super(errorCode, message);
        this.symbol = symbol;
    }

    protected PriceFeedException(ErrorCode errorCode, String symbol, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
