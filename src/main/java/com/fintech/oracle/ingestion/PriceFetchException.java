package com.fintech.oracle.ingestion;

/**
 * A source could not produce a usable price. Absorbed by the aggregation cycle.
 */
public class PriceFetchException extends RuntimeException {

    private final String source;

    public PriceFetchException(String source, String message) {
        super(message);
        this.source = source;
    }

    public PriceFetchException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
