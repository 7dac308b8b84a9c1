package com.fintech.oracle.exception;

/**
 * Fewer sources than the configured quorum survived an aggregation cycle.
 * The previously published value for the symbol is retained.
 */
public class InsufficientQuorumException extends PriceFeedException {

    private final int validSources;
    private final int requiredSources;

    public InsufficientQuorumException(String symbol, int validSources, int requiredSources) {
        super(ErrorCode.INSUFFICIENT_QUORUM, symbol,
            String.format("Insufficient valid sources for %s: %d of %d required", symbol, validSources, requiredSources));
        this.validSources = validSources;
        this.requiredSources = requiredSources;
    }

    public int getValidSources() {
        return validSources;
    }

    public int getRequiredSources() {
        return requiredSources;
    }
}
