package com.fintech.oracle.exception;

import java.time.Duration;

/**
 * A single source did not answer within its fetch timeout. Never fatal to a cycle.
 */
public class SourceTimeoutException extends PriceFeedException {

    private final String source;

    public SourceTimeoutException(String source, String symbol, Duration timeout) {
        super(ErrorCode.SOURCE_TIMEOUT, symbol,
            String.format("Source '%s' timed out after %dms fetching %s", source, timeout.toMillis(), symbol));
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
