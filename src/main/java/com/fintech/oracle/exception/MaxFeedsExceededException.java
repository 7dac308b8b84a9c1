package com.fintech.oracle.exception;

public class MaxFeedsExceededException extends PriceFeedException {

    public MaxFeedsExceededException(String symbol, int maxFeeds) {
        super(ErrorCode.MAX_FEEDS_EXCEEDED, symbol,
            String.format("Cannot track %s: maximum of %d price feeds reached", symbol, maxFeeds));
    }
}
