package com.fintech.oracle.exception;

public class UnsupportedSymbolException extends PriceFeedException {

    public UnsupportedSymbolException(String symbol) {
        super(ErrorCode.UNSUPPORTED_SYMBOL, symbol, "Unsupported symbol: " + symbol);
    }
}
