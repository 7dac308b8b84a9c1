package com.fintech.oracle.domain;

import java.time.Duration;

/**
 * Static description of an external price source.
 *
 * @param name Unique source name (e.g., "binance")
 * @param weight Influence on the combined value; higher weight, proportionally higher influence
 * @param endpoint URI template; {@code {symbol}} is expanded per request
 * @param pricePath JSON Pointer to the price inside the response body (e.g., "/price")
 * @param timeout Per-fetch timeout
 */
public record PriceSource(
    String name,
    double weight,
    String endpoint,
    String pricePath,
    Duration timeout
) {
}
