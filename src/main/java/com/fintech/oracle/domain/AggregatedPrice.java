package com.fintech.oracle.domain;

import java.time.Instant;

/**
 * Latest accepted price for a symbol. Published as a whole and never partially updated.
 *
 * @param symbol Tracked token (e.g., "NEO")
 * @param value Weighted combination of the surviving source samples
 * @param computedAt When the aggregation cycle completed
 * @param contributingSourceCount Number of samples that survived outlier rejection
 */
public record AggregatedPrice(
    String symbol,
    double value,
    Instant computedAt,
    int contributingSourceCount
) {

    public AggregatedPrice {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or blank");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Aggregated value must be finite: " + value);
        }
        if (contributingSourceCount < 1) {
            throw new IllegalArgumentException("At least one contributing source is required");
        }
    }
}
