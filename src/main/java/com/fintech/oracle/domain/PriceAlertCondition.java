package com.fintech.oracle.domain;

import java.math.BigDecimal;

/**
 * Parsed form of a price-alert condition such as {@code "NEO above 10.5"}.
 *
 * @param symbol Token whose aggregated price is checked
 * @param comparison Direction of the check
 * @param threshold Price the aggregated value is compared against
 */
public record PriceAlertCondition(
    String symbol,
    Comparison comparison,
    double threshold
) {

    public PriceAlertCondition {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Condition symbol cannot be blank");
        }
        if (comparison == null) {
            throw new IllegalArgumentException("Condition comparison cannot be null");
        }
        if (!Double.isFinite(threshold)) {
            throw new IllegalArgumentException("Condition threshold must be a finite number");
        }
    }

    /**
     * Parses {@code "SYMBOL COMPARISON THRESHOLD"}: exactly three whitespace-separated tokens.
     * The threshold is a plain decimal number, optionally with an exponent.
     *
     * @throws IllegalArgumentException if the text does not decompose into the three fields
     */
    public static PriceAlertCondition parse(String condition) {
        if (condition == null || condition.isBlank()) {
            throw new IllegalArgumentException("Condition cannot be empty for price alert trigger");
        }
        String[] parts = condition.trim().split("\\s+");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid condition format: " + condition);
        }

        Comparison comparison = Comparison.fromString(parts[1]);
        double threshold;
        try {
            threshold = new BigDecimal(parts[2]).doubleValue();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid threshold in condition: " + parts[2], e);
        }
        return new PriceAlertCondition(parts[0], comparison, threshold);
    }

    /** Returns true if the given aggregated price satisfies this condition. */
    public boolean matches(double price) {
        return comparison.test(price, threshold);
    }

    /** Canonical text form, e.g. "NEO above 10.5". */
    public String toExpression() {
        return symbol + " " + comparison.label() + " " + threshold;
    }
}
