package com.fintech.oracle.domain;

import java.util.Locale;

/**
 * Direction of a price-alert threshold check. Both comparisons are strict.
 */
public enum Comparison {

    ABOVE {
        @Override
        public boolean test(double price, double threshold) {
            return price > threshold;
        }
    },
    BELOW {
        @Override
        public boolean test(double price, double threshold) {
            return price < threshold;
        }
    };

    public abstract boolean test(double price, double threshold);

    /** Parses "above" / "below", case-insensitively. */
    public static Comparison fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Comparison cannot be null");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "above" -> ABOVE;
            case "below" -> BELOW;
            default -> throw new IllegalArgumentException(
                "Unsupported comparison '" + value + "'. Must be one of: above, below");
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
