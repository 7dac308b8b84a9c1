package com.fintech.oracle.util;

import com.fintech.oracle.domain.SourceQuote;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Statistics used by an aggregation cycle: median, outlier rejection and weighted averaging.
 *
 * Thread-safe and stateless - all methods are pure functions.
 */
public final class PriceStatistics {

    private PriceStatistics() {
    }

    /**
     * Median of the quote values. Even counts average the two middle values.
     *
     * @throws IllegalArgumentException if quotes is empty
     */
    public static double median(List<SourceQuote> quotes) {
        if (quotes.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute median of no values");
        }
        double[] values = quotes.stream().mapToDouble(SourceQuote::value).toArray();
        Arrays.sort(values);

        int n = values.length;
        if (n % 2 == 0) {
            return (values[n / 2 - 1] + values[n / 2]) / 2.0;
        }
        return values[n / 2];
    }

    /**
     * Relative distance of a value from the median: |value - median| / |median|.
     * Falls back to the absolute distance when the median is zero.
     */
    public static double relativeDeviation(double value, double median) {
        double distance = Math.abs(value - median);
        return median == 0.0 ? distance : distance / Math.abs(median);
    }

    /**
     * Keeps the quotes whose relative deviation from the median is within the threshold.
     * A threshold of zero or less disables rejection.
     */
    public static List<SourceQuote> rejectOutliers(List<SourceQuote> quotes, double median, double deviationThreshold) {
        if (deviationThreshold <= 0.0) {
            return List.copyOf(quotes);
        }
        List<SourceQuote> survivors = new ArrayList<>(quotes.size());
        for (SourceQuote quote : quotes) {
            if (relativeDeviation(quote.value(), median) <= deviationThreshold) {
                survivors.add(quote);
            }
        }
        return survivors;
    }

    /**
     * Weighted arithmetic mean: sum(w * v) / sum(w).
     *
     * @throws IllegalArgumentException if quotes is empty or the total weight is not positive
     */
    public static double weightedAverage(List<SourceQuote> quotes) {
        if (quotes.isEmpty()) {
            throw new IllegalArgumentException("Cannot average no values");
        }
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (SourceQuote quote : quotes) {
            weightedSum += quote.value() * quote.weight();
            totalWeight += quote.weight();
        }
        if (totalWeight <= 0.0) {
            throw new IllegalArgumentException("Total weight must be positive: " + totalWeight);
        }
        return weightedSum / totalWeight;
    }
}
