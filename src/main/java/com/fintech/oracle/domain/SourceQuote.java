package com.fintech.oracle.domain;

/**
 * One value returned by a source within an aggregation cycle.
 *
 * @param source Source name
 * @param value Raw price
 * @param weight Effective weight (configured weight, or the default weight when unset)
 */
public record SourceQuote(String source, double value, double weight) {
}
