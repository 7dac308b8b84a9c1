package com.fintech.oracle.exception;

/**
 * Stable error identifiers for aggregation and trigger-management failures.
 */
public enum ErrorCode {

    SOURCE_TIMEOUT,
    INSUFFICIENT_QUORUM,
    UNSUPPORTED_SYMBOL,
    MAX_FEEDS_EXCEEDED,

    DUPLICATE_ID,
    NOT_FOUND,
    INVALID_SCHEDULE,
    INVALID_CONDITION
}
