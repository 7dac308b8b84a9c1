package com.fintech.oracle.domain;

/**
 * Closed set of trigger kinds. Every creation, deletion and evaluation site switches over all values.
 */
public enum TriggerType {
    SCHEDULE,
    PRICE_ALERT
}
