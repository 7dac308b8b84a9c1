package com.fintech.oracle.trigger;

import com.fintech.oracle.domain.PriceAlertCondition;

/**
 * Entry in the (symbol, owner) alert index. Points back at its trigger by id.
 */
record PriceAlert(String triggerId, PriceAlertCondition condition) {
}
