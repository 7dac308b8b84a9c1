package com.fintech.oracle.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registered rule binding a schedule or a price condition to a function execution.
 * Immutable: a trigger is changed only by deleting and recreating it.
 *
 * @param id Unique trigger id
 * @param ownerId Owner of the trigger
 * @param type Trigger kind
 * @param schedule Normalised cron expression; null unless {@link TriggerType#SCHEDULE}
 * @param condition Parsed alert condition; null unless {@link TriggerType#PRICE_ALERT}
 * @param functionId Function to execute
 * @param parameters Unmodifiable function parameters
 * @param createdAt Registration time
 */
public record Trigger(
    String id,
    String ownerId,
    TriggerType type,
    String schedule,
    PriceAlertCondition condition,
    String functionId,
    Map<String, Object> parameters,
    Instant createdAt
) {

    public Trigger {
        Objects.requireNonNull(id, "Trigger id cannot be null");
        Objects.requireNonNull(type, "Trigger type cannot be null");
        Objects.requireNonNull(functionId, "Function id cannot be null");
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
