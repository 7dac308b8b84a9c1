package com.fintech.oracle.domain;

import java.util.Map;

/**
 * Input to trigger creation. Schedule and condition are still in their raw text form;
 * validation happens when the trigger is registered.
 *
 * @param id Caller-chosen unique trigger id
 * @param ownerId Owner of the trigger (user or account id)
 * @param type Trigger kind
 * @param schedule Cron expression, required for {@link TriggerType#SCHEDULE}
 * @param condition "SYMBOL above|below THRESHOLD", required for {@link TriggerType#PRICE_ALERT}
 * @param functionId Function to execute when the trigger fires
 * @param parameters Parameters passed to the function
 */
public record TriggerRequest(
    String id,
    String ownerId,
    TriggerType type,
    String schedule,
    String condition,
    String functionId,
    Map<String, Object> parameters
) {

    public static TriggerRequest schedule(String id, String ownerId, String cron,
                                          String functionId, Map<String, Object> parameters) {
        return new TriggerRequest(id, ownerId, TriggerType.SCHEDULE, cron, null, functionId, parameters);
    }

    public static TriggerRequest priceAlert(String id, String ownerId, String condition,
                                            String functionId, Map<String, Object> parameters) {
        return new TriggerRequest(id, ownerId, TriggerType.PRICE_ALERT, null, condition, functionId, parameters);
    }
}
