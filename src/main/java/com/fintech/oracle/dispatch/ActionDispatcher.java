package com.fintech.oracle.dispatch;

import com.fintech.oracle.domain.AggregatedPrice;
import com.fintech.oracle.domain.PriceAlertCondition;
import com.fintech.oracle.domain.Trigger;
import com.fintech.oracle.domain.TriggerType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget execution of triggered functions.
 *
 * {@link #dispatch} only enqueues onto a bounded executor and returns; the worker calls the
 * {@link FunctionExecutor} exactly once. Failures are logged and counted, never retried and
 * never written back to the registry. When the queue is full the dispatch is dropped.
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final FunctionExecutor functionExecutor;
    private final TaskExecutor taskExecutor;
    private final MeterRegistry meterRegistry;

    public ActionDispatcher(FunctionExecutor functionExecutor, TaskExecutor taskExecutor, MeterRegistry meterRegistry) {
        this.functionExecutor = functionExecutor;
        this.taskExecutor = taskExecutor;
        this.meterRegistry = meterRegistry;
    }

    /** Dispatches a schedule firing or a manual execution. */
    public boolean dispatch(Trigger trigger) {
        return submit(trigger, buildParameters(trigger, null));
    }

    /** Dispatches a price-alert firing with the price that satisfied the condition. */
    public boolean dispatch(Trigger trigger, AggregatedPrice price) {
        return submit(trigger, buildParameters(trigger, price));
    }

    /**
     * Trigger parameters merged over the execution context. Keys supplied by the trigger's
     * owner win over the generated ones.
     */
    static Map<String, Object> buildParameters(Trigger trigger, AggregatedPrice price) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("trigger_id", trigger.id());
        parameters.put("trigger_type", trigger.type().name().toLowerCase(Locale.ROOT));
        parameters.put("timestamp", Instant.now().getEpochSecond());

        if (trigger.type() == TriggerType.SCHEDULE) {
            parameters.put("schedule", trigger.schedule());
        } else {
            PriceAlertCondition condition = trigger.condition();
            parameters.put("symbol", condition.symbol());
            parameters.put("comparison", condition.comparison().label());
            parameters.put("threshold", condition.threshold());
            if (price != null) {
                parameters.put("price", price.value());
            }
        }

        parameters.putAll(trigger.parameters());
        return parameters;
    }

    private boolean submit(Trigger trigger, Map<String, Object> parameters) {
        String type = trigger.type().name();
        try {
            taskExecutor.execute(() -> execute(trigger, parameters));
            meterRegistry.counter("oracle.dispatch.submitted", "type", type).increment();
            return true;
        } catch (RejectedExecutionException e) {
            meterRegistry.counter("oracle.dispatch.rejected", "type", type).increment();
            log.warn("Dispatch queue full, dropping execution: trigger={}, function={}",
                     trigger.id(), trigger.functionId());
            return false;
        }
    }

    private void execute(Trigger trigger, Map<String, Object> parameters) {
        String type = trigger.type().name();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            functionExecutor.execute(trigger.functionId(), parameters);
            meterRegistry.counter("oracle.dispatch.executions", "type", type, "outcome", "success").increment();
            log.info("Function executed: trigger={}, function={}", trigger.id(), trigger.functionId());
        } catch (RuntimeException e) {
            meterRegistry.counter("oracle.dispatch.executions", "type", type, "outcome", "failure").increment();
            log.error("Function execution failed: trigger={}, function={}, error={}",
                      trigger.id(), trigger.functionId(), e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("oracle.dispatch.execution.time", "type", type));
        }
    }
}
