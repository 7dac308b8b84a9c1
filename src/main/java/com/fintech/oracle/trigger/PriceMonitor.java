package com.fintech.oracle.trigger;

import com.fintech.oracle.aggregation.PriceCache;
import com.fintech.oracle.dispatch.ActionDispatcher;
import com.fintech.oracle.domain.AggregatedPrice;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Evaluates price alerts against the price cache at a fixed interval.
 *
 * A tick takes one snapshot of the cache, then scans the alert index under the registry's
 * read lock and dispatches every satisfied alert. Alerts are level-triggered: a condition
 * that stays true fires again on every tick.
 */
@Component
@ConditionalOnProperty(name = "oracle.monitor.enabled", havingValue = "true", matchIfMissing = true)
public class PriceMonitor {

    private static final Logger log = LoggerFactory.getLogger(PriceMonitor.class);

    private final PriceCache priceCache;
    private final TriggerRegistry registry;
    private final ActionDispatcher dispatcher;
    private final MeterRegistry meterRegistry;

    public PriceMonitor(PriceCache priceCache, TriggerRegistry registry,
                        ActionDispatcher dispatcher, MeterRegistry meterRegistry) {
        this.priceCache = priceCache;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.meterRegistry = meterRegistry;
    }

    @Scheduled(fixedRateString = "${oracle.monitor.tick-interval:PT1M}",
               initialDelayString = "${oracle.monitor.tick-interval:PT1M}")
    public void scheduledTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Price monitor tick failed", e);
        }
    }

    /**
     * Runs one evaluation pass.
     *
     * @return number of alerts that fired
     */
    public int tick() {
        Map<String, AggregatedPrice> prices = priceCache.getAllPrices();
        if (prices.isEmpty()) {
            log.debug("Price monitor tick skipped: no cached prices");
            return 0;
        }

        int fired = registry.scanAlerts(prices, (trigger, price) -> {
            log.info("Price alert fired: trigger={}, condition='{}', price={}",
                     trigger.id(), trigger.condition().toExpression(), price.value());
            dispatcher.dispatch(trigger, price);
        });

        meterRegistry.counter("oracle.monitor.ticks").increment();
        if (fired > 0) {
            meterRegistry.counter("oracle.monitor.alerts.fired").increment(fired);
        }
        log.debug("Price monitor tick: symbols={}, fired={}", prices.size(), fired);
        return fired;
    }
}
