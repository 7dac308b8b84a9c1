package com.fintech.oracle.aggregation;

import com.fintech.oracle.config.OracleProperties;
import com.fintech.oracle.domain.AggregatedPrice;
import com.fintech.oracle.exception.MaxFeedsExceededException;
import com.fintech.oracle.exception.PriceFeedException;
import com.fintech.oracle.exception.UnsupportedSymbolException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs one recurring aggregation task per tracked symbol.
 *
 * The cadence is the configured update interval clamped into [min, max]. The number of
 * tracked symbols is capped by MaxPriceFeeds. Cycle failures are logged and absorbed so a
 * symbol with a persistent quorum failure only goes stale; other symbols keep updating.
 */
public class PriceFeedScheduler {

    private static final Logger log = LoggerFactory.getLogger(PriceFeedScheduler.class);

    private final PriceAggregator aggregator;
    private final TaskScheduler taskScheduler;
    private final OracleProperties.Feeds config;

    // Guarded by this
    private final Map<String, ScheduledFuture<?>> feeds = new LinkedHashMap<>();

    public PriceFeedScheduler(PriceAggregator aggregator, TaskScheduler taskScheduler, OracleProperties.Feeds config) {
        this.aggregator = aggregator;
        this.taskScheduler = taskScheduler;
        this.config = config;
    }

    @PostConstruct
    public void start() {
        if (!config.isAutoStart()) {
            log.info("Price feed auto-start disabled; no symbols tracked at startup");
            return;
        }
        for (String symbol : config.getSupportedSymbols()) {
            try {
                track(symbol);
            } catch (PriceFeedException e) {
                log.error("Failed to track {} at startup: {}", symbol, e.getMessage());
            }
        }
        log.info("Price feed scheduler started: symbols={}, interval={}", trackedSymbols(), updateInterval());
    }

    /**
     * Starts the recurring aggregation for a symbol. The first cycle runs immediately.
     * Tracking an already tracked symbol is a no-op.
     *
     * @throws UnsupportedSymbolException if the symbol is not supported
     * @throws MaxFeedsExceededException if MaxPriceFeeds symbols are already tracked
     */
    public synchronized void track(String symbol) {
        if (!aggregator.isSupported(symbol)) {
            throw new UnsupportedSymbolException(symbol);
        }
        if (feeds.containsKey(symbol)) {
            return;
        }
        if (feeds.size() >= config.getMaxPriceFeeds()) {
            throw new MaxFeedsExceededException(symbol, config.getMaxPriceFeeds());
        }

        Duration interval = updateInterval();
        ScheduledFuture<?> future = taskScheduler.scheduleWithFixedDelay(
            () -> runCycle(symbol), Instant.now(), interval);
        feeds.put(symbol, future);
        log.info("Tracking price feed: symbol={}, interval={}", symbol, interval);
    }

    /** Stops the recurring aggregation. The last published price stays in the cache. */
    public synchronized boolean untrack(String symbol) {
        ScheduledFuture<?> future = feeds.remove(symbol);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.info("Stopped tracking price feed: symbol={}", symbol);
        return true;
    }

    /**
     * Runs an immediate cycle for a tracked symbol on the caller's thread.
     *
     * @throws UnsupportedSymbolException if the symbol is not tracked
     */
    public Optional<AggregatedPrice> refreshNow(String symbol) {
        if (!isTracked(symbol)) {
            throw new UnsupportedSymbolException(symbol);
        }
        return runCycle(symbol);
    }

    public synchronized boolean isTracked(String symbol) {
        return feeds.containsKey(symbol);
    }

    public synchronized Set<String> trackedSymbols() {
        return Set.copyOf(feeds.keySet());
    }

    /** Configured update interval clamped into [MinUpdateInterval, MaxUpdateInterval]. */
    public Duration updateInterval() {
        Duration interval = config.getUpdateInterval();
        if (interval.compareTo(config.getMinUpdateInterval()) < 0) {
            return config.getMinUpdateInterval();
        }
        if (interval.compareTo(config.getMaxUpdateInterval()) > 0) {
            return config.getMaxUpdateInterval();
        }
        return interval;
    }

    /**
     * Cancels every recurring task. Cycles already running finish or time out on their own.
     */
    @PreDestroy
    public synchronized void shutdown() {
        log.info("Stopping {} price feed(s)", feeds.size());
        feeds.values().forEach(future -> future.cancel(false));
        feeds.clear();
    }

    private Optional<AggregatedPrice> runCycle(String symbol) {
        try {
            return Optional.of(aggregator.aggregate(symbol));
        } catch (PriceFeedException e) {
            log.warn("Aggregation cycle failed: symbol={}, code={}, reason={}", symbol, e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in aggregation cycle for {}", symbol, e);
        }
        return Optional.empty();
    }
}
