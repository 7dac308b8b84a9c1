package com.fintech.oracle.aggregation;

import com.fintech.oracle.config.OracleProperties;
import com.fintech.oracle.domain.AggregatedPrice;
import com.fintech.oracle.domain.PriceSource;
import com.fintech.oracle.domain.SourceQuote;
import com.fintech.oracle.exception.InsufficientQuorumException;
import com.fintech.oracle.exception.SourceTimeoutException;
import com.fintech.oracle.exception.UnsupportedSymbolException;
import com.fintech.oracle.ingestion.PriceSourceProvider;
import com.fintech.oracle.util.PriceStatistics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Multi-source price aggregator.
 *
 * One cycle fans out a fetch per source to a bounded worker pool, time-boxes each fetch,
 * rejects outliers around the median, enforces the source quorum and publishes the weighted
 * average to the {@link PriceCache}. A failed cycle never touches the cached value.
 */
public class PriceAggregator {

    private static final Logger log = LoggerFactory.getLogger(PriceAggregator.class);

    private final List<PriceSourceProvider> providers;
    private final PriceCache cache;
    private final ExecutorService fetchExecutor;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final OracleProperties.Feeds config;
    private final MeterRegistry meterRegistry;
    private final Set<String> supportedSymbols;

    // Symbols with a registered price gauge
    private final Set<String> gaugedSymbols = ConcurrentHashMap.newKeySet();

    public PriceAggregator(
            List<PriceSourceProvider> providers,
            PriceCache cache,
            ExecutorService fetchExecutor,
            CircuitBreakerRegistry circuitBreakerRegistry,
            OracleProperties.Feeds config,
            MeterRegistry meterRegistry) {
        this.providers = List.copyOf(providers);
        this.cache = cache;
        this.fetchExecutor = fetchExecutor;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.config = config;
        this.meterRegistry = meterRegistry;
        this.supportedSymbols = Set.copyOf(config.getSupportedSymbols());
    }

    /**
     * Runs one aggregation cycle for a symbol and publishes the result.
     *
     * @return the newly published price
     * @throws UnsupportedSymbolException if the symbol is not in the supported set
     * @throws InsufficientQuorumException if fewer than MinValidSources samples survive
     */
    public AggregatedPrice aggregate(String symbol) {
        if (!isSupported(symbol)) {
            throw new UnsupportedSymbolException(symbol);
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<SourceQuote> quotes = fetchAll(symbol);

            if (quotes.isEmpty()) {
                throw quorumFailure(symbol, 0, 0, 0);
            }

            double median = PriceStatistics.median(quotes);
            List<SourceQuote> survivors = PriceStatistics.rejectOutliers(quotes, median, config.getDeviationThreshold());
            int rejected = quotes.size() - survivors.size();
            if (rejected > 0) {
                meterRegistry.counter("oracle.aggregation.outliers.rejected", "symbol", symbol).increment(rejected);
                log.debug("Rejected {} outlier(s) for {}: median={}, threshold={}",
                         rejected, symbol, median, config.getDeviationThreshold());
            }

            if (survivors.size() < config.getMinValidSources()) {
                throw quorumFailure(symbol, survivors.size(), quotes.size(), rejected);
            }

            double value = PriceStatistics.weightedAverage(survivors);
            AggregatedPrice price = new AggregatedPrice(symbol, value, Instant.now(), survivors.size());
            cache.publish(price);
            registerGauge(symbol);

            meterRegistry.counter("oracle.aggregation.cycles", "symbol", symbol, "outcome", "published").increment();
            log.info("Aggregated price published: symbol={}, value={}, sources={}/{}, outliers={}",
                     symbol, value, survivors.size(), providers.size(), rejected);
            return price;

        } finally {
            sample.stop(meterRegistry.timer("oracle.aggregation.cycle.time", "symbol", symbol));
        }
    }

    public boolean isSupported(String symbol) {
        return symbol != null && supportedSymbols.contains(symbol);
    }

    public Set<String> supportedSymbols() {
        return supportedSymbols;
    }

    /** Read-through to the cache for the latest published price. */
    public Optional<AggregatedPrice> latest(String symbol) {
        return cache.getPrice(symbol);
    }

    /**
     * Dispatches every source fetch and collects the values that arrived in time.
     * Failures are recorded here and never retried within the cycle.
     */
    private List<SourceQuote> fetchAll(String symbol) {
        Map<PriceSourceProvider, CompletableFuture<Double>> pending = new LinkedHashMap<>();
        for (PriceSourceProvider provider : providers) {
            pending.put(provider, submitFetch(provider, symbol));
        }

        List<SourceQuote> quotes = new ArrayList<>(pending.size());
        pending.forEach((provider, future) -> {
            PriceSource source = provider.source();
            try {
                double value = future.join();
                if (!Double.isFinite(value)) {
                    recordFetch(source.name(), "invalid");
                    log.warn("Discarding non-finite value from {} for {}", source.name(), symbol);
                    return;
                }
                quotes.add(new SourceQuote(source.name(), value, effectiveWeight(source)));
                recordFetch(source.name(), "success");
            } catch (CompletionException e) {
                recordFailure(source, symbol, e.getCause() != null ? e.getCause() : e);
            }
        });
        return quotes;
    }

    private CompletableFuture<Double> submitFetch(PriceSourceProvider provider, String symbol) {
        PriceSource source = provider.source();
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker("price-source-" + source.name());
        Duration timeout = effectiveTimeout(source);
        try {
            return CompletableFuture
                .supplyAsync(() -> circuitBreaker.executeSupplier(() -> provider.fetchPrice(symbol)), fetchExecutor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void recordFailure(PriceSource source, String symbol, Throwable cause) {
        if (cause instanceof TimeoutException) {
            SourceTimeoutException timeout = new SourceTimeoutException(source.name(), symbol, effectiveTimeout(source));
            recordFetch(source.name(), "timeout");
            log.warn(timeout.getMessage());
        } else if (cause instanceof CallNotPermittedException) {
            recordFetch(source.name(), "circuit_open");
            log.warn("Skipping source {} for {}: circuit breaker open", source.name(), symbol);
        } else {
            recordFetch(source.name(), "failure");
            log.warn("Source {} failed for {}: {}", source.name(), symbol, cause.getMessage());
        }
    }

    private InsufficientQuorumException quorumFailure(String symbol, int valid, int collected, int rejected) {
        meterRegistry.counter("oracle.aggregation.cycles", "symbol", symbol, "outcome", "insufficient_quorum").increment();
        log.warn("Aggregation cycle failed for {}: {} valid of {} collected ({} outliers), {} required; keeping previous value",
                 symbol, valid, collected, rejected, config.getMinValidSources());
        return new InsufficientQuorumException(symbol, valid, config.getMinValidSources());
    }

    private void recordFetch(String source, String outcome) {
        meterRegistry.counter("oracle.aggregation.source.fetches", "source", source, "outcome", outcome).increment();
    }

    private void registerGauge(String symbol) {
        if (gaugedSymbols.add(symbol)) {
            Gauge.builder("oracle.price.value", cache,
                    c -> c.getPrice(symbol).map(AggregatedPrice::value).orElse(Double.NaN))
                .tag("symbol", symbol)
                .register(meterRegistry);
        }
    }

    private double effectiveWeight(PriceSource source) {
        return source.weight() > 0.0 ? source.weight() : config.getDefaultWeight();
    }

    private Duration effectiveTimeout(PriceSource source) {
        return source.timeout() != null ? source.timeout() : config.getDefaultTimeout();
    }
}
