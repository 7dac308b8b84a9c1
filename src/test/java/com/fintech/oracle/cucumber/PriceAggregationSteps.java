package com.fintech.oracle.cucumber;

import com.fintech.oracle.aggregation.PriceAggregator;
import com.fintech.oracle.aggregation.PriceCache;
import com.fintech.oracle.config.OracleProperties;
import com.fintech.oracle.domain.AggregatedPrice;
import com.fintech.oracle.domain.PriceSource;
import com.fintech.oracle.exception.PriceFeedException;
import com.fintech.oracle.ingestion.PriceSourceProvider;
import io.cucumber.java.After;
import io.cucumber.java.Before;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Steps for aggregation scenarios. Sources are in-memory; results land in the application's
 * price cache.
 */
public class PriceAggregationSteps {

    @Autowired
    private PriceCache priceCache;

    private final List<PriceSourceProvider> providers = new ArrayList<>();
    private final OracleProperties.Feeds feeds = new OracleProperties.Feeds();
    private ExecutorService fetchExecutor;
    private PriceFeedException cycleError;

    @Before
    public void setUp() {
        fetchExecutor = Executors.newFixedThreadPool(4);
    }

    @After
    public void tearDown() {
        fetchExecutor.shutdownNow();
    }

    @Given("^price sources reporting ([\\d., ]+) for \"([^\"]*)\"$")
    public void priceSourcesReporting(String values, String symbol) {
        feeds.setSupportedSymbols(List.of(symbol));
        List<Double> prices = Arrays.stream(values.split(","))
            .map(String::trim)
            .map(Double::valueOf)
            .toList();
        for (int i = 0; i < prices.size(); i++) {
            providers.add(stub("source-" + i, prices.get(i)));
        }
    }

    @Given("a quorum of {int} sources with a deviation threshold of {double}")
    public void aQuorum(int quorum, double threshold) {
        feeds.setMinValidSources(quorum);
        feeds.setDeviationThreshold(threshold);
    }

    @When("an aggregation cycle runs for {string}")
    public void anAggregationCycleRuns(String symbol) {
        PriceAggregator aggregator = new PriceAggregator(providers, priceCache, fetchExecutor,
            CircuitBreakerRegistry.ofDefaults(), feeds, new SimpleMeterRegistry());
        try {
            aggregator.aggregate(symbol);
        } catch (PriceFeedException e) {
            cycleError = e;
        }
    }

    @Then("the published price of {string} is {double} from {int} sources")
    public void thePublishedPriceFrom(String symbol, double value, int sources) {
        AggregatedPrice price = priceCache.getPrice(symbol).orElseThrow();
        assertThat(price.value()).isCloseTo(value, within(1e-3));
        assertThat(price.contributingSourceCount()).isEqualTo(sources);
    }

    @Then("the published price of {string} is {double}")
    public void thePublishedPrice(String symbol, double value) {
        assertThat(priceCache.getPrice(symbol)).get()
            .extracting(AggregatedPrice::value)
            .isEqualTo(value);
    }

    @Then("the cycle fails with error code {string}")
    public void theCycleFails(String code) {
        assertThat(cycleError).isNotNull();
        assertThat(cycleError.getErrorCode().name()).isEqualTo(code);
    }

    private static PriceSourceProvider stub(String name, double value) {
        PriceSource source = new PriceSource(name, 1.0, "memory://" + name, "/price", Duration.ofSeconds(1));
        return new PriceSourceProvider() {
            @Override
            public PriceSource source() {
                return source;
            }

            @Override
            public double fetchPrice(String symbol) {
                return value;
            }
        };
    }
}
