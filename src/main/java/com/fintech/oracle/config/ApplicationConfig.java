package com.fintech.oracle.config;

import com.fintech.oracle.aggregation.PriceAggregator;
import com.fintech.oracle.aggregation.PriceCache;
import com.fintech.oracle.aggregation.PriceFeedScheduler;
import com.fintech.oracle.dispatch.ActionDispatcher;
import com.fintech.oracle.dispatch.FunctionExecutor;
import com.fintech.oracle.dispatch.RestFunctionExecutor;
import com.fintech.oracle.domain.PriceSource;
import com.fintech.oracle.ingestion.HttpPriceSourceProvider;
import com.fintech.oracle.ingestion.PriceSourceProvider;
import com.fintech.oracle.trigger.TriggerRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public PriceCache priceCache() {
        return new PriceCache();
    }

    @Bean
    public TriggerRegistry triggerRegistry() {
        return new TriggerRegistry();
    }

    /**
     * Fixed pool shared by all source fetches. On shutdown, fetches in flight are allowed to
     * finish or hit their own timeout.
     */
    @Bean
    public ThreadPoolTaskExecutor priceFetchExecutor(OracleProperties properties) {
        OracleProperties.Feeds feeds = properties.getFeeds();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(feeds.getWorkerCount());
        executor.setMaxPoolSize(feeds.getWorkerCount());
        executor.setThreadNamePrefix("price-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(feeds.getShutdownTimeout().toMillis());
        return executor;
    }

    @Bean
    public PriceAggregator priceAggregator(
            OracleProperties properties,
            RestClient.Builder restClientBuilder,
            PriceCache priceCache,
            @Qualifier("priceFetchExecutor") ThreadPoolTaskExecutor priceFetchExecutor,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        List<PriceSourceProvider> providers = properties.getSources().stream()
            .map(source -> toProvider(source, properties.getFeeds(), restClientBuilder))
            .toList();
        return new PriceAggregator(providers, priceCache, priceFetchExecutor.getThreadPoolExecutor(),
                                   circuitBreakerRegistry, properties.getFeeds(), meterRegistry);
    }

    @Bean
    public ThreadPoolTaskScheduler priceFeedTaskScheduler(OracleProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getFeeds().getWorkerCount());
        scheduler.setThreadNamePrefix("price-feed-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationMillis(properties.getFeeds().getShutdownTimeout().toMillis());
        return scheduler;
    }

    @Bean
    public PriceFeedScheduler priceFeedScheduler(
            PriceAggregator priceAggregator,
            @Qualifier("priceFeedTaskScheduler") ThreadPoolTaskScheduler priceFeedTaskScheduler,
            OracleProperties properties) {
        return new PriceFeedScheduler(priceAggregator, priceFeedTaskScheduler, properties.getFeeds());
    }

    @Bean
    public ThreadPoolTaskExecutor dispatchTaskExecutor(OracleProperties properties) {
        OracleProperties.Dispatch dispatch = properties.getDispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.getPoolSize());
        executor.setMaxPoolSize(dispatch.getPoolSize());
        executor.setQueueCapacity(dispatch.getQueueCapacity());
        executor.setThreadNamePrefix("dispatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public FunctionExecutor functionExecutor(OracleProperties properties, RestClient.Builder restClientBuilder) {
        OracleProperties.Executor executor = properties.getExecutor();
        RestClient restClient = restClientBuilder.clone()
            .baseUrl(executor.getBaseUrl())
            .requestFactory(requestFactory(executor.getConnectTimeout(), executor.getReadTimeout()))
            .build();
        return new RestFunctionExecutor(restClient);
    }

    @Bean
    public ActionDispatcher actionDispatcher(
            FunctionExecutor functionExecutor,
            @Qualifier("dispatchTaskExecutor") ThreadPoolTaskExecutor dispatchTaskExecutor,
            MeterRegistry meterRegistry) {
        return new ActionDispatcher(functionExecutor, dispatchTaskExecutor, meterRegistry);
    }

    private static PriceSourceProvider toProvider(OracleProperties.Source config,
                                                  OracleProperties.Feeds feeds,
                                                  RestClient.Builder restClientBuilder) {
        Duration timeout = config.getTimeout() != null ? config.getTimeout() : feeds.getDefaultTimeout();
        double weight = config.getWeight() != null ? config.getWeight() : 0.0;
        PriceSource source = new PriceSource(config.getName(), weight, config.getEndpoint(), config.getPricePath(), timeout);

        RestClient restClient = restClientBuilder.clone()
            .requestFactory(requestFactory(timeout, timeout))
            .build();
        return new HttpPriceSourceProvider(source, restClient);
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }
}
