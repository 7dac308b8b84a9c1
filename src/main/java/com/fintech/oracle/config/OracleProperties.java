package com.fintech.oracle.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized configuration for the price oracle and automation engine.
 * Maps to 'oracle.*' properties in application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "oracle")
public class OracleProperties {

    @Valid
    private Feeds feeds = new Feeds();

    @Valid
    private List<Source> sources = new ArrayList<>();

    @Valid
    private Monitor monitor = new Monitor();

    @Valid
    private Schedule schedule = new Schedule();

    @Valid
    private Dispatch dispatch = new Dispatch();

    @Valid
    private Executor executor = new Executor();

    @Data
    public static class Feeds {
        /** Symbols the oracle accepts; anything else is rejected before dispatch. */
        private List<String> supportedSymbols = new ArrayList<>(List.of("NEO", "GAS"));
        /** Track every supported symbol at startup. */
        private boolean autoStart = true;
        @NotNull
        private Duration updateInterval = Duration.ofSeconds(30);
        @NotNull
        private Duration minUpdateInterval = Duration.ofSeconds(5);
        @NotNull
        private Duration maxUpdateInterval = Duration.ofMinutes(10);
        @Min(1)
        private int maxPriceFeeds = 100;
        @Min(1)
        private int minValidSources = 2;
        @NotNull
        private Duration defaultTimeout = Duration.ofSeconds(5);
        @DecimalMin(value = "0.0", inclusive = false)
        private double defaultWeight = 1.0;
        @Min(1)
        private int workerCount = 5;
        /** Fractional distance from the median beyond which a sample is an outlier (0.05 = 5%). */
        @DecimalMin("0.0")
        private double deviationThreshold = 0.05;
        /** How long shutdown waits for in-flight fetches and cycles before giving up. */
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Source {
        @NotBlank
        private String name;
        /** Unset or non-positive falls back to {@link Feeds#getDefaultWeight()}. */
        private Double weight;
        @NotBlank
        private String endpoint;
        private String pricePath = "/price";
        /** Unset falls back to {@link Feeds#getDefaultTimeout()}. */
        private Duration timeout;
    }

    @Data
    public static class Monitor {
        private boolean enabled = true;
        @NotNull
        private Duration tickInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Schedule {
        @Min(1)
        private int poolSize = 2;
        @NotNull
        private Duration awaitTermination = Duration.ofSeconds(10);
    }

    @Data
    public static class Dispatch {
        @Min(1)
        private int poolSize = 4;
        @Min(1)
        private int queueCapacity = 500;
    }

    @Data
    public static class Executor {
        @NotBlank
        private String baseUrl = "http://localhost:8081";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(2);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
