package com.fintech.oracle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Price Oracle and Automation Service
 *
 * Aggregates token prices from several HTTP sources into one outlier-filtered, quorum-backed
 * value per symbol, and runs user functions on cron schedules or when a price crosses a
 * threshold.
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class OracleAutomationApplication {

    public static void main(String[] args) {
        SpringApplication.run(OracleAutomationApplication.class, args);
    }
}
