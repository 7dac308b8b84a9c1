package com.fintech.oracle.trigger;

import org.springframework.scheduling.support.CronExpression;

/**
 * Validates and normalises cron expressions.
 *
 * Accepts the standard five-field form (minute hour day month weekday), the six-field form
 * with a leading seconds field, and the {@code @hourly}-style macros. Five-field expressions
 * are normalised to six fields by firing at second zero.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    /**
     * @return the six-field (or macro) expression to hand to the scheduler
     * @throws IllegalArgumentException if the expression does not parse
     */
    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Schedule cannot be empty for schedule trigger");
        }
        String trimmed = expression.trim();
        String normalized = trimmed;
        if (!trimmed.startsWith("@") && trimmed.split("\\s+").length == 5) {
            normalized = "0 " + trimmed;
        }
        CronExpression.parse(normalized);
        return normalized;
    }
}
