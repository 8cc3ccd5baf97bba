package io.github.drompincen.postscheduler.runtime.trigger;

import org.springframework.scheduling.support.CronExpression;

import java.util.Locale;

/**
 * Five-field crontab expressions (minute hour day-of-month month day-of-week), evaluated by
 * Spring's six-field {@link CronExpression} with the seconds field pinned to zero.
 */
public final class Crontab {

    private Crontab() {}

    public static String normalize(String expr) {
        if (expr == null || expr.isBlank()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String[] fields = expr.trim().split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException(
                    "Cron expression must have 5 fields but has " + fields.length + ": " + expr);
        }
        return String.join(" ", fields);
    }

    public static String toSpring(String expr) {
        return "0 " + normalize(expr).toUpperCase(Locale.ROOT);
    }

    public static CronExpression parse(String expr) {
        return CronExpression.parse(toSpring(expr));
    }
}
