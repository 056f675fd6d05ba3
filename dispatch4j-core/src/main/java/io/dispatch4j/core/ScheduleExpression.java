package io.dispatch4j.core;

import java.util.List;
import java.util.Objects;

/**
 * A resolved schedule: the Quartz cron expression a template fires on, or "never".
 * <p>
 * {@code cron} may hold several Quartz expressions joined by {@link #ALTERNATIVE_SEPARATOR}; the schedule
 * fires whenever any of them does.
 */
public record ScheduleExpression(IntervalCode intervalCode, String cron) {

    public static final String ALTERNATIVE_SEPARATOR = " | ";

    private static final ScheduleExpression NEVER = new ScheduleExpression(IntervalCode.NONE, null);

    public ScheduleExpression {
        Objects.requireNonNull(intervalCode, "intervalCode must not be null");
        if (intervalCode != IntervalCode.NONE && (cron == null || cron.isBlank())) {
            throw new IllegalArgumentException("cron must not be blank for interval " + intervalCode.label());
        }
    }

    public static ScheduleExpression never() {
        return NEVER;
    }

    public boolean isNever() {
        return intervalCode == IntervalCode.NONE;
    }

    public List<String> alternatives() {
        if (isNever()) {
            return List.of();
        }
        return splitAlternatives(cron);
    }

    public static List<String> splitAlternatives(String cron) {
        return List.of(cron.split("\\s*\\|\\s*"));
    }
}
