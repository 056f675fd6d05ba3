package io.dispatch4j.utils;

import io.dispatch4j.core.InvalidScheduleExpressionException;
import io.dispatch4j.core.Occurrence;
import io.dispatch4j.core.ScheduleExpression;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Computes due windows of resolved schedules.
 * <p>
 * A window start is the schedule occurrence that identifies one due period: evaluated at 10:00:07,
 * an hourly schedule is in the window starting 10:00:00. It is found by looking for the next
 * occurrence from one minute before the reference instant, the reference minute included. Once
 * that minute has passed, the window moves forward to the upcoming occurrence.
 * <p>
 * Stateless: a fresh Quartz expression is built per call, so identical inputs give identical results.
 */
public final class WindowCalculator {

    private static final Duration LOOK_BACK = Duration.ofMinutes(1);

    private final ZoneId zone;

    public WindowCalculator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Next occurrence at or after {@code reference} (at-or-after only when {@code allowCurrentInstant}).
     *
     * @param delaySeconds non-negative offset added to the window start to obtain the fire instant
     * @throws InvalidScheduleExpressionException if the expression does not parse or never fires again
     */
    public Occurrence nextOccurrence(ScheduleExpression expr, Instant reference, boolean allowCurrentInstant, long delaySeconds) {
        Objects.requireNonNull(reference, "reference must not be null");
        List<CronExpression> crons = compile(expr);

        Instant truncated = reference.truncatedTo(ChronoUnit.SECONDS);
        if (allowCurrentInstant && isSatisfiedBy(crons, truncated)) {
            return Occurrence.of(truncated, delaySeconds);
        }

        Date earliest = null;
        for (CronExpression cron : crons) {
            Date next = cron.getNextValidTimeAfter(Date.from(reference));
            if (next != null && (earliest == null || next.before(earliest))) {
                earliest = next;
            }
        }
        if (earliest == null) {
            throw new InvalidScheduleExpressionException("Cron expression produced no next execution time: " + expr.cron());
        }
        return Occurrence.of(earliest.toInstant(), delaySeconds);
    }

    /**
     * The window that {@code now} belongs to, or the upcoming one if the last occurrence is more than a
     * minute old.
     */
    public Occurrence currentWindow(ScheduleExpression expr, Instant now, long delaySeconds) {
        Objects.requireNonNull(now, "now must not be null");
        return nextOccurrence(expr, now.minus(LOOK_BACK), true, delaySeconds);
    }

    /**
     * True if {@code instant}, truncated to the second, is an occurrence of the schedule.
     */
    public boolean isDue(ScheduleExpression expr, Instant instant) {
        Objects.requireNonNull(instant, "instant must not be null");
        return isSatisfiedBy(compile(expr), instant.truncatedTo(ChronoUnit.SECONDS));
    }

    private static boolean isSatisfiedBy(List<CronExpression> crons, Instant instant) {
        Date date = Date.from(instant);
        for (CronExpression cron : crons) {
            if (cron.isSatisfiedBy(date)) {
                return true;
            }
        }
        return false;
    }

    private List<CronExpression> compile(ScheduleExpression expr) {
        Objects.requireNonNull(expr, "expr must not be null");
        if (expr.isNever()) {
            throw new IllegalArgumentException("Schedule 'none' has no occurrences");
        }
        List<CronExpression> crons = new ArrayList<>();
        for (String alternative : expr.alternatives()) {
            try {
                CronExpression cron = new CronExpression(alternative);
                cron.setTimeZone(TimeZone.getTimeZone(zone));
                crons.add(cron);
            } catch (ParseException e) {
                throw new InvalidScheduleExpressionException("Invalid cron expression: " + expr.cron(), e);
            }
        }
        return crons;
    }
}
