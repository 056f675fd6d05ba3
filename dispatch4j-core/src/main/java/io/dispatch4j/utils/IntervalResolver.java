package io.dispatch4j.utils;

import io.dispatch4j.core.EmptyCustomScheduleException;
import io.dispatch4j.core.IntervalCode;
import io.dispatch4j.core.InvalidScheduleExpressionException;
import io.dispatch4j.core.ScheduleExpression;
import org.quartz.CronExpression;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Maps interval codes to Quartz cron expressions.
 * <p>
 * Supported custom formats:
 * <ul>
 *   <li>Standard 5-field cron: {@code "min hour dom month dow"}, day-of-week 0-7 with 0 and 7 = Sunday</li>
 *   <li>6-field cron with a leading seconds field</li>
 *   <li>Macros: {@code @yearly}, {@code @annually}, {@code @monthly}, {@code @weekly}, {@code @daily},
 *       {@code @midnight}, {@code @hourly}</li>
 * </ul>
 * <p>
 * Quartz cannot restrict day-of-month and day-of-week in one expression. Cron fires when either field
 * matches, so such a spec becomes two Quartz expressions joined by
 * {@link ScheduleExpression#ALTERNATIVE_SEPARATOR}: one per restricted day field.
 */
public final class IntervalResolver {

    private static final Map<IntervalCode, String> CANONICAL;
    private static final Map<String, String> MACROS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *"
    );

    static {
        Map<IntervalCode, String> m = new EnumMap<>(IntervalCode.class);
        m.put(IntervalCode.MINUTE, "0 * * * * ?");
        m.put(IntervalCode.HOUR, "0 0 * * * ?");
        m.put(IntervalCode.DAY, "0 0 0 * * ?");
        m.put(IntervalCode.WEEK, "0 0 0 ? * SUN");
        m.put(IntervalCode.MONTH, "0 0 0 1 * ?");
        m.put(IntervalCode.YEAR, "0 0 0 1 1 ?");
        CANONICAL = Map.copyOf(m);
    }

    private final Map<IntervalCode, String> table;

    public IntervalResolver() {
        this(CANONICAL);
    }

    /**
     * @param table expression per fixed interval code; copied, must cover every fixed code
     */
    public IntervalResolver(Map<IntervalCode, String> table) {
        Objects.requireNonNull(table, "table must not be null");
        for (IntervalCode code : IntervalCode.values()) {
            String cron = table.get(code);
            if (code.isFixed() && (cron == null || !CronExpression.isValidExpression(cron))) {
                throw new IllegalArgumentException("Missing or invalid expression for interval " + code.label());
            }
        }
        this.table = Map.copyOf(table);
    }

    /**
     * Resolves the schedule of a template.
     *
     * @return the expression, or {@link ScheduleExpression#never()} for {@link IntervalCode#NONE}
     * @throws EmptyCustomScheduleException       custom interval with a blank expression
     * @throws InvalidScheduleExpressionException custom expression that does not parse
     */
    public ScheduleExpression resolve(IntervalCode code, String customExpression) {
        Objects.requireNonNull(code, "code must not be null");

        return switch (code) {
            case NONE -> ScheduleExpression.never();
            case CUSTOM -> {
                if (customExpression == null || customExpression.isBlank()) {
                    throw new EmptyCustomScheduleException("Custom interval without a schedule expression");
                }
                yield new ScheduleExpression(IntervalCode.CUSTOM, normalizeCron(customExpression));
            }
            default -> new ScheduleExpression(code, table.get(code));
        };
    }

    /**
     * Canonical expression for a fixed interval.
     */
    public String canonicalExpression(IntervalCode code) {
        String cron = table.get(code);
        if (cron == null) {
            throw new IllegalArgumentException("No canonical expression for interval " + code.label());
        }
        return cron;
    }

    /**
     * Normalize a cron spec into Quartz syntax:
     * - Expands macros.
     * - Accepts 5-field cron by prepending seconds "0".
     * - Accepts 6-field cron with seconds.
     * - Puts "?" into whichever day field is unrestricted and shifts numeric day-of-week to Quartz numbering.
     * - Splits a spec restricting both day fields into a day-of-month and a day-of-week alternative.
     *
     * @throws InvalidScheduleExpressionException if the result is not a valid Quartz expression
     */
    public static String normalizeCron(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new InvalidScheduleExpressionException("spec must not be empty");
        }
        String s = spec.trim().toLowerCase(Locale.ROOT);

        if (s.startsWith("@")) {
            String expanded = MACROS.get(s);
            if (expanded == null) {
                throw new InvalidScheduleExpressionException("Unknown cron macro: " + spec);
            }
            s = expanded;
        }

        String[] parts = s.split("\\s+");
        String quartz;
        if (parts.length == 5) {
            quartz = toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        } else if (parts.length == 6) {
            quartz = toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        } else {
            throw new InvalidScheduleExpressionException(
                    "Expected 5 or 6 cron fields but got " + parts.length + ": " + spec);
        }

        quartz = quartz.toUpperCase(Locale.ROOT);
        for (String alternative : ScheduleExpression.splitAlternatives(quartz)) {
            if (!CronExpression.isValidExpression(alternative)) {
                throw new InvalidScheduleExpressionException("Invalid cron expression: " + spec);
            }
        }
        return quartz;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        boolean anyDom = isUnrestricted(dayOfMonth);
        boolean anyDow = isUnrestricted(dayOfWeek);

        if (anyDow) {
            return String.join(" ", sec, min, hour, anyDom ? "*" : dayOfMonth, month, "?");
        }
        String byDayOfWeek = String.join(" ", sec, min, hour, "?", month, toQuartzDayOfWeek(dayOfWeek));
        if (anyDom) {
            return byDayOfWeek;
        }
        String byDayOfMonth = String.join(" ", sec, min, hour, dayOfMonth, month, "?");
        return byDayOfMonth + ScheduleExpression.ALTERNATIVE_SEPARATOR + byDayOfWeek;
    }

    private static boolean isUnrestricted(String field) {
        return "*".equals(field) || "?".equals(field);
    }

    // cron counts Sunday as 0 (or 7), Quartz as 1
    private static String toQuartzDayOfWeek(String field) {
        List<String> out = new ArrayList<>();
        for (String item : field.split(",")) {
            String base = item;
            String step = null;
            int slash = item.indexOf('/');
            if (slash >= 0) {
                base = item.substring(0, slash);
                step = item.substring(slash + 1);
            }

            String converted;
            int dash = base.indexOf('-');
            if (dash > 0) {
                String from = base.substring(0, dash);
                String to = base.substring(dash + 1);
                if ("0".equals(from) && "7".equals(to)) {
                    converted = "1-7";
                } else if (isNumber(from) && "7".equals(to)) {
                    // e.g. 5-7 = FRI..SUN, which Quartz cannot express as one ascending range
                    converted = shiftDay(from) + "-7,1";
                } else {
                    converted = shiftDay(from) + "-" + shiftDay(to);
                }
            } else {
                converted = shiftDay(base);
            }

            out.add(step == null ? converted : converted + "/" + step);
        }
        return String.join(",", out);
    }

    private static String shiftDay(String token) {
        // nth weekday (1#2) and last weekday (5L) carry a numeric day before the suffix
        int suffix = indexOfAny(token, '#', 'L', 'l');
        if (suffix > 0) {
            return shiftDay(token.substring(0, suffix)) + token.substring(suffix);
        }
        if (!isNumber(token)) {
            return token;
        }
        int day = Integer.parseInt(token);
        if (day > 7) {
            throw new InvalidScheduleExpressionException("Day-of-week out of range: " + token);
        }
        return Integer.toString(day % 7 + 1);
    }

    private static int indexOfAny(String s, char... chars) {
        for (int i = 0; i < s.length(); i++) {
            for (char c : chars) {
                if (s.charAt(i) == c) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean isNumber(String s) {
        return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
    }
}
