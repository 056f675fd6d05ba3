package io.dispatch4j.core;

import java.util.Locale;

/**
 * Schedule cadence of a run template, persisted as a one-letter code.
 */
public enum IntervalCode {

    MINUTE("i", "minute", "⏳"),
    HOUR("h", "hour", "🕰️"),
    DAY("d", "day", "☀️"),
    WEEK("w", "week", "📅"),
    MONTH("m", "month", "🌛"),
    YEAR("y", "year", "🎆"),
    CUSTOM("c", "custom", "🎛️"),
    NONE("n", "none", "🚫");

    private final String code;
    private final String label;
    private final String emoji;

    IntervalCode(String code, String label, String emoji) {
        this.code = code;
        this.label = label;
        this.emoji = emoji;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public String emoji() {
        return emoji;
    }

    /**
     * True for the built-in cadences that map to a canonical expression.
     */
    public boolean isFixed() {
        return this != CUSTOM && this != NONE;
    }

    /**
     * Resolves a stored code letter or a label such as {@code "hour"}, ignoring case.
     *
     * @throws IllegalArgumentException for blank or unknown input
     */
    public static IntervalCode fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("interval code must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (IntervalCode c : values()) {
            if (c.code.equals(v) || c.label.equals(v)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown interval code: " + value);
    }
}
