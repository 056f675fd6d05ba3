package io.dispatch4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One due occurrence of a schedule.
 *
 * @param windowStart  canonical instant identifying the occurrence, independent of delay
 * @param fireInstant  {@code windowStart + delaySeconds}, the time the job is scheduled for
 */
public record Occurrence(Instant windowStart, Instant fireInstant) {

    public Occurrence {
        Objects.requireNonNull(windowStart, "windowStart must not be null");
        Objects.requireNonNull(fireInstant, "fireInstant must not be null");
    }

    public static Occurrence of(Instant windowStart, long delaySeconds) {
        if (delaySeconds < 0) {
            throw new IllegalArgumentException("delaySeconds must not be negative: " + delaySeconds);
        }
        return new Occurrence(windowStart, windowStart.plusSeconds(delaySeconds));
    }
}
