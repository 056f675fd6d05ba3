package io.dispatch4j.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime settings of the daemon loop.
 *
 * @param tickEvery            pause between two scheduling passes
 * @param startupMaxAttempts   health checks tried before the first successful connection is declared impossible
 * @param reconnectBaseDelay   backoff base; the n-th reconnect attempt waits {@code base * n}
 * @param reconnectMaxDelay    backoff ceiling
 * @param orphanGracePeriod    age after which an orphaned pending job is removed at startup
 * @param preseedNextSchedule  write {@code nextSchedule} for every active template at startup
 * @param daemonize            keep ticking; when false a single pass runs after startup recovery
 */
public record DaemonSettings(
        Duration tickEvery,
        int startupMaxAttempts,
        Duration reconnectBaseDelay,
        Duration reconnectMaxDelay,
        Duration orphanGracePeriod,
        boolean preseedNextSchedule,
        boolean daemonize
) {

    public DaemonSettings {
        requirePositive(tickEvery, "tickEvery");
        requirePositive(reconnectBaseDelay, "reconnectBaseDelay");
        requirePositive(reconnectMaxDelay, "reconnectMaxDelay");
        Objects.requireNonNull(orphanGracePeriod, "orphanGracePeriod must not be null");
        if (orphanGracePeriod.isNegative()) {
            throw new IllegalArgumentException("orphanGracePeriod must not be negative");
        }
        if (startupMaxAttempts < 1) {
            throw new IllegalArgumentException("startupMaxAttempts must be at least 1");
        }
    }

    public static DaemonSettings defaults() {
        return new DaemonSettings(
                Duration.ofSeconds(1),
                6,
                Duration.ofSeconds(10),
                Duration.ofSeconds(60),
                Duration.ofHours(1),
                false,
                true
        );
    }

    /**
     * Delay before reconnect attempt {@code attempt} (1-based): linear in the attempt count, capped.
     */
    public Duration backoff(int attempt) {
        long n = Math.max(1, attempt);
        Duration d = reconnectBaseDelay.multipliedBy(n);
        return d.compareTo(reconnectMaxDelay) > 0 ? reconnectMaxDelay : d;
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
