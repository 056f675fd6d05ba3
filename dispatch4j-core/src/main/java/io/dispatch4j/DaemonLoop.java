package io.dispatch4j;

import io.dispatch4j.core.DaemonSettings;
import io.dispatch4j.core.DaemonState;
import io.dispatch4j.core.StorageUnavailableException;
import io.dispatch4j.core.TickReport;
import io.dispatch4j.store.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives {@link SchedulingEngine} on a fixed cadence.
 *
 * <p>States: {@code STARTING -> RUNNING -> (RECONNECTING_DB <-> RUNNING) -> STOPPING -> STOPPED}.
 * <ul>
 *   <li>Starting waits for storage (bounded, fatal when exceeded) and runs {@link StartupRecovery}.</li>
 *   <li>A {@link StorageUnavailableException} during a tick switches to reconnecting, which retries a health
 *       check with linear, capped backoff until it succeeds or the loop is stopped.</li>
 *   <li>Any other tick failure is logged and the next tick runs as usual.</li>
 * </ul>
 *
 * <p>A stop request is honored between ticks; the pass in progress always completes.
 */
public class DaemonLoop {
    private static final Logger log = LoggerFactory.getLogger(DaemonLoop.class);

    private final SchedulingEngine engine;
    private final StartupRecovery recovery;
    private final JobRepository health;
    private final DaemonSettings settings;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile DaemonState state = DaemonState.NEW;
    private volatile Thread loopThread;

    public DaemonLoop(SchedulingEngine engine,
                      StartupRecovery recovery,
                      JobRepository health,
                      DaemonSettings settings,
                      Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.recovery = Objects.requireNonNull(recovery, "recovery must not be null");
        this.health = Objects.requireNonNull(health, "health must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public DaemonState state() {
        return state;
    }

    /**
     * Waits for storage, recovers, then either starts the loop thread or, when not daemonized, runs a
     * single pass. Returns once the loop is running (or the single pass is done).
     *
     * @throws StorageUnavailableException if storage was never reachable within the configured attempts
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        state = DaemonState.STARTING;
        log.info("dispatch daemon starting tickEvery={} startupMaxAttempts={} reconnectBaseDelay={} reconnectMaxDelay={} daemonize={}",
                settings.tickEvery(),
                settings.startupMaxAttempts(),
                settings.reconnectBaseDelay(),
                settings.reconnectMaxDelay(),
                settings.daemonize());

        try {
            awaitStorage();
        } catch (RuntimeException e) {
            state = DaemonState.STOPPED;
            log.error("dispatch daemon could not reach storage msg={}", e.getMessage(), e);
            logTerminationBanner();
            throw e;
        }

        try {
            recovery.recover(now(), settings.orphanGracePeriod(), settings.preseedNextSchedule());
        } catch (StorageUnavailableException e) {
            log.warn("dispatch startup recovery interrupted by storage outage msg={}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("dispatch startup recovery failed msg={}", e.getMessage(), e);
        }

        state = DaemonState.RUNNING;
        log.info("==== dispatch daemon started ====");
        if (!settings.daemonize()) {
            tick();
            state = DaemonState.STOPPED;
            logTerminationBanner();
            return;
        }

        Thread t = new Thread(this::runLoop);
        t.setName("dispatch.daemon");
        loopThread = t;
        t.start();
        log.debug("dispatch daemon loop thread started name={}", t.getName());
    }

    /**
     * Requests a stop and waits up to {@code timeout} for the current pass to finish.
     */
    public void stop(Duration timeout) {
        if (!started.get() || stopSignal.getCount() == 0) {
            return;
        }
        log.info("dispatch daemon stopping...");
        if (state != DaemonState.STOPPED) {
            state = DaemonState.STOPPING;
        }
        stopSignal.countDown();

        Thread t = loopThread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("dispatch daemon did not stop within {}", timeout);
            }
        }
    }

    public void stop() {
        stop(Duration.ofSeconds(30));
    }

    private void runLoop() {
        try {
            while (!stopRequested()) {
                tick();
                if (!pause(settings.tickEvery())) {
                    break;
                }
            }
        } finally {
            state = DaemonState.STOPPED;
            logTerminationBanner();
        }
    }

    /**
     * One tick: a full scheduling pass, followed by reconnection if storage went away during it.
     */
    TickReport tick() {
        try {
            return engine.runOnce(now());
        } catch (StorageUnavailableException e) {
            log.warn("dispatch storage unavailable during tick msg={}", e.getMessage());
            reconnect();
        } catch (RuntimeException e) {
            log.error("dispatch tick failed msg={}", e.getMessage(), e);
        }
        return TickReport.empty();
    }

    void awaitStorage() {
        int max = settings.startupMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                health.ping();
                if (attempt > 1) {
                    log.info("dispatch storage reachable after attempts={}", attempt);
                }
                return;
            } catch (RuntimeException e) {
                if (attempt >= max) {
                    throw new StorageUnavailableException(
                            "Database unavailable after " + attempt + " attempts: " + e.getMessage(), e);
                }
                Duration wait = settings.backoff(attempt);
                log.warn("dispatch storage unavailable attempt={} of {} retryIn={} msg={}",
                        attempt, max, wait, e.getMessage());
                if (!pause(wait)) {
                    throw new StorageUnavailableException("Stopped while waiting for storage", e);
                }
            }
        }
    }

    void reconnect() {
        state = DaemonState.RECONNECTING_DB;
        for (int attempt = 1; !stopRequested(); attempt++) {
            Duration wait = settings.backoff(attempt);
            if (!pause(wait)) {
                return;
            }
            try {
                health.ping();
                state = DaemonState.RUNNING;
                log.info("dispatch storage connection recovered attempts={}", attempt);
                return;
            } catch (RuntimeException e) {
                log.warn("dispatch reconnect failed attempt={} nextRetryIn={} msg={}",
                        attempt, settings.backoff(attempt + 1), e.getMessage());
            }
        }
    }

    /**
     * Waits for {@code duration} or until a stop is requested.
     *
     * @return false if a stop was requested
     */
    protected boolean pause(Duration duration) {
        try {
            return !stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    protected Instant now() {
        return clock.instant();
    }

    private boolean stopRequested() {
        return stopSignal.getCount() == 0;
    }

    private void logTerminationBanner() {
        log.info("==== dispatch daemon ended ====");
    }
}
