package io.dispatch4j.daemon;

import io.dispatch4j.SchedulingEngine;
import io.dispatch4j.core.IntervalCode;
import io.dispatch4j.core.StorageUnavailableException;
import io.dispatch4j.core.TickReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Runs one scheduling pass for the interval named by the first non-option argument.
 */
@Component
@ConditionalOnProperty(prefix = "dispatch", name = "one-shot", havingValue = "true")
public class OneShotRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(OneShotRunner.class);

    static final String USAGE = "interval i/y/m/w/d/h missing";

    private final SchedulingEngine engine;
    private final Clock clock;
    private volatile int exitCode = 0;

    public OneShotRunner(SchedulingEngine engine, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void run(ApplicationArguments args) {
        IntervalCode interval = intervalOf(args.getNonOptionArgs());
        if (interval == null) {
            System.err.println(USAGE);
            exitCode = 1;
            return;
        }

        try {
            TickReport report = engine.runOnce(clock.instant(), interval);
            log.info("dispatch one-shot pass done interval={} report={}", interval.label(), report);
            exitCode = 0;
        } catch (StorageUnavailableException e) {
            log.error("dispatch one-shot pass aborted, storage unavailable msg={}", e.getMessage(), e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static IntervalCode intervalOf(List<String> args) {
        if (args.isEmpty()) {
            return null;
        }
        try {
            IntervalCode code = IntervalCode.fromCode(args.get(0));
            return code.isFixed() ? code : null;
        } catch (IllegalArgumentException e) {
            log.debug("dispatch unknown interval argument value={}", args.get(0));
            return null;
        }
    }
}
