package io.dispatch4j.utils;

import io.dispatch4j.StatusSink;
import io.dispatch4j.core.StatusLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes status lines to the {@code io.dispatch4j.status} logger.
 */
public class Slf4jStatusSink implements StatusSink {

    public static final String LOGGER_NAME = "io.dispatch4j.status";

    private final Logger log;

    public Slf4jStatusSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    public Slf4jStatusSink(Logger log) {
        this.log = log;
    }

    @Override
    public void emit(StatusLevel level, String message) {
        switch (level) {
            case DEBUG -> log.debug(message);
            case INFO -> log.info(message);
            case WARN -> log.warn(message);
            case ERROR -> log.error(message);
        }
    }
}
