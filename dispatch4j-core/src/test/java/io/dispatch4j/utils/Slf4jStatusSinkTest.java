package io.dispatch4j.utils;

import io.dispatch4j.core.StatusLevel;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class Slf4jStatusSinkTest {

    @Test
    void emitShouldLogAtMatchingLevel() {
        Logger logger = mock(Logger.class);
        Slf4jStatusSink sink = new Slf4jStatusSink(logger);

        sink.emit(StatusLevel.INFO, "launched");
        sink.emit(StatusLevel.WARN, "disabled");
        sink.emit(StatusLevel.DEBUG, "nothing to run");

        verify(logger).info("launched");
        verify(logger).warn("disabled");
        verify(logger).debug("nothing to run");
    }
}
