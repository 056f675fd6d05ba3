package io.dispatch4j;

import io.dispatch4j.core.StatusLevel;

/**
 * Destination for operator-facing status lines. Implementations must not throw.
 */
@FunctionalInterface
public interface StatusSink {

    void emit(StatusLevel level, String message);
}
