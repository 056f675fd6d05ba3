package io.dispatch4j.core;

/**
 * A custom interval without an expression. Callers disable the template instead of retrying.
 */
public class EmptyCustomScheduleException extends IllegalArgumentException {

    public EmptyCustomScheduleException(String message) {
        super(message);
    }
}
