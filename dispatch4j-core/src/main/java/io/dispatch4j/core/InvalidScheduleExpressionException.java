package io.dispatch4j.core;

/**
 * A schedule expression that cannot be normalized or evaluated.
 */
public class InvalidScheduleExpressionException extends IllegalArgumentException {

    public InvalidScheduleExpressionException(String message) {
        super(message);
    }

    public InvalidScheduleExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
