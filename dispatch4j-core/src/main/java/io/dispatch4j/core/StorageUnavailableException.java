package io.dispatch4j.core;

/**
 * Retryable storage failure: connection dropped, timed out or refused.
 *
 * <p>Store implementations translate their driver's connectivity errors into this type. Anything
 * else they throw is treated as a non-retryable error of the current operation.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
