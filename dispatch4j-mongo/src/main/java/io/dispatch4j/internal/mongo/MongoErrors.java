package io.dispatch4j.internal.mongo;

import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import io.dispatch4j.core.StorageUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.function.Supplier;

/**
 * Classifies Mongo failures: connectivity problems become {@link StorageUnavailableException},
 * everything else is rethrown unchanged.
 */
final class MongoErrors {

    private MongoErrors() {
    }

    static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | MongoSocketException | MongoTimeoutException e) {
            throw new StorageUnavailableException("MongoDB unavailable during " + operation + ": " + e.getMessage(), e);
        }
    }

    static void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
