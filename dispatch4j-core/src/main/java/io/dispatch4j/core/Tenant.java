package io.dispatch4j.core;

import java.util.Objects;

/**
 * Customer scope ("company") owning run templates. Read-only for the scheduler.
 */
public record Tenant(String id, String name) {

    public Tenant {
        Objects.requireNonNull(id, "tenant id must not be null");
        if (name == null || name.isBlank()) {
            name = id;
        }
    }
}
