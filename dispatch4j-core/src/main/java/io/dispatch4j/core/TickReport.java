package io.dispatch4j.core;

/**
 * Counters for one scheduling pass.
 */
public record TickReport(
        int tenants,
        int templates,
        int enqueued,
        int skipped,
        int disabled,
        int failed
) {

    public static TickReport empty() {
        return new TickReport(0, 0, 0, 0, 0, 0);
    }
}
