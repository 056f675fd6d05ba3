package io.dispatch4j.core;

/**
 * Per-template outcome of a ledger decision.
 */
public record ScheduleDecision(Outcome outcome, Occurrence occurrence, String reason) {

    public enum Outcome {
        SKIP,
        ENQUEUE,
        DISABLE
    }

    public static ScheduleDecision skip(String reason) {
        return new ScheduleDecision(Outcome.SKIP, null, reason);
    }

    public static ScheduleDecision enqueue(Occurrence occurrence) {
        return new ScheduleDecision(Outcome.ENQUEUE, occurrence, null);
    }

    public static ScheduleDecision disable(String reason) {
        return new ScheduleDecision(Outcome.DISABLE, null, reason);
    }

    public boolean enqueues() {
        return outcome == Outcome.ENQUEUE;
    }
}
