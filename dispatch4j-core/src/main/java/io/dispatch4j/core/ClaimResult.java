package io.dispatch4j.core;

/**
 * Result of moving a template's {@code lastSchedule} marker onto a new window.
 */
public enum ClaimResult {
    /** The marker now points at the window. */
    CLAIMED,
    /** The stored marker changed since it was read; another instance scheduled the template meanwhile. */
    LOST,
    /** The write failed; the pending-job check is the only guard left. */
    UNKNOWN
}
