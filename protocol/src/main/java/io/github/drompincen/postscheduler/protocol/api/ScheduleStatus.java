package io.github.drompincen.postscheduler.protocol.api;

/**
 * Lifecycle of a schedule record as seen by callers.
 * {@link #MISSED} is never persisted; it is reported for pending once records whose time
 * passed without a live trigger (for example while the process was down).
 */
public enum ScheduleStatus {
    PENDING,
    ACTIVE,
    DELIVERED,
    SUPPRESSED,
    FAILED,
    MISSED
}
