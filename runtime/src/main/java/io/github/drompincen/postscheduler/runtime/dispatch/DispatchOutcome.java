package io.github.drompincen.postscheduler.runtime.dispatch;

public enum DispatchOutcome {
    DELIVERED,
    SUPPRESSED,
    PERMISSION_DENIED,
    FAILED
}
