package io.github.drompincen.postscheduler.protocol.api;

public enum ScheduleKind {
    ONCE,
    RECURRING
}
