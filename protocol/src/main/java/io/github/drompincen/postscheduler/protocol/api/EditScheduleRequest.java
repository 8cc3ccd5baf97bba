package io.github.drompincen.postscheduler.protocol.api;

public record EditScheduleRequest(
        String content,
        String when
) {}
