package io.github.drompincen.postscheduler.protocol.api;

public record CreateScheduleRequest(
        String destinationId,
        String content,
        String when
) {}
