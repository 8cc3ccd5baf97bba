package io.github.drompincen.postscheduler.protocol.api;

import java.time.Instant;

public record ScheduleDto(
        String id,
        String destinationId,
        String content,
        ScheduleKind kind,
        String fireAt,
        String cronExpr,
        ScheduleStatus status,
        Instant nextFireAt,
        Instant lastFiredAt,
        Instant createdAt,
        Instant updatedAt
) {}
