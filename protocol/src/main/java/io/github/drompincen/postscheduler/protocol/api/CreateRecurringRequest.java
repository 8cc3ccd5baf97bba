package io.github.drompincen.postscheduler.protocol.api;

/**
 * Either {@code time} (with optional {@code weekday}) or a raw 5-field {@code cronExpr}.
 */
public record CreateRecurringRequest(
        String destinationId,
        String content,
        String time,
        String weekday,
        String cronExpr
) {}
