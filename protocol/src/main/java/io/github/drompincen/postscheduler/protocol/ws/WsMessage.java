package io.github.drompincen.postscheduler.protocol.ws;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String destinationId,
        String content,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String destinationId, String content) {
        return new WsMessage(type, destinationId, content, Instant.now());
    }

    public static WsMessage post(String destinationId, String content) {
        return of(WsMessageType.POST, destinationId, content);
    }

    public static WsMessage error(String destinationId, String reason) {
        return of(WsMessageType.ERROR, destinationId, reason);
    }
}
