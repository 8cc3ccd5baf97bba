package io.github.drompincen.postscheduler.protocol.ws;

public enum WsMessageType {
    // Client -> Server
    SUBSCRIBE,
    UNSUBSCRIBE,

    // Server -> Client
    POST,
    SUBSCRIBED,
    UNSUBSCRIBED,
    ERROR
}
