package io.github.drompincen.postscheduler.protocol.api;

public enum DeliveryResult {
    OK,
    PERMISSION_DENIED,
    TRANSIENT_ERROR,
    UNKNOWN_DESTINATION
}
