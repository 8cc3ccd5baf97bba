package io.github.drompincen.postscheduler.runtime.dispatch;

/**
 * What a fired trigger should post, carried by value from registration to delivery.
 */
public record DispatchCommand(String destinationId, String content) {}
