package io.github.drompincen.postscheduler.runtime.dispatch;

import io.github.drompincen.postscheduler.protocol.api.DeliveryResult;

/**
 * Posts a message body to a destination channel. Implementations report failures through the
 * returned result and may block for the duration of the send.
 */
@FunctionalInterface
public interface MessageDeliverer {

    DeliveryResult deliver(String destinationId, String content);
}
