package io.github.drompincen.postscheduler.runtime.dispatch;

import io.github.drompincen.postscheduler.protocol.api.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Performs the actual delivery of fired triggers and enforces the per-destination minimum
 * interval for {@link DispatchPolicy#PACED} sends. Suppressed and failed sends are dropped.
 */
@Service
public class DispatchGate {

    private static final Logger log = LoggerFactory.getLogger(DispatchGate.class);

    private final MessageDeliverer deliverer;
    private final Clock clock;
    private final Duration minInterval;
    private final Map<String, Instant> lastSentByDestination = new ConcurrentHashMap<>();

    public DispatchGate(MessageDeliverer deliverer, Clock clock,
                        @Value("${postscheduler.dispatch.min-interval:5s}") Duration minInterval) {
        this.deliverer = deliverer;
        this.clock = clock;
        this.minInterval = minInterval;
    }

    /**
     * A {@link DispatchPolicy#PACED} send reserves its destination's slot before delivering, so
     * concurrent paced sends to one destination cannot both go out. The reservation is given back
     * if the send does not succeed.
     */
    public DispatchOutcome dispatch(DispatchCommand command, DispatchPolicy policy) {
        String destinationId = command.destinationId();
        Instant now = clock.instant();

        AtomicReference<Instant> displaced = new AtomicReference<>();
        if (policy == DispatchPolicy.PACED) {
            AtomicBoolean reserved = new AtomicBoolean();
            Instant current = lastSentByDestination.compute(destinationId, (k, last) -> {
                if (last != null && Duration.between(last, now).compareTo(minInterval) < 0) return last;
                displaced.set(last);
                reserved.set(true);
                return now;
            });
            if (!reserved.get()) {
                log.info("Suppressed post to destination {}: last post was {} ago", destinationId,
                        Duration.between(current, now));
                return DispatchOutcome.SUPPRESSED;
            }
        }

        DeliveryResult result;
        try {
            result = deliverer.deliver(destinationId, command.content());
        } catch (RuntimeException e) {
            log.error("Delivery to destination {} failed", destinationId, e);
            release(policy, destinationId, now, displaced.get());
            return DispatchOutcome.FAILED;
        }
        if (result == null) result = DeliveryResult.TRANSIENT_ERROR;
        if (result != DeliveryResult.OK) release(policy, destinationId, now, displaced.get());

        return switch (result) {
            case OK -> {
                lastSentByDestination.merge(destinationId, now, (a, b) -> a.isAfter(b) ? a : b);
                log.debug("Posted to destination {}", destinationId);
                yield DispatchOutcome.DELIVERED;
            }
            case PERMISSION_DENIED -> {
                log.warn("Missing permission to post to destination {}", destinationId);
                yield DispatchOutcome.PERMISSION_DENIED;
            }
            case UNKNOWN_DESTINATION -> {
                log.warn("Destination {} is not reachable, post dropped", destinationId);
                yield DispatchOutcome.FAILED;
            }
            case TRANSIENT_ERROR -> {
                log.error("Transient error posting to destination {}, post dropped", destinationId);
                yield DispatchOutcome.FAILED;
            }
        };
    }

    private void release(DispatchPolicy policy, String destinationId, Instant reservedAt, Instant displaced) {
        if (policy != DispatchPolicy.PACED) return;
        lastSentByDestination.computeIfPresent(destinationId, (k, v) -> v.equals(reservedAt) ? displaced : v);
    }

    public Optional<Instant> lastSentAt(String destinationId) {
        return Optional.ofNullable(lastSentByDestination.get(destinationId));
    }

    public Duration getMinInterval() {
        return minInterval;
    }
}
