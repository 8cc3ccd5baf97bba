package io.github.drompincen.postscheduler.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.postscheduler.protocol.api.DeliveryResult;
import io.github.drompincen.postscheduler.protocol.ws.WsMessage;
import io.github.drompincen.postscheduler.protocol.ws.WsMessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Destination channels over WebSocket. Clients subscribe to a destination id and receive every
 * post delivered to it as a {@code POST} frame.
 */
@Component
public class ChannelWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChannelWebSocketHandler.class);

    private final ObjectMapper objectMapper;
    private final Map<String, Set<WebSocketSession>> subscriptions = new ConcurrentHashMap<>();

    public ChannelWebSocketHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        subscriptions.values().forEach(set -> set.remove(session));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        var node = objectMapper.readTree(message.getPayload());
        String type = node.path("type").asText();
        String destinationId = node.path("destinationId").asText();

        if (destinationId.isBlank()) {
            send(session, WsMessage.error(null, "destinationId is required"));
        } else if (WsMessageType.SUBSCRIBE.name().equals(type)) {
            subscriptions.computeIfAbsent(destinationId, k -> new CopyOnWriteArraySet<>()).add(session);
            send(session, WsMessage.of(WsMessageType.SUBSCRIBED, destinationId, null));
        } else if (WsMessageType.UNSUBSCRIBE.name().equals(type)) {
            var set = subscriptions.get(destinationId);
            if (set != null) set.remove(session);
            send(session, WsMessage.of(WsMessageType.UNSUBSCRIBED, destinationId, null));
        } else {
            send(session, WsMessage.error(destinationId, "Unsupported message type: " + type));
        }
    }

    /**
     * Pushes a post to every open subscriber of the destination.
     *
     * @return {@code OK} if at least one subscriber received it
     */
    public DeliveryResult publish(String destinationId, String content) {
        var subscribers = subscriptions.get(destinationId);
        if (subscribers == null || subscribers.isEmpty()) {
            return DeliveryResult.UNKNOWN_DESTINATION;
        }
        TextMessage frame;
        try {
            frame = new TextMessage(objectMapper.writeValueAsString(WsMessage.post(destinationId, content)));
        } catch (IOException e) {
            log.error("Could not encode post for destination {}", destinationId, e);
            return DeliveryResult.TRANSIENT_ERROR;
        }

        int sent = 0;
        for (var ws : subscribers) {
            if (!ws.isOpen()) continue;
            try {
                synchronized (ws) {
                    ws.sendMessage(frame);
                }
                sent++;
            } catch (IOException e) {
                log.warn("Post to session {} on destination {} failed: {}", ws.getId(), destinationId, e.getMessage());
            }
        }
        return sent > 0 ? DeliveryResult.OK : DeliveryResult.TRANSIENT_ERROR;
    }

    public int subscriberCount(String destinationId) {
        var subscribers = subscriptions.get(destinationId);
        return subscribers == null ? 0 : subscribers.size();
    }

    private void send(WebSocketSession session, WsMessage message) throws IOException {
        synchronized (session) {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        }
    }
}
