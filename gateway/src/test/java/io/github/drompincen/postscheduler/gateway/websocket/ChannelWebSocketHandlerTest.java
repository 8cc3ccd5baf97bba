package io.github.drompincen.postscheduler.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.postscheduler.protocol.api.DeliveryResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChannelWebSocketHandlerTest {

    @Mock private WebSocketSession alice;
    @Mock private WebSocketSession bob;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private ChannelWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new ChannelWebSocketHandler(mapper);
        when(alice.isOpen()).thenReturn(true);
        when(bob.isOpen()).thenReturn(true);
        when(alice.getId()).thenReturn("alice");
        when(bob.getId()).thenReturn("bob");
    }

    private void subscribe(WebSocketSession session, String destinationId) throws Exception {
        handler.handleTextMessage(session,
                new TextMessage("{\"type\":\"SUBSCRIBE\",\"destinationId\":\"" + destinationId + "\"}"));
    }

    private JsonNode lastFrame(WebSocketSession session) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return mapper.readTree(captor.getValue().getPayload());
    }

    @Test
    void subscribeIsAcknowledged() throws Exception {
        subscribe(alice, "chan-1");

        JsonNode ack = lastFrame(alice);
        assertThat(ack.path("type").asText()).isEqualTo("SUBSCRIBED");
        assertThat(ack.path("destinationId").asText()).isEqualTo("chan-1");
        assertThat(handler.subscriberCount("chan-1")).isEqualTo(1);
    }

    @Test
    void publishReachesOnlySubscribersOfThatDestination() throws Exception {
        subscribe(alice, "chan-1");
        subscribe(bob, "chan-2");
        clearInvocations(alice, bob);

        DeliveryResult result = handler.publish("chan-1", "good morning");

        assertThat(result).isEqualTo(DeliveryResult.OK);
        JsonNode post = lastFrame(alice);
        assertThat(post.path("type").asText()).isEqualTo("POST");
        assertThat(post.path("content").asText()).isEqualTo("good morning");
        verify(bob, never()).sendMessage(any());
    }

    @Test
    void publishWithoutSubscribersIsUnknownDestination() {
        assertThat(handler.publish("nobody", "hi")).isEqualTo(DeliveryResult.UNKNOWN_DESTINATION);
    }

    @Test
    void failedSendsAreTransient() throws Exception {
        subscribe(alice, "chan-1");
        doThrow(new IOException("broken pipe")).when(alice).sendMessage(any());

        assertThat(handler.publish("chan-1", "hi")).isEqualTo(DeliveryResult.TRANSIENT_ERROR);
    }

    @Test
    void oneWorkingSubscriberIsEnough() throws Exception {
        subscribe(alice, "chan-1");
        subscribe(bob, "chan-1");
        doThrow(new IOException("broken pipe")).when(alice).sendMessage(any());

        assertThat(handler.publish("chan-1", "hi")).isEqualTo(DeliveryResult.OK);
    }

    @Test
    void unsubscribeAndCloseDropSubscriptions() throws Exception {
        subscribe(alice, "chan-1");
        subscribe(bob, "chan-1");

        handler.handleTextMessage(alice, new TextMessage("{\"type\":\"UNSUBSCRIBE\",\"destinationId\":\"chan-1\"}"));
        assertThat(lastFrame(alice).path("type").asText()).isEqualTo("UNSUBSCRIBED");
        handler.afterConnectionClosed(bob, CloseStatus.NORMAL);

        assertThat(handler.subscriberCount("chan-1")).isZero();
        assertThat(handler.publish("chan-1", "hi")).isEqualTo(DeliveryResult.UNKNOWN_DESTINATION);
    }

    @Test
    void missingDestinationIsAnError() throws Exception {
        handler.handleTextMessage(alice, new TextMessage("{\"type\":\"SUBSCRIBE\"}"));

        assertThat(lastFrame(alice).path("type").asText()).isEqualTo("ERROR");
        assertThat(handler.subscriberCount("")).isZero();
    }
}
