package io.github.drompincen.postscheduler.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.postscheduler.gateway.websocket.ChannelWebSocketHandler;
import io.github.drompincen.postscheduler.runtime.dispatch.MessageDeliverer;
import io.github.drompincen.postscheduler.runtime.dispatch.WebhookMessageDeliverer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class DeliveryConfig {

    private static final Logger log = LoggerFactory.getLogger(DeliveryConfig.class);

    @Bean
    MessageDeliverer messageDeliverer(DeliveryProperties properties, ChannelWebSocketHandler channelHub,
                                      ObjectMapper objectMapper) {
        if (properties.getMode() == DeliveryProperties.Mode.WEBHOOK) {
            log.info("Delivering posts to {} configured webhooks", properties.getWebhooks().size());
            HttpClient client = HttpClient.newBuilder()
                    .connectTimeout(Duration.ofSeconds(10))
                    .build();
            return new WebhookMessageDeliverer(client, objectMapper, properties.getWebhooks());
        }
        log.info("Delivering posts to WebSocket channel subscribers");
        return channelHub::publish;
    }
}
