package io.github.drompincen.postscheduler.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "postscheduler.delivery")
public class DeliveryProperties {

    public enum Mode { WEBSOCKET, WEBHOOK }

    private Mode mode = Mode.WEBSOCKET;
    private Map<String, String> webhooks = new LinkedHashMap<>();

    public Mode getMode() { return mode; }
    public void setMode(Mode mode) { this.mode = mode; }

    /** Destination id to webhook URL. */
    public Map<String, String> getWebhooks() { return webhooks; }
    public void setWebhooks(Map<String, String> webhooks) { this.webhooks = webhooks; }
}
