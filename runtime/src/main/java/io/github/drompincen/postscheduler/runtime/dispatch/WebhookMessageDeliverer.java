package io.github.drompincen.postscheduler.runtime.dispatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.postscheduler.protocol.api.DeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

/**
 * Posts to chat webhooks, one URL per destination, with a {@code {"content": ...}} JSON body.
 */
public class WebhookMessageDeliverer implements MessageDeliverer {

    private static final Logger log = LoggerFactory.getLogger(WebhookMessageDeliverer.class);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Map<String, String> webhookUrls;

    public WebhookMessageDeliverer(HttpClient client, ObjectMapper mapper, Map<String, String> webhookUrls) {
        this.client = client;
        this.mapper = mapper;
        this.webhookUrls = Map.copyOf(webhookUrls);
    }

    @Override
    public DeliveryResult deliver(String destinationId, String content) {
        String url = webhookUrls.get(destinationId);
        if (url == null) {
            log.warn("No webhook configured for destination {}", destinationId);
            return DeliveryResult.UNKNOWN_DESTINATION;
        }
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(Map.of("content", content))))
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 200 && status < 300) return DeliveryResult.OK;
            if (status == 401 || status == 403) return DeliveryResult.PERMISSION_DENIED;
            log.warn("Webhook for destination {} answered HTTP {}", destinationId, status);
            return DeliveryResult.TRANSIENT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.TRANSIENT_ERROR;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Webhook post to destination {} failed: {}", destinationId, e.getMessage());
            return DeliveryResult.TRANSIENT_ERROR;
        }
    }
}
