package com.siqiu.scriptmonitor.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siqiu.scriptmonitor.alert.AlertEvent;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * POSTs the event as JSON to the channel's URL.
 */
@Component
public class WebhookTransport implements NotificationTransport {

    private final CloseableHttpClient client;
    private final ObjectMapper mapper;

    public WebhookTransport(@Qualifier("webhookHttpClient") CloseableHttpClient client, ObjectMapper mapper) {
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public String type() {
        return "WEBHOOK";
    }

    @Override
    public void deliver(NotificationChannel channel, AlertEvent event) throws DeliveryException {
        if (channel.getTarget() == null || channel.getTarget().isBlank()) {
            throw new DeliveryException("webhook channel " + channel.getId() + " has no target URL", false);
        }

        HttpPost request;
        try {
            request = new HttpPost(channel.getTarget());
        } catch (IllegalArgumentException e) {
            throw new DeliveryException("invalid webhook URL: " + channel.getTarget(), false);
        }
        channel.getHeaders().forEach(request::setHeader);
        request.setEntity(new StringEntity(payload(event), ContentType.APPLICATION_JSON));

        try (CloseableHttpResponse response = client.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            EntityUtils.consumeQuietly(response.getEntity());
            if (status >= 200 && status < 300) {
                return;
            }
            String reason = String.format("Code: %s, reason: %s", status, response.getStatusLine().getReasonPhrase());
            throw new DeliveryException(reason, isRetryable(status));
        } catch (IOException e) {
            throw new DeliveryException("webhook request failed: " + e.getMessage(), e);
        }
    }

    static boolean isRetryable(int status) {
        if (status == 408 || status == 429) return true;
        return status < 400 || status >= 500;
    }

    private String payload(AlertEvent event) throws DeliveryException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("eventId", event.id().toString());
        body.put("ruleId", event.ruleId());
        body.put("scheduleId", event.scheduleId());
        body.put("executionId", event.executionId().toString());
        body.put("triggeredAt", event.triggeredAt().toString());
        body.put("snapshot", event.snapshot());
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DeliveryException("Failed to serialize alert event", false);
        }
    }
}
