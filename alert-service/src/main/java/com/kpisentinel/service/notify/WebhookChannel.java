package com.kpisentinel.service.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpisentinel.core.model.Alert;
import com.kpisentinel.service.storage.JsonSupport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Posts each alert as a JSON document to every configured URL. Each URL is
 * its own target. Any status outside {@code 2xx} is a delivery failure.
 */
public class WebhookChannel implements NotificationChannel {

    public static final String NAME = "webhook";

    private final List<String> urls;
    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public WebhookChannel(List<String> urls, ObjectMapper mapper, Duration timeout) {
        this(urls, HttpClient.newBuilder().connectTimeout(timeout).build(), mapper, timeout);
    }

    WebhookChannel(List<String> urls, HttpClient client, ObjectMapper mapper, Duration timeout) {
        this.urls = List.copyOf(Objects.requireNonNull(urls, "urls must not be null"));
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<String> getTargets() {
        return urls;
    }

    @Override
    public Map<String, Object> renderPayload(Alert alert, String target) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alert_id", alert.getAlertId());
        payload.put("metric_name", alert.getMetricName());
        payload.put("metric_date", alert.getMetricDate() != null ? alert.getMetricDate().toString() : null);
        payload.put("severity", alert.getSeverity().name());
        payload.put("risk_score", alert.getRiskScore());
        payload.put("message", alert.getMessage());
        payload.put("context", alert.getContext());
        payload.put("timestamp", alert.getCreatedAt().toString());
        return payload;
    }

    @Override
    public void send(Alert alert, String target, Map<String, Object> payload) throws DeliveryException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(target))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(JsonSupport.write(mapper, payload)))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new DeliveryException("Invalid webhook URL: " + target, e);
        }

        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new DeliveryException("Webhook returned HTTP " + status);
            }
        } catch (IOException e) {
            throw new DeliveryException("Webhook request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeliveryException("Webhook request interrupted", e);
        }
    }
}
