package com.kpisentinel.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpisentinel.core.model.Alert;
import com.kpisentinel.core.model.Severity;
import com.kpisentinel.service.ServiceContext;
import com.kpisentinel.service.TestDatabase;
import com.kpisentinel.service.lifecycle.AlertLifecycleService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AlertApiServer} over real HTTP.
 */
class AlertApiServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private ServiceContext context;
    private ObjectMapper mapper;
    private AlertApiServer server;
    private Alert alert;

    @BeforeEach
    void setUp() {
        context = TestDatabase.newContext();
        mapper = context.getObjectMapper();
        server = new AlertApiServer(AlertLifecycleService.from(context), mapper, context.getMetrics());
        server.start(0);
        alert = TestDatabase.insertAlert(context, "dau", Severity.WARN);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        context.close();
    }

    @Test
    @DisplayName("Health endpoint should report UP")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).get("status").asText()).isEqualTo("UP");
        assertThat(server.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Recent alerts should be returned as snake_case JSON")
    void shouldListRecentAlerts() throws Exception {
        HttpResponse<String> response = get("/alerts/recent?limit=10");

        JsonNode body = json(response);
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).contains("application/json");
        assertThat(body.isArray()).isTrue();
        assertThat(body.size()).isEqualTo(1);
        assertThat(body.get(0).get("alert_id").asLong()).isEqualTo(alert.getAlertId());
        assertThat(body.get(0).get("metric_name").asText()).isEqualTo("dau");
        assertThat(body.get(0).get("metric_date").asText()).isEqualTo("2024-03-13");
        assertThat(body.get(0).get("status").asText()).isEqualTo("OPEN");
        assertThat(body.get(0).get("created_at").asText()).isEqualTo("2024-03-14T06:00:00Z");
    }

    @Test
    @DisplayName("An out-of-range or non-numeric limit should be a 400")
    void shouldRejectBadLimit() throws Exception {
        assertThat(get("/alerts/recent?limit=0").statusCode()).isEqualTo(400);
        assertThat(get("/alerts/recent?limit=500").statusCode()).isEqualTo(400);
        assertThat(get("/notifications/recent?limit=ten").statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("Recent notifications should be empty before any dispatch")
    void shouldListRecentNotifications() throws Exception {
        HttpResponse<String> response = get("/notifications/recent");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("An operator should acknowledge an alert")
    void shouldAcknowledge() throws Exception {
        HttpResponse<String> response = post("/alerts/" + alert.getAlertId() + "/ack", "operator",
                "{\"actor\":\"ana\"}");

        JsonNode body = json(response);
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(body.get("status").asText()).isEqualTo("ACK");
        assertThat(body.get("acked_by").asText()).isEqualTo("ana");
    }

    @Test
    @DisplayName("An admin should resolve an alert")
    void shouldResolve() throws Exception {
        HttpResponse<String> response = post("/alerts/" + alert.getAlertId() + "/resolve", "admin",
                "{\"actor\":\"carol\"}");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).get("status").asText()).isEqualTo("RESOLVED");
    }

    @Test
    @DisplayName("Readers and unknown roles should get a 403")
    void shouldRejectInsufficientRole() throws Exception {
        HttpResponse<String> reader = post("/alerts/" + alert.getAlertId() + "/ack", "reader",
                "{\"actor\":\"ana\"}");
        HttpResponse<String> missing = post("/alerts/" + alert.getAlertId() + "/ack", null,
                "{\"actor\":\"ana\"}");
        HttpResponse<String> unknown = post("/alerts/" + alert.getAlertId() + "/ack", "root",
                "{\"actor\":\"ana\"}");

        assertThat(reader.statusCode()).isEqualTo(403);
        assertThat(json(reader).get("detail").asText()).isEqualTo("Insufficient role");
        assertThat(missing.statusCode()).isEqualTo(403);
        assertThat(unknown.statusCode()).isEqualTo(403);
        assertThat(json(unknown).get("detail").asText()).isEqualTo("Invalid role");
    }

    @Test
    @DisplayName("An unknown alert should be a 404")
    void shouldReportMissingAlert() throws Exception {
        HttpResponse<String> response = post("/alerts/99999/resolve", "operator", "{\"actor\":\"ana\"}");

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(json(response).get("detail").asText()).isEqualTo("Alert not found");
    }

    @Test
    @DisplayName("A missing actor or malformed body should be a 400")
    void shouldRejectBadBody() throws Exception {
        String path = "/alerts/" + alert.getAlertId() + "/ack";

        assertThat(post(path, "operator", "{}").statusCode()).isEqualTo(400);
        assertThat(post(path, "operator", "").statusCode()).isEqualTo(400);
        HttpResponse<String> malformed = post(path, "operator", "{actor");
        assertThat(malformed.statusCode()).isEqualTo(400);
        assertThat(json(malformed).get("detail").asText()).isEqualTo("Malformed JSON body");
        assertThat(post("/alerts/abc/ack", "operator", "{\"actor\":\"ana\"}").statusCode()).isEqualTo(400);
    }

    @Test
    @DisplayName("Wrong methods should be a 405 and unknown routes a 404")
    void shouldRejectWrongMethodAndRoute() throws Exception {
        assertThat(get("/alerts/" + alert.getAlertId() + "/ack").statusCode()).isEqualTo(405);
        assertThat(post("/health", "admin", "{}").statusCode()).isEqualTo(405);
        assertThat(get("/alerts/unknown").statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("Metrics endpoint should serve recorded meters as Prometheus text")
    void shouldScrapeMetrics() throws Exception {
        context.getMetrics().incrementNotificationsSent("slack");
        context.getMetrics().addMetricsSkipped(2);

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                type -> assertThat(type).startsWith("text/plain"));
        assertThat(response.body())
                .contains("sentinel_notifications_total{channel=\"slack\",outcome=\"sent\"}")
                .contains("sentinel_metrics_skipped_total");
        assertThat(get("/metrics/prometheus").body()).contains("sentinel_notifications_total");
        assertThat(post("/metrics", "admin", "{}").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should reject an out-of-range port")
    void shouldRejectInvalidPort() {
        AlertApiServer other = new AlertApiServer(AlertLifecycleService.from(context), mapper, context.getMetrics());

        assertThatThrownBy(() -> other.start(70_000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(other::getPort).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should read query parameters by name")
    void shouldParseQueryParams() {
        assertThat(AlertApiServer.queryParam("a=1&limit=25", "limit")).isEqualTo("25");
        assertThat(AlertApiServer.queryParam("limit", "limit")).isEmpty();
        assertThat(AlertApiServer.queryParam(null, "limit")).isNull();
        assertThat(AlertApiServer.queryParam("other=2", "limit")).isNull();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String role, String body) throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (role != null) {
            request.header(AlertApiServer.ROLE_HEADER, role);
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    private JsonNode json(HttpResponse<String> response) throws IOException {
        return mapper.readTree(response.body());
    }
}
