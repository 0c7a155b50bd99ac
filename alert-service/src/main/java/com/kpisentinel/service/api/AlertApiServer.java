package com.kpisentinel.service.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpisentinel.core.model.Alert;
import com.kpisentinel.service.SentinelMetrics;
import com.kpisentinel.service.lifecycle.AlertLifecycleService;
import com.kpisentinel.service.lifecycle.AlertNotFoundException;
import com.kpisentinel.service.lifecycle.InsufficientRoleException;
import com.kpisentinel.service.lifecycle.Role;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * HTTP surface over the {@link AlertLifecycleService}.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code {"status":"UP"}}</li>
 * <li>{@code GET /alerts/recent?limit=N} – newest alerts first</li>
 * <li>{@code POST /alerts/{id}/ack} – body {@code {"actor":"..."}}, header {@code X-Role}</li>
 * <li>{@code POST /alerts/{id}/resolve} – same contract as ack</li>
 * <li>{@code GET /notifications/recent?limit=N} – newest notification rows first</li>
 * <li>{@code GET /metrics} – job and delivery meters in the Prometheus text format</li>
 * </ul>
 *
 * <p>
 * Errors are JSON {@code {"detail": "..."}}: 400 for bad input, 403 for an
 * invalid or insufficient role, 404 for unknown alerts and routes, 405 for
 * a wrong method. Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertApiServer {

    private static final Logger LOG = LoggerFactory.getLogger(AlertApiServer.class);

    public static final String ROLE_HEADER = "X-Role";

    static final String JSON = "application/json";
    static final String PROMETHEUS_TEXT = "text/plain; version=0.0.4; charset=utf-8";

    private static final Pattern ALERT_ACTION = Pattern.compile("^/alerts/([^/]+)/(ack|resolve)/?$");
    private static final int THREADS = 4;

    private final AlertLifecycleService lifecycle;
    private final ObjectMapper mapper;
    private final SentinelMetrics metrics;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;
    private ExecutorService executor;

    public AlertApiServer(AlertLifecycleService lifecycle, ObjectMapper mapper, SentinelMetrics metrics) {
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "API port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            LOG.error("Failed to start API server on port {}: {}", port, e.getMessage(), e);
            throw new UncheckedIOException("Cannot bind API port " + port, e);
        }
        server.createContext("/health", exchange -> handle(exchange, this::route));
        server.createContext("/alerts", exchange -> handle(exchange, this::route));
        server.createContext("/notifications", exchange -> handle(exchange, this::route));
        server.createContext("/metrics", exchange -> handle(exchange, this::route));

        AtomicInteger threadCount = new AtomicInteger();
        executor = Executors.newFixedThreadPool(THREADS, r -> {
            Thread t = new Thread(r, "api-server-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("API server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("API server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, useful when started on port {@code 0}
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("API server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Routing
    // ---------------------------------------------------------------

    /**
     * Status code and body: JSON-serializable, or text written as is.
     */
    static final class Response {
        final int status;
        final Object body;
        final String contentType;

        Response(int status, Object body, String contentType) {
            this.status = status;
            this.body = body;
            this.contentType = contentType;
        }

        Response(int status, Object body) {
            this(status, body, JSON);
        }

        static Response ok(Object body) {
            return new Response(200, body);
        }

        static Response text(String body, String contentType) {
            return new Response(200, body, contentType);
        }

        static Response error(int status, String detail) {
            return new Response(status, Map.of("detail", detail));
        }
    }

    @FunctionalInterface
    interface Route {
        Response apply(HttpExchange exchange) throws IOException;
    }

    private Response route(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();

        if (path.equals("/health")) {
            return requireMethod(method, "GET", () -> Response.ok(Map.of("status", "UP")));
        }
        if (path.equals("/alerts/recent")) {
            return requireMethod(method, "GET",
                    () -> Response.ok(lifecycle.listRecentAlerts(limit(exchange))));
        }
        if (path.equals("/metrics") || path.equals("/metrics/prometheus")) {
            return requireMethod(method, "GET", () -> Response.text(metrics.scrape(), PROMETHEUS_TEXT));
        }
        if (path.equals("/notifications/recent")) {
            return requireMethod(method, "GET",
                    () -> Response.ok(lifecycle.listRecentNotifications(limit(exchange))));
        }
        Matcher matcher = ALERT_ACTION.matcher(path);
        if (matcher.matches()) {
            if (!"POST".equals(method)) {
                return Response.error(405, "Method not allowed");
            }
            Role role = Role.parse(exchange.getRequestHeaders().getFirst(ROLE_HEADER));
            role.require(AlertLifecycleService.REQUIRED_ROLE);
            long alertId = alertId(matcher.group(1));
            String actor = actor(exchange.getRequestBody());
            Alert alert = "ack".equals(matcher.group(2))
                    ? lifecycle.acknowledge(alertId, actor, role)
                    : lifecycle.resolve(alertId, actor, role);
            return Response.ok(alert);
        }
        return Response.error(404, "Not found");
    }

    @FunctionalInterface
    private interface Action {
        Response run() throws IOException;
    }

    private static Response requireMethod(String method, String expected, Action action) throws IOException {
        if (!expected.equals(method)) {
            return Response.error(405, "Method not allowed");
        }
        return action.run();
    }

    private void handle(HttpExchange exchange, Route route) throws IOException {
        Response response;
        try {
            response = route.apply(exchange);
        } catch (AlertNotFoundException e) {
            response = Response.error(404, e.getMessage());
        } catch (InsufficientRoleException e) {
            response = Response.error(403, e.getMessage());
        } catch (JsonProcessingException e) {
            response = Response.error(400, "Malformed JSON body");
        } catch (IllegalArgumentException e) {
            response = Response.error(400, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Request {} {} failed: {}", exchange.getRequestMethod(),
                    exchange.getRequestURI().getPath(), e.getMessage(), e);
            response = Response.error(500, "Internal error");
        }
        write(exchange, response);
    }

    private void write(HttpExchange exchange, Response response) throws IOException {
        byte[] body = JSON.equals(response.contentType)
                ? mapper.writeValueAsBytes(response.body)
                : String.valueOf(response.body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", response.contentType);
        exchange.sendResponseHeaders(response.status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    // ---------------------------------------------------------------
    // Request parsing
    // ---------------------------------------------------------------

    static int limit(HttpExchange exchange) {
        String raw = queryParam(exchange.getRequestURI().getRawQuery(), "limit");
        if (raw == null) {
            return AlertLifecycleService.DEFAULT_LIMIT;
        }
        try {
            return AlertLifecycleService.checkLimit(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be an integer, got: " + raw);
        }
    }

    static String queryParam(String rawQuery, String name) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq >= 0 ? pair.substring(0, eq) : pair, StandardCharsets.UTF_8);
            if (key.equals(name)) {
                return eq >= 0 ? URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8) : "";
            }
        }
        return null;
    }

    private static long alertId(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("alert id must be an integer, got: " + raw);
        }
    }

    private String actor(InputStream body) throws IOException {
        JsonNode node;
        try (body) {
            byte[] bytes = body.readAllBytes();
            if (bytes.length == 0) {
                throw new IllegalArgumentException("Request body with an actor is required");
            }
            node = mapper.readTree(bytes);
        }
        if (node == null || !node.isObject() || !node.hasNonNull("actor") || !node.get("actor").isTextual()) {
            throw new IllegalArgumentException("actor is required");
        }
        return node.get("actor").asText();
    }
}
