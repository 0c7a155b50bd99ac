package com.kpisentinel.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import java.time.Duration;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Micrometer meter definitions for KPI Sentinel, backed by a Prometheus
 * registry so the API can serve them at {@code GET /metrics}.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code sentinel.detection.runs} – timer of full detection runs</li>
 *   <li>{@code sentinel.metrics.skipped} – counter of metrics skipped for insufficient data</li>
 *   <li>{@code sentinel.alerts.created} – counter of persisted alerts, tagged by {@code method}</li>
 *   <li>{@code sentinel.notifications} – counter of delivery attempts, tagged by
 *       {@code channel} and {@code outcome}</li>
 * </ul>
 *
 * <p>
 * {@code detect} and {@code dispatch} are short-lived, so their values are
 * also logged via {@link #summary()} before the process exits.
 * </p>
 */
public class SentinelMetrics {

    private static final String PREFIX = "sentinel.";

    private final PrometheusMeterRegistry registry;
    private final Timer detectionRuns;
    private final Counter metricsSkipped;

    public SentinelMetrics() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public SentinelMetrics(PrometheusMeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.detectionRuns = Timer.builder("sentinel.detection.runs")
                .description("Duration of detection runs")
                .register(registry);
        this.metricsSkipped = Counter.builder("sentinel.metrics.skipped")
                .description("Metrics skipped for insufficient data")
                .register(registry);
    }

    public void recordDetectionRun(Duration duration) {
        detectionRuns.record(duration);
    }

    public void addMetricsSkipped(int count) {
        metricsSkipped.increment(count);
    }

    public void incrementAlertsCreated(String method) {
        registry.counter("sentinel.alerts.created", "method", method != null ? method : "unknown").increment();
    }

    public void incrementNotificationsSent(String channel) {
        registry.counter("sentinel.notifications", "channel", channel, "outcome", "sent").increment();
    }

    public void incrementNotificationsFailed(String channel) {
        registry.counter("sentinel.notifications", "channel", channel, "outcome", "failed").increment();
    }

    /**
     * @return every meter in the Prometheus text exposition format
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * One-line rendering of the sentinel meters, e.g.
     * {@code sentinel.alerts.created{method=z_score}=2}.
     */
    public String summary() {
        return registry.getMeters().stream()
                .filter(meter -> meter.getId().getName().startsWith(PREFIX))
                .sorted(Comparator.comparing((Meter meter) -> meter.getId().getName())
                        .thenComparing(meter -> meter.getId().getTags().toString()))
                .map(SentinelMetrics::describe)
                .collect(Collectors.joining(", "));
    }

    public PrometheusMeterRegistry getRegistry() {
        return registry;
    }

    private static String describe(Meter meter) {
        StringBuilder text = new StringBuilder(meter.getId().getName());
        if (!meter.getId().getTags().isEmpty()) {
            text.append(meter.getId().getTags().stream()
                    .map(tag -> tag.getKey() + "=" + tag.getValue())
                    .collect(Collectors.joining(",", "{", "}")));
        }
        text.append('=');
        if (meter instanceof Timer timer) {
            text.append(timer.count()).append(" run(s)/")
                    .append(String.format(Locale.ROOT, "%.0fms", timer.totalTime(TimeUnit.MILLISECONDS)));
        } else if (meter instanceof Counter counter) {
            text.append((long) counter.count());
        } else {
            meter.measure().forEach(m -> text.append(m.getStatistic()).append(':').append(m.getValue()).append(' '));
        }
        return text.toString();
    }
}
