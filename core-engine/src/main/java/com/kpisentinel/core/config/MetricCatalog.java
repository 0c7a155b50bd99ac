package com.kpisentinel.core.config;

import com.kpisentinel.core.risk.ImpactProfile;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the metric catalog YAML.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * metrics:
 *   - name: tx_fail_rate
 *     impact: rate_increase
 *   - name: dau
 *     impact: activity_drop
 * </pre>
 *
 * @since 1.0.0
 */
public class MetricCatalog implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Profile applied to metrics the catalog does not list. */
    public static final ImpactProfile FALLBACK_PROFILE = ImpactProfile.ACTIVITY_DROP;

    private List<TrackedMetric> metrics = new ArrayList<>();

    public MetricCatalog() {
    }

    public MetricCatalog(List<TrackedMetric> metrics) {
        setMetrics(metrics);
    }

    /**
     * @return unmodifiable list of tracked metrics, in catalog order
     */
    public List<TrackedMetric> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    /**
     * Set the metrics list (used by SnakeYAML during deserialization).
     *
     * @param metrics the tracked metrics
     */
    public void setMetrics(List<TrackedMetric> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    /**
     * @return metric names in catalog order
     */
    public List<String> metricNames() {
        return metrics.stream().map(TrackedMetric::getName).toList();
    }

    /**
     * @param metricName metric name
     * @return the catalog's profile for the metric, or
     *         {@link #FALLBACK_PROFILE} when it is not listed
     */
    public ImpactProfile profileFor(String metricName) {
        return metrics.stream()
                .filter(m -> Objects.equals(m.getName(), metricName))
                .findFirst()
                .map(TrackedMetric::resolveImpactProfile)
                .orElse(FALLBACK_PROFILE);
    }

    /**
     * Validate every metric and reject duplicate names.
     *
     * @throws IllegalStateException if one or more entries are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < metrics.size(); i++) {
            TrackedMetric metric = Objects.requireNonNull(metrics.get(i),
                    "Metric at index " + i + " is null");
            try {
                metric.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (metric.getName() != null && !seen.add(metric.getName())) {
                errors.add("Duplicate metric '" + metric.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Metric catalog validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "MetricCatalog{metrics=" + metrics + '}';
    }
}
