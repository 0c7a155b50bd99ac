package com.kpisentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An alert produced by a detector but not yet persisted.
 *
 * <p>
 * The alert store turns a draft into an {@link Alert} by assigning an id,
 * a creation timestamp and the initial {@link AlertStatus#OPEN} status.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code metricName}, {@code metricDate},
 * {@code severity}, {@code ruleVersion} and a context carrying a
 * {@value #METHOD_KEY} entry are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertDraft implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Context key naming the detection method that raised the alert. */
    public static final String METHOD_KEY = "method";

    private final String metricName;
    private final LocalDate metricDate;
    private final Severity severity;
    private final String ruleVersion;
    private final double riskScore;
    private final String message;
    private final Map<String, Object> context;

    private AlertDraft(Builder builder) {
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.metricDate = Objects.requireNonNull(builder.metricDate, "metricDate must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.ruleVersion = Objects.requireNonNull(builder.ruleVersion, "ruleVersion must not be null");
        if (builder.riskScore < 0 || Double.isNaN(builder.riskScore)) {
            throw new IllegalArgumentException("riskScore must be >= 0, got: " + builder.riskScore);
        }
        this.riskScore = builder.riskScore;
        this.message = builder.message != null ? builder.message : "";
        if (!builder.context.containsKey(METHOD_KEY)) {
            throw new IllegalArgumentException("context must contain '" + METHOD_KEY + "'");
        }
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(builder.context));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AlertDraft}.
     */
    public static class Builder {
        private String metricName;
        private LocalDate metricDate;
        private Severity severity;
        private String ruleVersion;
        private double riskScore;
        private String message;
        private final Map<String, Object> context = new LinkedHashMap<>();

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder metricDate(LocalDate metricDate) {
            this.metricDate = metricDate;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder ruleVersion(String ruleVersion) {
            this.ruleVersion = ruleVersion;
            return this;
        }

        public Builder riskScore(double riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder method(String method) {
            this.context.put(METHOD_KEY, method);
            return this;
        }

        public Builder context(String key, Object value) {
            this.context.put(key, value);
            return this;
        }

        public Builder context(Map<String, Object> values) {
            this.context.putAll(values);
            return this;
        }

        public AlertDraft build() {
            return new AlertDraft(this);
        }
    }

    public String getMetricName() {
        return metricName;
    }

    public LocalDate getMetricDate() {
        return metricDate;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getRuleVersion() {
        return ruleVersion;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return unmodifiable method-specific payload, always containing
     *         {@value #METHOD_KEY}
     */
    public Map<String, Object> getContext() {
        return context;
    }

    public String getMethod() {
        return String.valueOf(context.get(METHOD_KEY));
    }

    @Override
    public String toString() {
        return "AlertDraft{" +
                "metricName='" + metricName + '\'' +
                ", metricDate=" + metricDate +
                ", method=" + getMethod() +
                ", severity=" + severity +
                ", riskScore=" + riskScore +
                '}';
    }
}
