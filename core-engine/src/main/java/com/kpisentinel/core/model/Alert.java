package com.kpisentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted alert raised by one detection method for one metric and day.
 *
 * <p>
 * Several alerts may exist for the same {@code (metricName, metricDate)},
 * one per triggering method; they are never merged. Alerts are never
 * deleted. The acknowledgement and resolution fields are written once and
 * never overwritten.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code alertId}, {@code metricName},
 * {@code severity}, {@code status} and {@code createdAt} are required.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long alertId;
    private final Instant createdAt;
    private final String metricName;
    private final LocalDate metricDate;
    private final Severity severity;
    private final String ruleVersion;
    private final double riskScore;
    private final String message;
    private final Map<String, Object> context;
    private final AlertStatus status;
    private final String ackedBy;
    private final Instant ackedAt;
    private final String resolvedBy;
    private final Instant resolvedAt;

    private Alert(Builder builder) {
        this.alertId = Objects.requireNonNull(builder.alertId, "alertId must not be null");
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.metricDate = builder.metricDate;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.ruleVersion = builder.ruleVersion;
        this.riskScore = builder.riskScore;
        this.message = builder.message;
        this.context = builder.context != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.context))
                : Collections.emptyMap();
        this.status = Objects.requireNonNull(builder.status, "status must not be null");
        this.ackedBy = builder.ackedBy;
        this.ackedAt = builder.ackedAt;
        this.resolvedBy = builder.resolvedBy;
        this.resolvedAt = builder.resolvedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private Long alertId;
        private Instant createdAt;
        private String metricName;
        private LocalDate metricDate;
        private Severity severity;
        private String ruleVersion;
        private double riskScore;
        private String message;
        private Map<String, Object> context;
        private AlertStatus status = AlertStatus.OPEN;
        private String ackedBy;
        private Instant ackedAt;
        private String resolvedBy;
        private Instant resolvedAt;

        public Builder alertId(long alertId) {
            this.alertId = alertId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

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

        public Builder context(Map<String, Object> context) {
            this.context = context;
            return this;
        }

        public Builder status(AlertStatus status) {
            this.status = status;
            return this;
        }

        public Builder ackedBy(String ackedBy) {
            this.ackedBy = ackedBy;
            return this;
        }

        public Builder ackedAt(Instant ackedAt) {
            this.ackedAt = ackedAt;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        /**
         * Copy every field of a draft into this builder.
         *
         * @param draft the detector output
         * @return this builder
         */
        public Builder fromDraft(AlertDraft draft) {
            this.metricName = draft.getMetricName();
            this.metricDate = draft.getMetricDate();
            this.severity = draft.getSeverity();
            this.ruleVersion = draft.getRuleVersion();
            this.riskScore = draft.getRiskScore();
            this.message = draft.getMessage();
            this.context = draft.getContext();
            return this;
        }

        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public long getAlertId() {
        return alertId;
    }

    public Instant getCreatedAt() {
        return createdAt;
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
     * @return unmodifiable method-specific payload
     */
    public Map<String, Object> getContext() {
        return context;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public String getAckedBy() {
        return ackedBy;
    }

    public Instant getAckedAt() {
        return ackedAt;
    }

    public String getResolvedBy() {
        return resolvedBy;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    /**
     * @return the detection method recorded in the context, or {@code null}
     */
    @JsonIgnore
    public String getMethod() {
        Object method = context.get(AlertDraft.METHOD_KEY);
        return method != null ? method.toString() : null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return alertId == alert.alertId;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(alertId);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "alertId=" + alertId +
                ", metricName='" + metricName + '\'' +
                ", metricDate=" + metricDate +
                ", severity=" + severity +
                ", status=" + status +
                ", riskScore=" + riskScore +
                '}';
    }
}
