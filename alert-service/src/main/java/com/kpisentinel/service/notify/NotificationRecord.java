package com.kpisentinel.service.notify;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One row of {@code alert_notifications}: the latest delivery state of an
 * alert for a {@code (channel, target)} pair.
 *
 * <p>
 * {@code metricName} and {@code severity} are only populated by listings
 * that join the owning alert.
 * </p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationRecord {

    private final long notificationId;
    private final long alertId;
    private final String channel;
    private final String target;
    private final NotificationStatus status;
    private final Map<String, Object> payload;
    private final String lastError;
    private final Instant sentAt;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String metricName;
    private final String severity;

    private NotificationRecord(Builder b) {
        this.notificationId = b.notificationId;
        this.alertId = b.alertId;
        this.channel = Objects.requireNonNull(b.channel, "channel must not be null");
        this.target = Objects.requireNonNull(b.target, "target must not be null");
        this.status = Objects.requireNonNull(b.status, "status must not be null");
        this.payload = b.payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.payload))
                : Collections.emptyMap();
        this.lastError = b.lastError;
        this.sentAt = b.sentAt;
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt;
        this.metricName = b.metricName;
        this.severity = b.severity;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long notificationId;
        private long alertId;
        private String channel;
        private String target;
        private NotificationStatus status;
        private Map<String, Object> payload;
        private String lastError;
        private Instant sentAt;
        private Instant createdAt;
        private Instant updatedAt;
        private String metricName;
        private String severity;

        public Builder notificationId(long v) {
            this.notificationId = v;
            return this;
        }

        public Builder alertId(long v) {
            this.alertId = v;
            return this;
        }

        public Builder channel(String v) {
            this.channel = v;
            return this;
        }

        public Builder target(String v) {
            this.target = v;
            return this;
        }

        public Builder status(NotificationStatus v) {
            this.status = v;
            return this;
        }

        public Builder payload(Map<String, Object> v) {
            this.payload = v;
            return this;
        }

        public Builder lastError(String v) {
            this.lastError = v;
            return this;
        }

        public Builder sentAt(Instant v) {
            this.sentAt = v;
            return this;
        }

        public Builder createdAt(Instant v) {
            this.createdAt = v;
            return this;
        }

        public Builder updatedAt(Instant v) {
            this.updatedAt = v;
            return this;
        }

        public Builder metricName(String v) {
            this.metricName = v;
            return this;
        }

        public Builder severity(String v) {
            this.severity = v;
            return this;
        }

        public NotificationRecord build() {
            return new NotificationRecord(this);
        }
    }

    public long getNotificationId() {
        return notificationId;
    }

    public long getAlertId() {
        return alertId;
    }

    public String getChannel() {
        return channel;
    }

    public String getTarget() {
        return target;
    }

    public NotificationStatus getStatus() {
        return status;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getSentAt() {
        return sentAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public String getMetricName() {
        return metricName;
    }

    public String getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return "NotificationRecord{" +
                "alertId=" + alertId +
                ", channel='" + channel + '\'' +
                ", target='" + target + '\'' +
                ", status=" + status +
                '}';
    }
}
