package com.kpisentinel.service.notify;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of the last delivery attempt of an alert to one channel target.
 */
public enum NotificationStatus {

    SENT("sent"),
    FAILED("failed");

    private final String value;

    NotificationStatus(String value) {
        this.value = value;
    }

    /**
     * @return the stored, lower-case form
     */
    @JsonValue
    public String value() {
        return value;
    }

    public static NotificationStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Notification status must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
