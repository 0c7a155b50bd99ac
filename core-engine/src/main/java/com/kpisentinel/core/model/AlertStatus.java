package com.kpisentinel.core.model;

import java.util.Locale;

/**
 * Lifecycle state of an {@link Alert}. Transitions only move forward:
 * {@code OPEN -> ACK -> RESOLVED}.
 *
 * @since 1.0.0
 */
public enum AlertStatus {

    OPEN,
    ACK,
    RESOLVED;

    /**
     * Parse a stored status value.
     *
     * @param value status name, case-insensitive
     * @return the matching status
     * @throws IllegalArgumentException if the value is unknown
     */
    public static AlertStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Alert status must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
