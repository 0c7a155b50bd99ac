package com.kpisentinel.service.lifecycle;

/**
 * Thrown when a lifecycle operation names an alert id that does not exist.
 */
public class AlertNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long alertId;

    public AlertNotFoundException(long alertId) {
        super("Alert not found");
        this.alertId = alertId;
    }

    public long getAlertId() {
        return alertId;
    }
}
