package com.kpisentinel.service.detection;

import com.kpisentinel.core.model.Alert;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one committed detection run.
 */
public final class DetectionSummary {

    private final LocalDate targetDate;
    private final String ruleVersion;
    private final int metricsEvaluated;
    private final int metricsSkipped;
    private final List<Alert> alerts;

    public DetectionSummary(LocalDate targetDate, String ruleVersion, int metricsEvaluated, int metricsSkipped,
            List<Alert> alerts) {
        this.targetDate = targetDate;
        this.ruleVersion = ruleVersion;
        this.metricsEvaluated = metricsEvaluated;
        this.metricsSkipped = metricsSkipped;
        this.alerts = List.copyOf(alerts);
    }

    public LocalDate getTargetDate() {
        return targetDate;
    }

    public String getRuleVersion() {
        return ruleVersion;
    }

    public int getMetricsEvaluated() {
        return metricsEvaluated;
    }

    public int getMetricsSkipped() {
        return metricsSkipped;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    @Override
    public String toString() {
        return "DetectionSummary{" +
                "targetDate=" + targetDate +
                ", ruleVersion='" + ruleVersion + '\'' +
                ", metricsEvaluated=" + metricsEvaluated +
                ", metricsSkipped=" + metricsSkipped +
                ", alerts=" + alerts.size() +
                '}';
    }
}
