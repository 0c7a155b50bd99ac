package com.kpisentinel.core.detection;

import com.kpisentinel.core.model.AlertDraft;
import com.kpisentinel.core.model.Severity;
import com.kpisentinel.core.risk.RiskScorer;

import java.util.Locale;
import java.util.Map;

/**
 * Shared tail of every detector: impact, confidence, risk and severity for a
 * fired statistic, assembled into an {@link AlertDraft}.
 */
final class AlertDrafts {

    private AlertDrafts() {
        // utility class
    }

    /**
     * @param input         the detection input
     * @param method        method name stored under {@code context.method}
     * @param statistic     the z-like statistic that fired
     * @param referenceMean mean the observation is compared against for impact
     * @param message       human-readable description
     * @param statistics    method-specific intermediate values, in display order
     * @return the draft
     */
    static AlertDraft fired(DetectionInput input, String method, double statistic,
            double referenceMean, String message, Map<String, Object> statistics) {
        double impact = input.getImpactProfile().impact(input.getObserved(), referenceMean);
        double confidence = RiskScorer.confidenceFromZ(statistic);
        double risk = RiskScorer.score(impact, confidence, input.getPersistence());

        return AlertDraft.builder()
                .metricName(input.getMetricName())
                .metricDate(input.getTargetDate())
                .severity(Severity.fromZ(statistic))
                .ruleVersion(input.getRuleConfig().getRuleVersion())
                .riskScore(risk)
                .message(message)
                .method(method)
                .context("observed", input.getObserved())
                .context(statistics)
                .context("impact", impact)
                .context("confidence", confidence)
                .context("persistence", input.getPersistence())
                .build();
    }

    static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
