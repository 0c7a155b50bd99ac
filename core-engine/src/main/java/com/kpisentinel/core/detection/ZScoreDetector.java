package com.kpisentinel.core.detection;

import com.kpisentinel.core.model.AlertDraft;
import com.kpisentinel.core.model.Severity;
import com.kpisentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rolling z-score detector.
 *
 * <p>
 * Scores the observation against the trailing-week baseline and fires when
 * {@code |z| >= 3}. A baseline with (near) zero spread yields {@code z = 0}
 * and never fires.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetector.class);

    public static final String METHOD = "z_score";

    static final double THRESHOLD = Severity.WARN_Z;

    @Override
    public Optional<AlertDraft> evaluate(DetectionInput input) {
        Objects.requireNonNull(input, "DetectionInput must not be null");

        double mean = input.getBaselineMean();
        double stdDev = input.getBaselineStdDev();
        double z = Stats.zScore(input.getObserved(), mean, stdDev);

        if (Math.abs(z) < THRESHOLD) {
            return Optional.empty();
        }
        LOG.debug("[{}] {} fired: observed={} mean={} stddev={} z={}",
                METHOD, input.getMetricName(), input.getObserved(), mean, stdDev, z);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("baseline_mean", mean);
        stats.put("baseline_std", stdDev);
        stats.put("z_score", z);
        stats.put("baseline_window_days", input.getBaseline().size());

        String message = AlertDrafts.format("%s anomalous on %s: observed=%.4g, baseline_mean=%.4g, z=%.2f",
                input.getMetricName(), input.getTargetDate(), input.getObserved(), mean, z);
        return Optional.of(AlertDrafts.fired(input, METHOD, z, mean, message, stats));
    }

    @Override
    public String getMethod() {
        return METHOD;
    }
}
