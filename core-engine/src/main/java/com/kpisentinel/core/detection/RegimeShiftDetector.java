package com.kpisentinel.core.detection;

import com.kpisentinel.core.model.AlertDraft;
import com.kpisentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Regime-shift detector.
 *
 * <p>
 * Compares the most recent {@code regime_recent_days} values with the
 * {@code regime_baseline_days} values before them. Fires when the recent
 * mean differs from the prior mean by at least {@code regime_z} standard
 * errors, or when the ratio of recent to prior variance leaves
 * {@code (1 / regime_var_ratio, regime_var_ratio)}.
 * </p>
 *
 * <p>
 * A prior window without spread gives an infinite variance ratio, which
 * always fires, and a mean z of 0.
 * </p>
 *
 * @since 1.0.0
 */
public class RegimeShiftDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(RegimeShiftDetector.class);

    public static final String METHOD = "regime_shift";

    @Override
    public Optional<AlertDraft> evaluate(DetectionInput input) {
        Objects.requireNonNull(input, "DetectionInput must not be null");

        int recentDays = input.getRuleConfig().getRegimeRecentDays();
        int baselineDays = input.getRuleConfig().getRegimeBaselineDays();
        double threshold = input.getRuleConfig().getRegimeZ();
        double ratioLimit = input.getRuleConfig().getRegimeVarRatio();
        List<Double> values = input.getSeries().values();

        if (values.size() < recentDays + baselineDays) {
            return Optional.empty();
        }
        List<Double> recent = values.subList(values.size() - recentDays, values.size());
        List<Double> prior = values.subList(values.size() - recentDays - baselineDays,
                values.size() - recentDays);

        double priorMean = Stats.mean(prior);
        double priorStd = Stats.sampleStdDev(prior);
        double priorVar = Stats.sampleVariance(prior);
        double recentMean = Stats.mean(recent);
        double recentVar = Stats.sampleVariance(recent);

        double meanZ = priorStd > 0
                ? (recentMean - priorMean) / (priorStd / Math.sqrt(recent.size()))
                : 0.0;
        double varRatio = varianceRatio(recentVar, priorVar);

        boolean meanShift = Math.abs(meanZ) >= threshold;
        boolean varianceShift = varRatio >= ratioLimit || varRatio <= 1 / ratioLimit;
        if (!meanShift && !varianceShift) {
            return Optional.empty();
        }
        LOG.debug("[{}] {} fired: priorMean={} recentMean={} meanZ={} varRatio={}",
                METHOD, input.getMetricName(), priorMean, recentMean, meanZ, varRatio);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("prior_mean", priorMean);
        stats.put("recent_mean", recentMean);
        stats.put("mean_z", meanZ);
        stats.put("prior_var", priorVar);
        stats.put("recent_var", recentVar);
        stats.put("var_ratio", varRatio);
        stats.put("mean_shift", meanShift);
        stats.put("variance_shift", varianceShift);

        String message = AlertDrafts.format("%s regime shift on %s: prior_mean=%.4g, recent_mean=%.4g",
                input.getMetricName(), input.getTargetDate(), priorMean, recentMean);
        return Optional.of(AlertDrafts.fired(input, METHOD, meanZ, priorMean, message, stats));
    }

    @Override
    public String getMethod() {
        return METHOD;
    }

    static double varianceRatio(double recentVar, double priorVar) {
        return priorVar > 0 ? recentVar / priorVar : Double.POSITIVE_INFINITY;
    }
}
