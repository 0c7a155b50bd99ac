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
 * Two-window change-point detector.
 *
 * <p>
 * Splits the most recent {@code 2 × window} points of the series into a
 * prior and a recent window of equal size and tests the difference of their
 * means against the pooled standard deviation:
 * {@code (recentMean - priorMean) / (pooledStd · sqrt(2 / window))}.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangePointDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ChangePointDetector.class);

    public static final String METHOD = "change_point";

    @Override
    public Optional<AlertDraft> evaluate(DetectionInput input) {
        Objects.requireNonNull(input, "DetectionInput must not be null");

        int window = input.getRuleConfig().getChangePointWindow();
        double threshold = input.getRuleConfig().getChangePointZ();
        List<Double> values = input.getSeries().values();

        if (values.size() < 2 * window) {
            return Optional.empty();
        }
        List<Double> recent = values.subList(values.size() - window, values.size());
        List<Double> prior = values.subList(values.size() - 2 * window, values.size() - window);

        double recentMean = Stats.mean(recent);
        double priorMean = Stats.mean(prior);
        double pooledVar = ((recent.size() - 1) * Stats.sampleVariance(recent)
                + (prior.size() - 1) * Stats.sampleVariance(prior))
                / (recent.size() + prior.size() - 2);
        double pooledStd = pooledVar > 0 ? Math.sqrt(pooledVar) : 0.0;
        if (pooledStd <= Stats.EPSILON) {
            return Optional.empty();
        }

        double cpZ = (recentMean - priorMean) / (pooledStd * Math.sqrt(2.0 / recent.size()));
        if (Math.abs(cpZ) < threshold) {
            return Optional.empty();
        }
        LOG.debug("[{}] {} fired: priorMean={} recentMean={} pooledStd={} z={}",
                METHOD, input.getMetricName(), priorMean, recentMean, pooledStd, cpZ);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("previous_mean", priorMean);
        stats.put("recent_mean", recentMean);
        stats.put("pooled_std", pooledStd);
        stats.put("change_point_z", cpZ);
        stats.put("window", window);

        String message = AlertDrafts.format("%s change-point on %s: prev_mean=%.4g, recent_mean=%.4g",
                input.getMetricName(), input.getTargetDate(), priorMean, recentMean);
        return Optional.of(AlertDrafts.fired(input, METHOD, cpZ, input.getBaselineMean(), message, stats));
    }

    @Override
    public String getMethod() {
        return METHOD;
    }
}
