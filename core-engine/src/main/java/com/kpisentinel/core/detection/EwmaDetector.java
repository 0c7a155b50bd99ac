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
 * EWMA control-chart detector.
 *
 * <p>
 * Seeds the moving average with the first baseline value, folds the
 * remaining baseline values and finally the observation into it with
 * smoothing factor {@code λ}, then compares the result with the baseline
 * mean in units of {@code σ·sqrt(λ / (2 - λ))}. Fires when that ratio
 * reaches {@code ewma_limit}.
 * </p>
 *
 * <p>
 * Needs at least two baseline points and a baseline spread above
 * {@link Stats#EPSILON}.
 * </p>
 *
 * @since 1.0.0
 */
public class EwmaDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(EwmaDetector.class);

    public static final String METHOD = "ewma";

    @Override
    public Optional<AlertDraft> evaluate(DetectionInput input) {
        Objects.requireNonNull(input, "DetectionInput must not be null");

        List<Double> baseline = input.getBaseline();
        double stdDev = input.getBaselineStdDev();
        if (baseline.size() < 2 || stdDev <= Stats.EPSILON) {
            return Optional.empty();
        }

        double lambda = input.getRuleConfig().getEwmaLambda();
        double limit = input.getRuleConfig().getEwmaLimit();

        double ewma = baseline.get(0);
        for (int i = 1; i < baseline.size(); i++) {
            ewma = lambda * baseline.get(i) + (1 - lambda) * ewma;
        }
        ewma = lambda * input.getObserved() + (1 - lambda) * ewma;

        double sigma = stdDev * Math.sqrt(lambda / (2 - lambda));
        if (sigma <= 0) {
            return Optional.empty();
        }
        double mean = input.getBaselineMean();
        double ewmaZ = (ewma - mean) / sigma;

        if (Math.abs(ewmaZ) < limit) {
            return Optional.empty();
        }
        LOG.debug("[{}] {} fired: ewma={} mean={} sigma={} z={}",
                METHOD, input.getMetricName(), ewma, mean, sigma, ewmaZ);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("ewma", ewma);
        stats.put("baseline_mean", mean);
        stats.put("baseline_std", stdDev);
        stats.put("ewma_lambda", lambda);
        stats.put("ewma_sigma", sigma);
        stats.put("ewma_z", ewmaZ);

        String message = AlertDrafts.format("%s EWMA signal on %s: observed=%.4g, ewma=%.4g, z=%.2f",
                input.getMetricName(), input.getTargetDate(), input.getObserved(), ewma, ewmaZ);
        return Optional.of(AlertDrafts.fired(input, METHOD, ewmaZ, mean, message, stats));
    }

    @Override
    public String getMethod() {
        return METHOD;
    }
}
