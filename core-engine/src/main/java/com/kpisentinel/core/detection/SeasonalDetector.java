package com.kpisentinel.core.detection;

import com.kpisentinel.core.model.AlertDraft;
import com.kpisentinel.core.model.MetricPoint;
import com.kpisentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Weekday-seasonal detector.
 *
 * <p>
 * Compares the observation with up to the last {@value #MAX_SEASONAL_POINTS}
 * earlier values that fall on the same weekday as the target day.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalDetector.class);

    public static final String METHOD = "seasonal_decomposition";

    static final int MAX_SEASONAL_POINTS = 4;

    @Override
    public Optional<AlertDraft> evaluate(DetectionInput input) {
        Objects.requireNonNull(input, "DetectionInput must not be null");

        int minPoints = input.getRuleConfig().getSeasonalMinPoints();
        double threshold = input.getRuleConfig().getSeasonalZ();

        List<Double> sameWeekday = sameWeekdayHistory(input);
        if (sameWeekday.size() < minPoints) {
            return Optional.empty();
        }

        double seasonalMean = Stats.mean(sameWeekday);
        double seasonalStd = Stats.sampleStdDev(sameWeekday);
        if (seasonalStd <= Stats.EPSILON) {
            return Optional.empty();
        }

        double seasonalZ = (input.getObserved() - seasonalMean) / seasonalStd;
        if (Math.abs(seasonalZ) < threshold) {
            return Optional.empty();
        }
        LOG.debug("[{}] {} fired: seasonalMean={} seasonalStd={} z={}",
                METHOD, input.getMetricName(), seasonalMean, seasonalStd, seasonalZ);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("seasonal_mean", seasonalMean);
        stats.put("seasonal_std", seasonalStd);
        stats.put("seasonal_z", seasonalZ);
        stats.put("seasonal_points", sameWeekday.size());

        String message = AlertDrafts.format("%s seasonal deviation on %s: observed=%.4g, seasonal_mean=%.4g",
                input.getMetricName(), input.getTargetDate(), input.getObserved(), seasonalMean);
        return Optional.of(AlertDrafts.fired(input, METHOD, seasonalZ, seasonalMean, message, stats));
    }

    @Override
    public String getMethod() {
        return METHOD;
    }

    private static List<Double> sameWeekdayHistory(DetectionInput input) {
        DayOfWeek weekday = input.getTargetDate().getDayOfWeek();
        List<Double> matches = input.getSeries().getPoints().stream()
                .filter(p -> p.getDate().isBefore(input.getTargetDate()))
                .filter(p -> p.getDate().getDayOfWeek() == weekday)
                .map(MetricPoint::getValue)
                .toList();
        return matches.subList(Math.max(0, matches.size() - MAX_SEASONAL_POINTS), matches.size());
    }
}
