package com.kpisentinel.core.detection;

import com.kpisentinel.core.config.RuleConfig;
import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.risk.ImpactProfile;
import com.kpisentinel.core.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a detector needs to evaluate one metric on one day.
 *
 * <p>
 * Built once per metric and date by {@link #prepare}; every detector in the
 * run receives the same instance. The baseline is the trailing week
 * {@code [targetDate - 7, targetDate - 1]}, excluding the target day.
 * </p>
 *
 * <h3>Skip rules</h3>
 * <p>
 * A metric is not evaluated for a day when the series holds fewer than
 * {@value #MIN_HISTORY_POINTS} points, the target day has no observation, or
 * the baseline holds fewer than {@value #MIN_BASELINE_POINTS} points.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionInput {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionInput.class);

    static final int MIN_HISTORY_POINTS = 6;
    static final int MIN_BASELINE_POINTS = 5;
    static final int BASELINE_DAYS = 7;

    /** Previous-day {@code |z|} above which the deviation counts as persisting. */
    static final double PERSISTENCE_Z = 2.0;
    static final double PERSISTENT = 1.3;
    static final double NOT_PERSISTENT = 1.0;

    private final String metricName;
    private final LocalDate targetDate;
    private final double observed;
    private final MetricSeries series;
    private final List<Double> baseline;
    private final double baselineMean;
    private final double baselineStdDev;
    private final double persistence;
    private final RuleConfig ruleConfig;
    private final ImpactProfile impactProfile;

    private DetectionInput(MetricSeries series, LocalDate targetDate, double observed,
            List<Double> baseline, RuleConfig ruleConfig, ImpactProfile impactProfile) {
        this.metricName = series.getMetricName();
        this.targetDate = targetDate;
        this.observed = observed;
        this.series = series;
        this.baseline = List.copyOf(baseline);
        this.baselineMean = Stats.mean(baseline);
        this.baselineStdDev = Stats.sampleStdDev(baseline);
        this.persistence = persistenceFactor(series, targetDate, baselineMean, baselineStdDev);
        this.ruleConfig = ruleConfig;
        this.impactProfile = impactProfile;
    }

    /**
     * Derive the detection input for a metric and day.
     *
     * @param series        lookback history, including the target day
     * @param targetDate    the day being evaluated
     * @param ruleConfig    thresholds of the current run
     * @param impactProfile how deviations of this metric translate into impact
     * @return the input, or empty when the metric must be skipped for this day
     */
    public static Optional<DetectionInput> prepare(MetricSeries series, LocalDate targetDate,
            RuleConfig ruleConfig, ImpactProfile impactProfile) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(targetDate, "targetDate must not be null");
        Objects.requireNonNull(ruleConfig, "ruleConfig must not be null");
        Objects.requireNonNull(impactProfile, "impactProfile must not be null");

        String metric = series.getMetricName();
        if (series.size() < MIN_HISTORY_POINTS) {
            LOG.debug("Skipping [{}] on {}: {} history point(s) < {}",
                    metric, targetDate, series.size(), MIN_HISTORY_POINTS);
            return Optional.empty();
        }

        Optional<Double> observed = series.valueOn(targetDate);
        if (observed.isEmpty()) {
            LOG.debug("Skipping [{}] on {}: no observation for the target day", metric, targetDate);
            return Optional.empty();
        }

        List<Double> baseline = baselineWindow(series, targetDate);
        if (baseline.size() < MIN_BASELINE_POINTS) {
            LOG.debug("Skipping [{}] on {}: {} baseline point(s) < {}",
                    metric, targetDate, baseline.size(), MIN_BASELINE_POINTS);
            return Optional.empty();
        }

        return Optional.of(new DetectionInput(series, targetDate, observed.get(), baseline,
                ruleConfig, impactProfile));
    }

    /**
     * @return values dated within {@code [targetDate - 7, targetDate - 1]}
     */
    static List<Double> baselineWindow(MetricSeries series, LocalDate targetDate) {
        return series.valuesBetween(targetDate.minusDays(BASELINE_DAYS), targetDate.minusDays(1));
    }

    /**
     * Reward alerts that continue an existing deviation: {@code 1.3} when the
     * previous day was observed and its {@code |z|} against the same baseline
     * exceeds 2, else {@code 1.0}.
     */
    static double persistenceFactor(MetricSeries series, LocalDate targetDate,
            double baselineMean, double baselineStdDev) {
        Optional<Double> previous = series.valueOn(targetDate.minusDays(1));
        if (previous.isEmpty()) {
            return NOT_PERSISTENT;
        }
        double previousZ = Stats.zScore(previous.get(), baselineMean, baselineStdDev);
        return Math.abs(previousZ) > PERSISTENCE_Z ? PERSISTENT : NOT_PERSISTENT;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getMetricName() {
        return metricName;
    }

    public LocalDate getTargetDate() {
        return targetDate;
    }

    public double getObserved() {
        return observed;
    }

    public MetricSeries getSeries() {
        return series;
    }

    /**
     * @return unmodifiable trailing-week values, in date order
     */
    public List<Double> getBaseline() {
        return baseline;
    }

    public double getBaselineMean() {
        return baselineMean;
    }

    public double getBaselineStdDev() {
        return baselineStdDev;
    }

    public double getPersistence() {
        return persistence;
    }

    public RuleConfig getRuleConfig() {
        return ruleConfig;
    }

    public ImpactProfile getImpactProfile() {
        return impactProfile;
    }

    @Override
    public String toString() {
        return "DetectionInput{" +
                "metricName='" + metricName + '\'' +
                ", targetDate=" + targetDate +
                ", observed=" + observed +
                ", baselineMean=" + baselineMean +
                ", baselineStdDev=" + baselineStdDev +
                ", persistence=" + persistence +
                '}';
    }
}
