package com.kpisentinel.core.stats;

import java.util.List;
import java.util.Objects;

/**
 * Closed-form descriptive statistics over small value windows.
 *
 * <p>
 * Variance and standard deviation use the sample ({@code n - 1})
 * denominator; windows with fewer than two values have zero spread.
 * </p>
 *
 * @since 1.0.0
 */
public final class Stats {

    /** Standard deviations at or below this are treated as zero. */
    public static final double EPSILON = 1e-9;

    private Stats() {
        // utility class
    }

    /**
     * @param values the window; must not be {@code null} or empty
     * @return arithmetic mean
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double mean(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute the mean of an empty window");
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * @param values the window
     * @return sample variance, or {@code 0} for fewer than two values
     */
    public static double sampleVariance(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return sumSquaredDiff / (values.size() - 1);
    }

    /**
     * @param values the window
     * @return sample standard deviation, or {@code 0} for fewer than two values
     */
    public static double sampleStdDev(List<Double> values) {
        return Math.sqrt(sampleVariance(values));
    }

    /**
     * Standard score guarded against near-zero spread.
     *
     * @param value  observation
     * @param mean   reference mean
     * @param stdDev reference standard deviation
     * @return {@code (value - mean) / stdDev}, or {@code 0} when
     *         {@code stdDev <= }{@value #EPSILON}
     */
    public static double zScore(double value, double mean, double stdDev) {
        if (stdDev <= EPSILON) {
            return 0.0;
        }
        return (value - mean) / stdDev;
    }
}
