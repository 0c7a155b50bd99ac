package com.kpisentinel.core.risk;

import java.util.Locale;

/**
 * Translates a metric's deviation from its reference mean into business
 * impact.
 *
 * <p>
 * Every profile is non-negative and grows with the deviation in the
 * direction that hurts: rates and latencies hurt when they rise, volumes
 * and activity hurt when they fall.
 * </p>
 *
 * @since 1.0.0
 */
public enum ImpactProfile {

    /** Failure-style ratios; each percentage point above reference counts 1. */
    RATE_INCREASE {
        @Override
        public double impact(double observed, double referenceMean) {
            return Math.max(0.0, observed - referenceMean) * 100.0;
        }
    },

    /** Latencies in milliseconds; every 100 ms above reference counts 1. */
    LATENCY_INCREASE {
        @Override
        public double impact(double observed, double referenceMean) {
            return Math.max(0.0, observed - referenceMean) / 100.0;
        }
    },

    /** Transaction volumes; relative drop scaled by 10. */
    VOLUME_DROP {
        @Override
        public double impact(double observed, double referenceMean) {
            return relativeDrop(observed, referenceMean) * 10.0;
        }
    },

    /** User activity counts; relative drop scaled by 5. */
    ACTIVITY_DROP {
        @Override
        public double impact(double observed, double referenceMean) {
            return relativeDrop(observed, referenceMean) * 5.0;
        }
    };

    /**
     * @param observed      value on the target day
     * @param referenceMean mean of the window the method compares against
     * @return impact, always {@code >= 0}
     */
    public abstract double impact(double observed, double referenceMean);

    /**
     * Parse a catalog value such as {@code rate_increase} or
     * {@code RATE-INCREASE}.
     *
     * @param value profile name
     * @return the profile
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ImpactProfile parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Impact profile must not be blank");
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalised);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown impact profile: '" + value
                    + "'. Supported: rate_increase, latency_increase, volume_drop, activity_drop", e);
        }
    }

    private static double relativeDrop(double observed, double referenceMean) {
        return Math.max(0.0, (referenceMean - observed) / Math.max(1.0, referenceMean));
    }
}
