package com.kpisentinel.core.risk;

/**
 * Turns a deviation into a unitless prioritisation score.
 *
 * <p>
 * {@code risk = max(0, impact) * max(0, confidence) * max(0, persistence)}.
 * The score is floored at zero, unbounded above and non-decreasing in each
 * factor while the others are held fixed.
 * </p>
 *
 * @since 1.0.0
 */
public final class RiskScorer {

    /** Statistic magnitude at which confidence saturates at 1. */
    static final double FULL_CONFIDENCE_Z = 5.0;

    private RiskScorer() {
        // utility class
    }

    public static double score(double impact, double confidence, double persistence) {
        return Math.max(0.0, impact) * Math.max(0.0, confidence) * Math.max(0.0, persistence);
    }

    /**
     * @param statistic z-like test statistic (sign is ignored)
     * @return {@code min(1, |statistic| / 5)}
     */
    public static double confidenceFromZ(double statistic) {
        return Math.min(1.0, Math.abs(statistic) / FULL_CONFIDENCE_Z);
    }
}
