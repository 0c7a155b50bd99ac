package com.kpisentinel.core.model;

/**
 * Alert severity band derived from the magnitude of a test statistic.
 *
 * @since 1.0.0
 */
public enum Severity {

    INFO,
    WARN,
    CRITICAL;

    /** {@code |z|} at or above which an alert is {@link #CRITICAL}. */
    public static final double CRITICAL_Z = 4.0;

    /** {@code |z|} at or above which an alert is {@link #WARN}. */
    public static final double WARN_Z = 3.0;

    /**
     * Map a z-like statistic to its severity band.
     *
     * @param z test statistic (sign is ignored)
     * @return {@code CRITICAL} for {@code |z| >= 4}, {@code WARN} for
     *         {@code |z| >= 3}, {@code INFO} otherwise
     */
    public static Severity fromZ(double z) {
        double abs = Math.abs(z);
        if (abs >= CRITICAL_Z) {
            return CRITICAL;
        }
        if (abs >= WARN_Z) {
            return WARN;
        }
        return INFO;
    }
}
