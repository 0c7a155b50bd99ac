package com.kpisentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Versioned set of detection thresholds, loaded once per detection run and
 * shared by every metric and method in that run.
 *
 * <p>
 * {@link #defaults()} returns the built-in {@value #DEFAULT_VERSION}
 * configuration used whenever no stored configuration can be read.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_VERSION = "v1";

    private static final RuleConfig DEFAULTS = builder().build();

    private final String ruleVersion;

    // --- EWMA control chart ---
    private final double ewmaLambda;
    private final double ewmaLimit;

    // --- Two-window change point ---
    private final int changePointWindow;
    private final double changePointZ;

    // --- Weekday seasonal ---
    private final int seasonalMinPoints;
    private final double seasonalZ;

    // --- Regime shift ---
    private final int regimeRecentDays;
    private final int regimeBaselineDays;
    private final double regimeZ;
    private final double regimeVarRatio;

    private RuleConfig(Builder b) {
        this.ruleVersion = b.ruleVersion;
        this.ewmaLambda = b.ewmaLambda;
        this.ewmaLimit = b.ewmaLimit;
        this.changePointWindow = b.changePointWindow;
        this.changePointZ = b.changePointZ;
        this.seasonalMinPoints = b.seasonalMinPoints;
        this.seasonalZ = b.seasonalZ;
        this.regimeRecentDays = b.regimeRecentDays;
        this.regimeBaselineDays = b.regimeBaselineDays;
        this.regimeZ = b.regimeZ;
        this.regimeVarRatio = b.regimeVarRatio;
    }

    /**
     * @return the built-in {@value #DEFAULT_VERSION} configuration
     */
    public static RuleConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a configuration from a stored version and a loosely typed
     * threshold map. Keys absent from the map keep their built-in default.
     *
     * @param ruleVersion stored version label; must not be {@code null}
     * @param values      snake_case threshold keys, e.g. {@code ewma_lambda};
     *                    may be {@code null}
     * @return validated configuration
     * @throws IllegalArgumentException if a value is not numeric or out of range
     */
    public static RuleConfig fromMap(String ruleVersion, Map<String, ?> values) {
        Map<String, ?> v = values != null ? values : Map.of();
        return builder()
                .ruleVersion(ruleVersion)
                .ewmaLambda(doubleValue(v, "ewma_lambda", DEFAULTS.ewmaLambda))
                .ewmaLimit(doubleValue(v, "ewma_limit", DEFAULTS.ewmaLimit))
                .changePointWindow(intValue(v, "change_point_window", DEFAULTS.changePointWindow))
                .changePointZ(doubleValue(v, "change_point_z", DEFAULTS.changePointZ))
                .seasonalMinPoints(intValue(v, "seasonal_min_points", DEFAULTS.seasonalMinPoints))
                .seasonalZ(doubleValue(v, "seasonal_z", DEFAULTS.seasonalZ))
                .regimeRecentDays(intValue(v, "regime_recent_days", DEFAULTS.regimeRecentDays))
                .regimeBaselineDays(intValue(v, "regime_baseline_days", DEFAULTS.regimeBaselineDays))
                .regimeZ(doubleValue(v, "regime_z", DEFAULTS.regimeZ))
                .regimeVarRatio(doubleValue(v, "regime_var_ratio", DEFAULTS.regimeVarRatio))
                .build();
    }

    /**
     * Like {@link #fromMap(String, Map)}, but a non-numeric or out-of-range
     * value falls back to its default instead of failing the whole map.
     *
     * @param rejected receives one message per defaulted key
     * @throws IllegalArgumentException if {@code ruleVersion} is blank
     */
    public static RuleConfig fromMapDefaultingInvalid(String ruleVersion, Map<String, ?> values,
                                                      Consumer<String> rejected) {
        Map<String, Object> accepted = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, value) -> {
                if (value == null) {
                    return;
                }
                try {
                    fromMap(DEFAULT_VERSION, Map.of(key, value));
                    accepted.put(key, value);
                } catch (IllegalArgumentException e) {
                    rejected.accept(e.getMessage());
                }
            });
        }
        return fromMap(ruleVersion, accepted);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getRuleVersion() {
        return ruleVersion;
    }

    public double getEwmaLambda() {
        return ewmaLambda;
    }

    public double getEwmaLimit() {
        return ewmaLimit;
    }

    public int getChangePointWindow() {
        return changePointWindow;
    }

    public double getChangePointZ() {
        return changePointZ;
    }

    public int getSeasonalMinPoints() {
        return seasonalMinPoints;
    }

    public double getSeasonalZ() {
        return seasonalZ;
    }

    public int getRegimeRecentDays() {
        return regimeRecentDays;
    }

    public int getRegimeBaselineDays() {
        return regimeBaselineDays;
    }

    public double getRegimeZ() {
        return regimeZ;
    }

    public double getRegimeVarRatio() {
        return regimeVarRatio;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link RuleConfig}, pre-populated with the
     * built-in defaults.
     *
     * <p>
     * {@link #build()} validates every threshold and reports all problems in a
     * single {@link IllegalArgumentException}.
     * </p>
     */
    public static class Builder {
        private String ruleVersion = DEFAULT_VERSION;
        private double ewmaLambda = 0.3;
        private double ewmaLimit = 3.0;
        private int changePointWindow = 7;
        private double changePointZ = 3.0;
        private int seasonalMinPoints = 3;
        private double seasonalZ = 3.0;
        private int regimeRecentDays = 7;
        private int regimeBaselineDays = 14;
        private double regimeZ = 3.0;
        private double regimeVarRatio = 2.0;

        public Builder ruleVersion(String v) {
            this.ruleVersion = v;
            return this;
        }

        public Builder ewmaLambda(double v) {
            this.ewmaLambda = v;
            return this;
        }

        public Builder ewmaLimit(double v) {
            this.ewmaLimit = v;
            return this;
        }

        public Builder changePointWindow(int v) {
            this.changePointWindow = v;
            return this;
        }

        public Builder changePointZ(double v) {
            this.changePointZ = v;
            return this;
        }

        public Builder seasonalMinPoints(int v) {
            this.seasonalMinPoints = v;
            return this;
        }

        public Builder seasonalZ(double v) {
            this.seasonalZ = v;
            return this;
        }

        public Builder regimeRecentDays(int v) {
            this.regimeRecentDays = v;
            return this;
        }

        public Builder regimeBaselineDays(int v) {
            this.regimeBaselineDays = v;
            return this;
        }

        public Builder regimeZ(double v) {
            this.regimeZ = v;
            return this;
        }

        public Builder regimeVarRatio(double v) {
            this.regimeVarRatio = v;
            return this;
        }

        /**
         * @return a validated configuration
         * @throws IllegalArgumentException if any threshold is out of range
         */
        public RuleConfig build() {
            List<String> errors = new ArrayList<>();
            if (ruleVersion == null || ruleVersion.isBlank()) {
                errors.add("'rule_version' is required");
            }
            if (!(ewmaLambda > 0 && ewmaLambda <= 1)) {
                errors.add("'ewma_lambda' must be in (0, 1], got: " + ewmaLambda);
            }
            if (!(ewmaLimit > 0)) {
                errors.add("'ewma_limit' must be > 0, got: " + ewmaLimit);
            }
            if (changePointWindow < 2) {
                errors.add("'change_point_window' must be >= 2, got: " + changePointWindow);
            }
            if (!(changePointZ > 0)) {
                errors.add("'change_point_z' must be > 0, got: " + changePointZ);
            }
            if (seasonalMinPoints < 2) {
                errors.add("'seasonal_min_points' must be >= 2, got: " + seasonalMinPoints);
            }
            if (!(seasonalZ > 0)) {
                errors.add("'seasonal_z' must be > 0, got: " + seasonalZ);
            }
            if (regimeRecentDays < 2) {
                errors.add("'regime_recent_days' must be >= 2, got: " + regimeRecentDays);
            }
            if (regimeBaselineDays < 2) {
                errors.add("'regime_baseline_days' must be >= 2, got: " + regimeBaselineDays);
            }
            if (!(regimeZ > 0)) {
                errors.add("'regime_z' must be > 0, got: " + regimeZ);
            }
            if (!(regimeVarRatio > 1)) {
                errors.add("'regime_var_ratio' must be > 1, got: " + regimeVarRatio);
            }

            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid RuleConfig: " + String.join("; ", errors));
            }
            return new RuleConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static double doubleValue(Map<String, ?> values, String key, double defaultValue) {
        Object raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' is not numeric: " + raw, e);
        }
    }

    private static int intValue(Map<String, ?> values, String key, int defaultValue) {
        Object raw = values.get(key);
        if (raw == null) {
            return defaultValue;
        }
        if (raw instanceof Number n) {
            return n.intValue();
        }
        try {
            return (int) Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' is not numeric: " + raw, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RuleConfig that))
            return false;
        return Double.compare(ewmaLambda, that.ewmaLambda) == 0
                && Double.compare(ewmaLimit, that.ewmaLimit) == 0
                && changePointWindow == that.changePointWindow
                && Double.compare(changePointZ, that.changePointZ) == 0
                && seasonalMinPoints == that.seasonalMinPoints
                && Double.compare(seasonalZ, that.seasonalZ) == 0
                && regimeRecentDays == that.regimeRecentDays
                && regimeBaselineDays == that.regimeBaselineDays
                && Double.compare(regimeZ, that.regimeZ) == 0
                && Double.compare(regimeVarRatio, that.regimeVarRatio) == 0
                && Objects.equals(ruleVersion, that.ruleVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleVersion, ewmaLambda, ewmaLimit, changePointWindow, changePointZ,
                seasonalMinPoints, seasonalZ, regimeRecentDays, regimeBaselineDays, regimeZ,
                regimeVarRatio);
    }

    @Override
    public String toString() {
        return "RuleConfig{" +
                "ruleVersion='" + ruleVersion + '\'' +
                ", ewmaLambda=" + ewmaLambda +
                ", ewmaLimit=" + ewmaLimit +
                ", changePointWindow=" + changePointWindow +
                ", changePointZ=" + changePointZ +
                ", seasonalMinPoints=" + seasonalMinPoints +
                ", seasonalZ=" + seasonalZ +
                ", regimeRecentDays=" + regimeRecentDays +
                ", regimeBaselineDays=" + regimeBaselineDays +
                ", regimeZ=" + regimeZ +
                ", regimeVarRatio=" + regimeVarRatio +
                '}';
    }
}
