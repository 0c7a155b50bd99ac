package com.kpisentinel.core.config;

import com.kpisentinel.core.risk.ImpactProfile;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A metric the detection run evaluates, as declared in the metric catalog.
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that the name is present and the impact profile is known.
 * </p>
 *
 * @since 1.0.0
 */
public class TrackedMetric implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Metric name as stored in the daily series table. */
    private String name;

    /**
     * Impact profile name, e.g. {@code rate_increase}; defaults to
     * {@code activity_drop}.
     */
    private String impact = "activity_drop";

    public TrackedMetric() {
    }

    public TrackedMetric(String name, String impact) {
        this.name = name;
        this.impact = impact;
    }

    /**
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("Metric 'name' is required");
        }
        try {
            ImpactProfile.parse(impact);
        } catch (IllegalArgumentException e) {
            errors.add("Metric '" + name + "': " + e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid TrackedMetric: " + String.join("; ", errors));
        }
    }

    /**
     * @return the parsed impact profile
     * @throws IllegalArgumentException if the profile name is unknown
     */
    public ImpactProfile resolveImpactProfile() {
        return ImpactProfile.parse(impact);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getImpact() {
        return impact;
    }

    public void setImpact(String impact) {
        this.impact = impact;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TrackedMetric that))
            return false;
        return Objects.equals(name, that.name) && Objects.equals(impact, that.impact);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, impact);
    }

    @Override
    public String toString() {
        return "TrackedMetric{name='" + name + "', impact='" + impact + "'}";
    }
}
