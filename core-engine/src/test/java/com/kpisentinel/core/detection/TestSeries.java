package com.kpisentinel.core.detection;

import com.kpisentinel.core.config.RuleConfig;
import com.kpisentinel.core.model.MetricPoint;
import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.core.risk.ImpactProfile;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds daily series and detection inputs for detector tests.
 */
final class TestSeries {

    /** A Wednesday. */
    static final LocalDate TARGET = LocalDate.of(2024, 3, 13);

    private TestSeries() {
    }

    /**
     * Consecutive daily values; the last value lands on {@link #TARGET}.
     */
    static MetricSeries endingOnTarget(String metric, double... values) {
        List<MetricPoint> points = new ArrayList<>();
        LocalDate first = TARGET.minusDays(values.length - 1L);
        for (int i = 0; i < values.length; i++) {
            points.add(new MetricPoint(first.plusDays(i), values[i]));
        }
        return new MetricSeries(metric, points);
    }

    static DetectionInput input(double... values) {
        return input(RuleConfig.defaults(), values);
    }

    static DetectionInput input(RuleConfig config, double... values) {
        return DetectionInput.prepare(endingOnTarget("dau", values), TARGET, config, ImpactProfile.ACTIVITY_DROP)
                .orElseThrow(() -> new AssertionError("series was skipped"));
    }

    static double[] concat(double[] head, double... tail) {
        double[] all = new double[head.length + tail.length];
        System.arraycopy(head, 0, all, 0, head.length);
        System.arraycopy(tail, 0, all, head.length, tail.length);
        return all;
    }

    /**
     * {@code count} values alternating {@code low, high, low, ...}.
     */
    static double[] alternating(int count, double low, double high) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = i % 2 == 0 ? low : high;
        }
        return values;
    }
}
