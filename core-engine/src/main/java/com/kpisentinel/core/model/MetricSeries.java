package com.kpisentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered daily history of a single metric.
 *
 * <p>
 * Points are kept ascending by date. When the same date appears more than
 * once the last value wins, so the series never contains duplicate dates.
 * Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final List<MetricPoint> points;
    private final Map<LocalDate, Double> byDate;

    /**
     * @param metricName metric name; must not be {@code null}
     * @param points     points in any order; must not be {@code null}
     */
    public MetricSeries(String metricName, List<MetricPoint> points) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(points, "points must not be null");

        Map<LocalDate, Double> values = new LinkedHashMap<>();
        points.stream()
                .sorted((a, b) -> a.getDate().compareTo(b.getDate()))
                .forEach(p -> values.put(p.getDate(), p.getValue()));

        List<MetricPoint> ordered = new ArrayList<>(values.size());
        values.forEach((date, value) -> ordered.add(new MetricPoint(date, value)));

        this.byDate = Collections.unmodifiableMap(values);
        this.points = Collections.unmodifiableList(ordered);
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return unmodifiable list of points, ascending by date
     */
    public List<MetricPoint> getPoints() {
        return points;
    }

    /**
     * @return the values in date order
     */
    public List<Double> values() {
        return points.stream().map(MetricPoint::getValue).toList();
    }

    /**
     * @return unmodifiable date-to-value view
     */
    public Map<LocalDate, Double> byDate() {
        return byDate;
    }

    /**
     * Look up the value observed on a date.
     *
     * @param date the day
     * @return the value, or empty if the day has no observation
     */
    public Optional<Double> valueOn(LocalDate date) {
        return Optional.ofNullable(byDate.get(date));
    }

    /**
     * Values dated within {@code [from, to]}, inclusive, in date order.
     *
     * @param from first day (inclusive)
     * @param to   last day (inclusive)
     * @return the matching values
     */
    public List<Double> valuesBetween(LocalDate from, LocalDate to) {
        return points.stream()
                .filter(p -> !p.getDate().isBefore(from) && !p.getDate().isAfter(to))
                .map(MetricPoint::getValue)
                .toList();
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    @Override
    public String toString() {
        return "MetricSeries{" +
                "metricName='" + metricName + '\'' +
                ", points=" + points.size() +
                '}';
    }
}
