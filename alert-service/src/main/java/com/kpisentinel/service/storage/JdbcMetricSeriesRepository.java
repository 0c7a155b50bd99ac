package com.kpisentinel.service.storage;

import com.kpisentinel.core.model.MetricPoint;
import com.kpisentinel.core.model.MetricSeries;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Reads daily KPI values from {@code metrics_daily}.
 */
public class JdbcMetricSeriesRepository {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcMetricSeriesRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
    }

    /**
     * Load the non-null values of one metric dated within
     * {@code [asOf - lookbackDays, asOf]}, ascending by date.
     *
     * @param metricName   metric to load
     * @param asOf         last day of the window, inclusive
     * @param lookbackDays size of the window before {@code asOf}
     * @return the series, possibly empty
     */
    public MetricSeries loadSeries(String metricName, LocalDate asOf, int lookbackDays) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        if (lookbackDays < 0) {
            throw new IllegalArgumentException("lookbackDays must be >= 0, got: " + lookbackDays);
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("metric_name", metricName)
                .addValue("from_date", asOf.minusDays(lookbackDays))
                .addValue("to_date", asOf);

        List<MetricPoint> points = jdbc.query(
                """
                select metric_date, value
                from metrics_daily
                where metric_name = :metric_name
                  and value is not null
                  and metric_date between :from_date and :to_date
                order by metric_date asc
                """,
                params,
                (rs, rowNum) -> new MetricPoint(rs.getObject("metric_date", LocalDate.class), rs.getDouble("value")));
        return new MetricSeries(metricName, points);
    }
}
