package com.kpisentinel.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpisentinel.core.model.Alert;
import com.kpisentinel.core.model.AlertDraft;
import com.kpisentinel.core.model.AlertStatus;
import com.kpisentinel.core.model.Severity;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Persistence of {@link Alert}s in the {@code alerts} table.
 *
 * <p>
 * Lifecycle updates are single conditional statements: acknowledging never
 * moves a resolved alert back, and the {@code acked_*} / {@code resolved_*}
 * fields keep their first value.
 * </p>
 */
public class JdbcAlertRepository {

    private static final String SELECT_ALERT = """
            select alert_id, created_at, metric_name, metric_date, severity, rule_version, risk_score,
                   message, context, status, acked_by, acked_at, resolved_by, resolved_at
            from alerts
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final RowMapper<Alert> rowMapper = this::mapAlert;

    public JdbcAlertRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Persist a detector output as a new {@code OPEN} alert.
     *
     * @return the stored alert with its generated id
     */
    public Alert insert(AlertDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        Instant now = clock.instant();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("created_at", toOffset(now), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("metric_name", draft.getMetricName())
                .addValue("metric_date", draft.getMetricDate(), Types.DATE)
                .addValue("severity", draft.getSeverity().name())
                .addValue("rule_version", draft.getRuleVersion())
                .addValue("risk_score", draft.getRiskScore())
                .addValue("message", draft.getMessage())
                .addValue("context", JsonSupport.write(mapper, draft.getContext()))
                .addValue("status", AlertStatus.OPEN.name());

        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(
                """
                insert into alerts (created_at, metric_name, metric_date, severity, rule_version,
                                    risk_score, message, context, status)
                values (:created_at, :metric_name, :metric_date, :severity, :rule_version,
                        :risk_score, :message, :context, :status)
                """,
                params, keys, new String[] {"alert_id"});

        Number id = Objects.requireNonNull(keys.getKey(), "no alert_id generated");
        return Alert.builder()
                .fromDraft(draft)
                .alertId(id.longValue())
                .createdAt(now)
                .status(AlertStatus.OPEN)
                .build();
    }

    public Optional<Alert> findById(long alertId) {
        return jdbc.query(SELECT_ALERT + " where alert_id = :alert_id", Map.of("alert_id", alertId), rowMapper)
                .stream()
                .findFirst();
    }

    /**
     * @return the newest alerts first, at most {@code limit}
     */
    public List<Alert> listRecent(int limit) {
        return jdbc.query(
                SELECT_ALERT + " order by created_at desc, alert_id desc limit :limit",
                Map.of("limit", limit),
                rowMapper);
    }

    /**
     * Alerts with no {@code sent} notification row for the channel and
     * target, oldest first.
     */
    public List<Alert> findUndelivered(String channel, String target, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("channel", channel)
                .addValue("target", target)
                .addValue("sent", "sent")
                .addValue("limit", limit);
        return jdbc.query(
                """
                select a.alert_id, a.created_at, a.metric_name, a.metric_date, a.severity, a.rule_version,
                       a.risk_score, a.message, a.context, a.status, a.acked_by, a.acked_at,
                       a.resolved_by, a.resolved_at
                from alerts a
                left join alert_notifications n
                  on n.alert_id = a.alert_id
                 and n.channel = :channel
                 and n.target = :target
                 and n.status = :sent
                where n.notification_id is null
                order by a.created_at asc, a.alert_id asc
                limit :limit
                """,
                params,
                rowMapper);
    }

    /**
     * Move an {@code OPEN} alert to {@code ACK}. Already acknowledged or
     * resolved alerts keep their status and acknowledgement fields.
     *
     * @return the alert after the update, or empty when it does not exist
     */
    public Optional<Alert> acknowledge(long alertId, String actor) {
        MapSqlParameterSource params = lifecycleParams(alertId, actor);
        int updated = jdbc.update(
                """
                update alerts
                set status = case when status = 'OPEN' then 'ACK' else status end,
                    acked_by = coalesce(acked_by, :actor),
                    acked_at = coalesce(acked_at, :now)
                where alert_id = :alert_id
                """,
                params);
        return updated == 0 ? Optional.empty() : findById(alertId);
    }

    /**
     * Move an alert to {@code RESOLVED}, backfilling the acknowledgement
     * fields when the alert was never acknowledged.
     *
     * @return the alert after the update, or empty when it does not exist
     */
    public Optional<Alert> resolve(long alertId, String actor) {
        MapSqlParameterSource params = lifecycleParams(alertId, actor);
        int updated = jdbc.update(
                """
                update alerts
                set status = 'RESOLVED',
                    resolved_by = coalesce(resolved_by, :actor),
                    resolved_at = coalesce(resolved_at, :now),
                    acked_by = coalesce(acked_by, :actor),
                    acked_at = coalesce(acked_at, :now)
                where alert_id = :alert_id
                """,
                params);
        return updated == 0 ? Optional.empty() : findById(alertId);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private MapSqlParameterSource lifecycleParams(long alertId, String actor) {
        return new MapSqlParameterSource()
                .addValue("alert_id", alertId)
                .addValue("actor", actor, Types.VARCHAR)
                .addValue("now", toOffset(clock.instant()), Types.TIMESTAMP_WITH_TIMEZONE);
    }

    private Alert mapAlert(ResultSet rs, int rowNum) throws SQLException {
        return Alert.builder()
                .alertId(rs.getLong("alert_id"))
                .createdAt(instant(rs, "created_at"))
                .metricName(rs.getString("metric_name"))
                .metricDate(rs.getObject("metric_date", LocalDate.class))
                .severity(Severity.valueOf(rs.getString("severity").trim().toUpperCase(Locale.ROOT)))
                .ruleVersion(rs.getString("rule_version"))
                .riskScore(rs.getDouble("risk_score"))
                .message(rs.getString("message"))
                .context(JsonSupport.readObject(mapper, rs.getString("context")))
                .status(AlertStatus.parse(rs.getString("status")))
                .ackedBy(rs.getString("acked_by"))
                .ackedAt(instant(rs, "acked_at"))
                .resolvedBy(rs.getString("resolved_by"))
                .resolvedAt(instant(rs, "resolved_at"))
                .build();
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }

    static OffsetDateTime toOffset(Instant instant) {
        return instant != null ? OffsetDateTime.ofInstant(instant, ZoneOffset.UTC) : null;
    }
}
