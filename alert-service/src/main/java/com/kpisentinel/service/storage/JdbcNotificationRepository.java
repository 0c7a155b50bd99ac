package com.kpisentinel.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpisentinel.service.notify.NotificationRecord;
import com.kpisentinel.service.notify.NotificationStatus;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Delivery bookkeeping in {@code alert_notifications}, one row per
 * {@code (alert_id, channel, target)}.
 */
public class JdbcNotificationRepository {

    private static final String COLUMNS = """
            n.notification_id, n.alert_id, n.channel, n.target, n.status, n.payload, n.last_error,
            n.sent_at, n.created_at, n.updated_at
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JdbcNotificationRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Record the outcome of a delivery attempt, overwriting the previous
     * outcome for the same alert, channel and target.
     *
     * @param error failure description; ignored for {@link NotificationStatus#SENT}
     */
    public void record(long alertId, String channel, String target, NotificationStatus status,
            Map<String, Object> payload, String error) {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(status, "status must not be null");
        boolean sent = status == NotificationStatus.SENT;
        Instant now = clock.instant();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("alert_id", alertId)
                .addValue("channel", channel)
                .addValue("target", target)
                .addValue("status", status.value())
                .addValue("payload", JsonSupport.write(mapper, payload != null ? payload : Map.of()))
                .addValue("last_error", sent ? null : error, Types.VARCHAR)
                .addValue("sent_at", sent ? JdbcAlertRepository.toOffset(now) : null, Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("now", JdbcAlertRepository.toOffset(now), Types.TIMESTAMP_WITH_TIMEZONE);

        int updated = jdbc.update(
                """
                update alert_notifications
                set status = :status, payload = :payload, last_error = :last_error,
                    sent_at = :sent_at, updated_at = :now
                where alert_id = :alert_id and channel = :channel and target = :target
                """,
                params);
        if (updated == 0) {
            jdbc.update(
                    """
                    insert into alert_notifications (alert_id, channel, target, status, payload, last_error,
                                                     sent_at, created_at, updated_at)
                    values (:alert_id, :channel, :target, :status, :payload, :last_error,
                            :sent_at, :now, :now)
                    """,
                    params);
        }
    }

    public Optional<NotificationRecord> find(long alertId, String channel, String target) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("alert_id", alertId)
                .addValue("channel", channel)
                .addValue("target", target);
        return jdbc.query(
                "select " + COLUMNS + " from alert_notifications n"
                        + " where n.alert_id = :alert_id and n.channel = :channel and n.target = :target",
                params,
                (rs, rowNum) -> mapRecord(rs, false))
                .stream()
                .findFirst();
    }

    public List<NotificationRecord> findByAlert(long alertId) {
        return jdbc.query(
                "select " + COLUMNS + " from alert_notifications n"
                        + " where n.alert_id = :alert_id order by n.notification_id",
                Map.of("alert_id", alertId),
                (rs, rowNum) -> mapRecord(rs, false));
    }

    /**
     * @return the newest notification rows first, joined with the alert's
     *         metric name and severity
     */
    public List<NotificationRecord> listRecent(int limit) {
        return jdbc.query(
                "select " + COLUMNS + ", a.metric_name, a.severity"
                        + " from alert_notifications n join alerts a on a.alert_id = n.alert_id"
                        + " order by n.created_at desc, n.notification_id desc limit :limit",
                Map.of("limit", limit),
                (rs, rowNum) -> mapRecord(rs, true));
    }

    private NotificationRecord mapRecord(ResultSet rs, boolean joined) throws SQLException {
        NotificationRecord.Builder builder = NotificationRecord.builder()
                .notificationId(rs.getLong("notification_id"))
                .alertId(rs.getLong("alert_id"))
                .channel(rs.getString("channel"))
                .target(rs.getString("target"))
                .status(NotificationStatus.parse(rs.getString("status")))
                .payload(JsonSupport.readObject(mapper, rs.getString("payload")))
                .lastError(rs.getString("last_error"))
                .sentAt(JdbcAlertRepository.instant(rs, "sent_at"))
                .createdAt(JdbcAlertRepository.instant(rs, "created_at"))
                .updatedAt(JdbcAlertRepository.instant(rs, "updated_at"));
        if (joined) {
            builder.metricName(rs.getString("metric_name"))
                    .severity(rs.getString("severity"));
        }
        return builder.build();
    }
}
