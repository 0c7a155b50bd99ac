package com.kpisentinel.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Types;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only record of operator actions in {@code audit_log}.
 */
public class JdbcAuditLog {

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JdbcAuditLog(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void record(String actor, String action, String entityType, String entityId, Map<String, Object> payload) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("ts", JdbcAlertRepository.toOffset(clock.instant()), Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("actor", actor)
                .addValue("action", action)
                .addValue("entity_type", entityType)
                .addValue("entity_id", entityId)
                .addValue("payload", JsonSupport.write(mapper, payload != null ? payload : Map.of()));
        jdbc.update(
                """
                insert into audit_log (ts, actor, action, entity_type, entity_id, payload)
                values (:ts, :actor, :action, :entity_type, :entity_id, :payload)
                """,
                params);
    }
}
