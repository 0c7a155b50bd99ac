package com.kpisentinel.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpisentinel.core.config.RuleConfig;
import com.kpisentinel.core.config.RuleConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads detection thresholds from the {@code anomaly_rules} row named
 * {@value #RULE_NAME}, preferring the most recently updated one.
 *
 * <p>
 * Never fails: a missing table, a missing row or malformed JSON fall back to
 * {@link RuleConfig#defaults()}. Keys absent from the stored document, or
 * holding an invalid value, take their default values under the stored
 * version.
 * </p>
 */
public class JdbcRuleConfigProvider implements RuleConfigProvider {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcRuleConfigProvider.class);

    public static final String RULE_NAME = "anomaly_rules";

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public JdbcRuleConfigProvider(NamedParameterJdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public RuleConfig loadConfig() {
        try {
            List<RuleConfig> rows = jdbc.query(
                    """
                    select rule_version, config
                    from anomaly_rules
                    where rule_name = :rule_name
                    order by updated_at desc
                    limit 1
                    """,
                    Map.of("rule_name", RULE_NAME),
                    (rs, rowNum) -> {
                        String version = rs.getString("rule_version");
                        Map<String, Object> values = JsonSupport.readObject(mapper, rs.getString("config"));
                        return RuleConfig.fromMapDefaultingInvalid(version, values,
                                problem -> LOG.warn("Rule configuration {}: {}; using the default", version, problem));
                    });
            if (rows.isEmpty()) {
                LOG.info("No stored rule configuration '{}'; using built-in defaults {}",
                        RULE_NAME, RuleConfig.DEFAULT_VERSION);
                return RuleConfig.defaults();
            }
            RuleConfig config = rows.get(0);
            LOG.info("Loaded rule configuration {}", config.getRuleVersion());
            return config;
        } catch (RuntimeException e) {
            LOG.warn("Rule configuration unavailable, using built-in defaults {}: {}",
                    RuleConfig.DEFAULT_VERSION, e.getMessage());
            return RuleConfig.defaults();
        }
    }

    /**
     * Store a rule configuration, replacing any existing one.
     *
     * @param ruleVersion version label recorded on alerts
     * @param values      snake_case threshold keys to values
     */
    public void save(String ruleVersion, Map<String, ?> values) {
        Objects.requireNonNull(ruleVersion, "ruleVersion must not be null");
        // throws IllegalArgumentException on invalid values
        RuleConfig.fromMap(ruleVersion, values);
        Map<String, Object> params = Map.of(
                "rule_name", RULE_NAME,
                "rule_version", ruleVersion,
                "config", JsonSupport.write(mapper, values));
        int updated = jdbc.update(
                """
                update anomaly_rules
                set rule_version = :rule_version, config = :config, updated_at = current_timestamp
                where rule_name = :rule_name
                """,
                params);
        if (updated == 0) {
            jdbc.update(
                    """
                    insert into anomaly_rules (rule_name, rule_version, config, updated_at)
                    values (:rule_name, :rule_version, :config, current_timestamp)
                    """,
                    params);
        }
    }
}
