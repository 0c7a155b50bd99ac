package com.kpisentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kpisentinel.service.storage.JdbcAlertRepository;
import com.kpisentinel.service.storage.JdbcAuditLog;
import com.kpisentinel.service.storage.JdbcMetricSeriesRepository;
import com.kpisentinel.service.storage.JdbcNotificationRepository;
import com.kpisentinel.service.storage.JdbcRuleConfigProvider;
import com.kpisentinel.service.storage.JsonSupport;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.Objects;

/**
 * Everything a job or the API needs: configuration, the database handle,
 * the stores, the clock and the meter registry.
 *
 * <p>
 * Built once at start-up and passed explicitly. Closing the context closes
 * the connection pool when the context created it.
 * </p>
 */
public class ServiceContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceContext.class);

    private final ServiceConfig config;
    private final DataSource dataSource;
    private final boolean ownsDataSource;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final SentinelMetrics metrics;
    private final TransactionTemplate transactions;
    private final JdbcMetricSeriesRepository seriesRepository;
    private final JdbcRuleConfigProvider ruleConfigProvider;
    private final JdbcAlertRepository alertRepository;
    private final JdbcNotificationRepository notificationRepository;
    private final JdbcAuditLog auditLog;

    /**
     * @param config     service configuration
     * @param dataSource database handle; not closed by {@link #close()}
     * @param clock      source of every persisted timestamp
     * @param metrics    job and delivery meters
     */
    public ServiceContext(ServiceConfig config, DataSource dataSource, Clock clock, SentinelMetrics metrics) {
        this(config, dataSource, false, clock, metrics);
    }

    private ServiceContext(ServiceConfig config, DataSource dataSource, boolean ownsDataSource,
            Clock clock, SentinelMetrics metrics) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.ownsDataSource = ownsDataSource;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.objectMapper = JsonSupport.newObjectMapper();
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));

        NamedParameterJdbcTemplate jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.seriesRepository = new JdbcMetricSeriesRepository(jdbc);
        this.ruleConfigProvider = new JdbcRuleConfigProvider(jdbc, objectMapper);
        this.alertRepository = new JdbcAlertRepository(jdbc, objectMapper, clock);
        this.notificationRepository = new JdbcNotificationRepository(jdbc, objectMapper, clock);
        this.auditLog = new JdbcAuditLog(jdbc, objectMapper, clock);
    }

    /**
     * Open a pooled connection to {@link ServiceConfig#getDatabaseUrl()}.
     *
     * @param config service configuration
     * @return a context that owns its connection pool
     */
    public static ServiceContext open(ServiceConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.getDatabaseUrl());
        if (config.getDatabaseUser() != null) {
            hikari.setUsername(config.getDatabaseUser());
        }
        if (config.getDatabasePassword() != null) {
            hikari.setPassword(config.getDatabasePassword());
        }
        hikari.setMaximumPoolSize(config.getDatabasePoolSize());
        hikari.setPoolName("kpi-sentinel");
        LOG.info("Opening database pool (size={})", config.getDatabasePoolSize());
        return new ServiceContext(config, new HikariDataSource(hikari), true,
                Clock.systemUTC(), new SentinelMetrics());
    }

    public ServiceConfig getConfig() {
        return config;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public Clock getClock() {
        return clock;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public SentinelMetrics getMetrics() {
        return metrics;
    }

    public TransactionTemplate getTransactions() {
        return transactions;
    }

    public JdbcMetricSeriesRepository getSeriesRepository() {
        return seriesRepository;
    }

    public JdbcRuleConfigProvider getRuleConfigProvider() {
        return ruleConfigProvider;
    }

    public JdbcAlertRepository getAlertRepository() {
        return alertRepository;
    }

    public JdbcNotificationRepository getNotificationRepository() {
        return notificationRepository;
    }

    public JdbcAuditLog getAuditLog() {
        return auditLog;
    }

    @Override
    public void close() {
        if (ownsDataSource && dataSource instanceof HikariDataSource hikari) {
            hikari.close();
            LOG.info("Database pool closed");
        }
    }
}
