package com.kpisentinel.service.detection;

import com.kpisentinel.core.config.MetricCatalog;
import com.kpisentinel.core.config.RuleConfig;
import com.kpisentinel.core.config.RuleConfigProvider;
import com.kpisentinel.core.detection.DetectionEngine;
import com.kpisentinel.core.detection.DetectionInput;
import com.kpisentinel.core.model.Alert;
import com.kpisentinel.core.model.AlertDraft;
import com.kpisentinel.core.model.MetricSeries;
import com.kpisentinel.service.SentinelMetrics;
import com.kpisentinel.service.ServiceContext;
import com.kpisentinel.service.storage.JdbcAlertRepository;
import com.kpisentinel.service.storage.JdbcMetricSeriesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates every tracked metric for one day and persists the resulting
 * alerts.
 *
 * <h3>Transactions</h3>
 * <p>
 * The rule configuration is read first, outside the run's transaction.
 * Series loading, detection and alert inserts then share one transaction:
 * any failure rolls back every alert of the run and propagates to the
 * caller.
 * </p>
 *
 * <h3>Re-runs</h3>
 * <p>
 * Running the same day twice inserts a second set of alerts; runs are not
 * deduplicated.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionJob {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionJob.class);

    private final MetricCatalog catalog;
    private final DetectionEngine engine;
    private final RuleConfigProvider ruleConfigProvider;
    private final JdbcMetricSeriesRepository seriesRepository;
    private final JdbcAlertRepository alertRepository;
    private final TransactionTemplate transactions;
    private final SentinelMetrics metrics;
    private final Clock clock;
    private final int lookbackDays;

    public DetectionJob(MetricCatalog catalog, DetectionEngine engine, RuleConfigProvider ruleConfigProvider,
            JdbcMetricSeriesRepository seriesRepository, JdbcAlertRepository alertRepository,
            TransactionTemplate transactions, SentinelMetrics metrics, Clock clock, int lookbackDays) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.ruleConfigProvider = Objects.requireNonNull(ruleConfigProvider, "ruleConfigProvider must not be null");
        this.seriesRepository = Objects.requireNonNull(seriesRepository, "seriesRepository must not be null");
        this.alertRepository = Objects.requireNonNull(alertRepository, "alertRepository must not be null");
        this.transactions = Objects.requireNonNull(transactions, "transactions must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.lookbackDays = lookbackDays;
    }

    public static DetectionJob from(ServiceContext context, MetricCatalog catalog, DetectionEngine engine) {
        return new DetectionJob(catalog, engine, context.getRuleConfigProvider(), context.getSeriesRepository(),
                context.getAlertRepository(), context.getTransactions(), context.getMetrics(), context.getClock(),
                context.getConfig().getLookbackDays());
    }

    /**
     * Evaluate yesterday, in the clock's zone.
     */
    public DetectionSummary runDetection() {
        return runDetection(LocalDate.now(clock).minusDays(1));
    }

    /**
     * Evaluate every tracked metric on {@code targetDate}.
     *
     * @param targetDate day to evaluate
     * @return the committed run's summary
     * @throws org.springframework.dao.DataAccessException if reading series or storing alerts fails;
     *                                                     nothing of the run is committed
     */
    public DetectionSummary runDetection(LocalDate targetDate) {
        Objects.requireNonNull(targetDate, "targetDate must not be null");
        long started = System.nanoTime();
        RuleConfig ruleConfig = ruleConfigProvider.loadConfig();
        LOG.info("Detection started for {} ({} metric(s), rules {})",
                targetDate, catalog.metricNames().size(), ruleConfig.getRuleVersion());

        DetectionSummary summary = transactions.execute(status -> evaluateAll(targetDate, ruleConfig));
        metrics.recordDetectionRun(Duration.ofNanos(System.nanoTime() - started));
        metrics.addMetricsSkipped(summary.getMetricsSkipped());
        summary.getAlerts().forEach(alert -> metrics.incrementAlertsCreated(alert.getMethod()));

        LOG.info("Detection complete for {}: {} evaluated, {} skipped, {} alert(s) created",
                targetDate, summary.getMetricsEvaluated(), summary.getMetricsSkipped(), summary.getAlerts().size());
        return summary;
    }

    private DetectionSummary evaluateAll(LocalDate targetDate, RuleConfig ruleConfig) {
        List<Alert> created = new ArrayList<>();
        int evaluated = 0;
        int skipped = 0;
        for (String metricName : catalog.metricNames()) {
            MetricSeries series = seriesRepository.loadSeries(metricName, targetDate, lookbackDays);
            Optional<DetectionInput> input = DetectionInput.prepare(series, targetDate, ruleConfig,
                    catalog.profileFor(metricName));
            if (input.isEmpty()) {
                skipped++;
                continue;
            }
            evaluated++;
            for (AlertDraft draft : engine.evaluate(input.get())) {
                created.add(alertRepository.insert(draft));
            }
        }
        return new DetectionSummary(targetDate, ruleConfig.getRuleVersion(), evaluated, skipped, created);
    }
}
