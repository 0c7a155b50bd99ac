package com.kpisentinel.service;

import com.kpisentinel.core.config.MetricCatalog;
import com.kpisentinel.core.config.MetricCatalogLoader;
import com.kpisentinel.core.detection.DetectionEngine;
import com.kpisentinel.service.api.AlertApiServer;
import com.kpisentinel.service.detection.DetectionJob;
import com.kpisentinel.service.detection.DetectionSummary;
import com.kpisentinel.service.lifecycle.AlertLifecycleService;
import com.kpisentinel.service.notify.DispatchJob;
import com.kpisentinel.service.storage.SchemaInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point of KPI Sentinel.
 *
 * <pre>
 * SentinelApplication detect [yyyy-MM-dd]   evaluate one day (default: yesterday, UTC)
 * SentinelApplication dispatch              deliver pending alerts on every enabled channel
 * SentinelApplication serve                 run the HTTP API until shutdown
 * </pre>
 *
 * <p>
 * Configuration comes from environment variables, see {@link ServiceConfig}.
 * The schema is applied on every start.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelApplication {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelApplication.class);

    private static final String USAGE = "usage: SentinelApplication <detect [yyyy-MM-dd] | dispatch | serve>";

    private SentinelApplication() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            System.err.println(USAGE);
            System.exit(2);
        }
        String command = args[0].toLowerCase(Locale.ROOT);
        LocalDate targetDate = null;
        if ("detect".equals(command) && args.length > 1) {
            targetDate = parseDate(args[1]);
        }

        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("KPI Sentinel starting: command={} config={}", command, config);

        try (ServiceContext context = ServiceContext.open(config)) {
            SchemaInitializer.apply(context.getDataSource());
            switch (command) {
                case "detect" -> detect(context, targetDate);
                case "dispatch" -> dispatch(context);
                case "serve" -> serve(context);
                default -> {
                    System.err.println(USAGE);
                    System.exit(2);
                }
            }
        }
    }

    private static void detect(ServiceContext context, LocalDate targetDate) {
        MetricCatalog catalog = MetricCatalogLoader.load(context.getConfig().getMetricsCatalogPath());
        DetectionJob job = DetectionJob.from(context, catalog, DetectionEngine.withDefaultDetectors());
        DetectionSummary summary = targetDate != null ? job.runDetection(targetDate) : job.runDetection();
        LOG.info("Detection finished: {}", summary);
        LOG.info("Run metrics: {}", context.getMetrics().summary());
    }

    private static void dispatch(ServiceContext context) {
        DispatchJob.from(context).runDispatch();
        LOG.info("Run metrics: {}", context.getMetrics().summary());
    }

    private static void serve(ServiceContext context) throws InterruptedException {
        AlertApiServer server = new AlertApiServer(AlertLifecycleService.from(context),
                context.getObjectMapper(), context.getMetrics());
        server.start(context.getConfig().getApiPort());

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown requested");
            server.stop();
            shutdown.countDown();
        }, "api-shutdown"));
        shutdown.await();
    }

    private static LocalDate parseDate(String raw) {
        try {
            return LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Target date must be yyyy-MM-dd, got: " + raw, e);
        }
    }
}
