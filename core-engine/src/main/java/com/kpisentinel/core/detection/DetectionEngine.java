package com.kpisentinel.core.detection;

import com.kpisentinel.core.model.AlertDraft;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs every configured detector against the same {@link DetectionInput}.
 *
 * <p>
 * All detectors are evaluated; each may contribute one draft. Drafts raised
 * by different methods for the same metric and day are all kept. A detector
 * that throws aborts the evaluation so the caller can roll back the run.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionEngine.class);

    private final List<AnomalyDetector> detectors;

    /**
     * @param detectors detectors to run, in order; must not be {@code null} or
     *                  empty
     * @throws IllegalArgumentException if {@code detectors} is empty
     */
    public DetectionEngine(List<AnomalyDetector> detectors) {
        Objects.requireNonNull(detectors, "Detector list must not be null");
        if (detectors.isEmpty()) {
            throw new IllegalArgumentException("Detector list must not be empty");
        }
        this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
    }

    /**
     * @return an engine running every built-in detector
     */
    public static DetectionEngine withDefaultDetectors() {
        return new DetectionEngine(DetectorFactory.createAll());
    }

    /**
     * @param input the shared input for one metric and day
     * @return drafts from every method that fired, in detector order
     */
    public List<AlertDraft> evaluate(DetectionInput input) {
        Objects.requireNonNull(input, "DetectionInput must not be null");

        List<AlertDraft> drafts = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            Optional<AlertDraft> draft = detector.evaluate(input);
            draft.ifPresent(d -> {
                LOG.info("Detector fired: method={} metric={} date={} severity={} risk={}",
                        detector.getMethod(), d.getMetricName(), d.getMetricDate(),
                        d.getSeverity(), d.getRiskScore());
                drafts.add(d);
            });
        }
        return drafts;
    }

    public List<AnomalyDetector> getDetectors() {
        return detectors;
    }
}
