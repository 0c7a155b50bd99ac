package com.kpisentinel.core.detection;

import com.kpisentinel.core.model.AlertDraft;

import java.util.Optional;

/**
 * Contract for all daily anomaly detectors.
 * <p>
 * Implementations are <strong>stateless</strong>: everything they need
 * arrives in the {@link DetectionInput}, so one instance serves every metric
 * and day. Detectors are independent of each other; none suppresses another.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate one metric on one day.
     *
     * @param input the shared detection input
     * @return a draft alert if the method fires, empty otherwise
     */
    Optional<AlertDraft> evaluate(DetectionInput input);

    /**
     * Return the method name recorded in {@code context.method}.
     *
     * @return method name
     */
    String getMethod();
}
