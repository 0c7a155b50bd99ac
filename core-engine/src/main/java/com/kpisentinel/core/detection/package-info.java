/**
 * Daily statistical anomaly detection.
 *
 * <p>
 * All detectors implement
 * {@link com.kpisentinel.core.detection.AnomalyDetector}, are created by
 * {@link com.kpisentinel.core.detection.DetectorFactory} and run side by side
 * by {@link com.kpisentinel.core.detection.DetectionEngine} on one shared
 * {@link com.kpisentinel.core.detection.DetectionInput}:
 * </p>
 * <ul>
 * <li>{@link com.kpisentinel.core.detection.ZScoreDetector} - rolling z-score
 * against the trailing week</li>
 * <li>{@link com.kpisentinel.core.detection.EwmaDetector} - EWMA control
 * chart</li>
 * <li>{@link com.kpisentinel.core.detection.ChangePointDetector} - two-window
 * level shift</li>
 * <li>{@link com.kpisentinel.core.detection.SeasonalDetector} - same-weekday
 * deviation</li>
 * <li>{@link com.kpisentinel.core.detection.RegimeShiftDetector} - mean or
 * variance regime change</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.kpisentinel.core.detection;
