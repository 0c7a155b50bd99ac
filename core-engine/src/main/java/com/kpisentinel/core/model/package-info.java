/**
 * Domain model classes for KPI Sentinel.
 *
 * <p>
 * This package contains the value types shared between the detection engine
 * and the alert service:
 * </p>
 * <ul>
 * <li>{@link com.kpisentinel.core.model.MetricSeries} - daily history of one
 * metric</li>
 * <li>{@link com.kpisentinel.core.model.AlertDraft} - detector output awaiting
 * persistence</li>
 * <li>{@link com.kpisentinel.core.model.Alert} - persisted alert with its
 * lifecycle fields</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.kpisentinel.core.model;
