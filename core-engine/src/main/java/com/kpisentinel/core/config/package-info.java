/**
 * Detection configuration.
 *
 * <p>
 * Thresholds live in a versioned {@link com.kpisentinel.core.config.RuleConfig}
 * supplied by a {@link com.kpisentinel.core.config.RuleConfigProvider}. The set
 * of tracked metrics and their impact profiles is declared in YAML and loaded
 * by {@link com.kpisentinel.core.config.MetricCatalogLoader}; validation runs
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.kpisentinel.core.config;
