/**
 * Risk translation: per-metric impact profiles and the risk score that
 * combines impact, confidence and persistence.
 *
 * @since 1.0.0
 */
package com.kpisentinel.core.risk;
