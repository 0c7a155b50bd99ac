/**
 * KPI Sentinel service: jobs, HTTP API and their wiring.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.kpisentinel.service.SentinelApplication} - main entry
 * point</li>
 * <li>{@link com.kpisentinel.service.ServiceConfig} - environment-driven
 * configuration</li>
 * <li>{@link com.kpisentinel.service.ServiceContext} - database handle, stores
 * and clock passed to every job</li>
 * <li>{@link com.kpisentinel.service.SentinelMetrics} - Micrometer
 * meters</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.kpisentinel.service;
