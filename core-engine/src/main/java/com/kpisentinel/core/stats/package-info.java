/**
 * Small descriptive-statistics helpers shared by the detectors.
 */
package com.kpisentinel.core.stats;
