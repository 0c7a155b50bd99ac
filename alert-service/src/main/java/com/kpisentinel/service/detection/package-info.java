/**
 * The daily detection run over every tracked metric.
 */
package com.kpisentinel.service.detection;
