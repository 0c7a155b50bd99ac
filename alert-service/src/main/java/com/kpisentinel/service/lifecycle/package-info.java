/**
 * Acknowledge and resolve operations with role checks.
 */
package com.kpisentinel.service.lifecycle;
