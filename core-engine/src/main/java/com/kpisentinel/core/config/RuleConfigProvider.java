package com.kpisentinel.core.config;

/**
 * Source of the active {@link RuleConfig}.
 *
 * <p>
 * Implementations must never throw: when no configuration is stored or the
 * store cannot be read they return {@link RuleConfig#defaults()}.
 * </p>
 */
@FunctionalInterface
public interface RuleConfigProvider {

    /**
     * @return the active configuration, or the built-in defaults
     */
    RuleConfig loadConfig();
}
