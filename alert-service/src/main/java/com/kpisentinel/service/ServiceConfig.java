package com.kpisentinel.service;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration for the KPI Sentinel jobs and API.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults.
 * A channel whose destinations are not configured (no e-mail recipients, no
 * webhook URLs) is disabled without error.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Database
    // ---------------------------------------------------------------
    private final String databaseUrl;
    private final String databaseUser;
    private final String databasePassword;
    private final int databasePoolSize;

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------
    private final int lookbackDays;
    private final String metricsCatalogPath;

    // ---------------------------------------------------------------
    // Notifications
    // ---------------------------------------------------------------
    private final int notifyBatchLimit;
    private final List<String> emailRecipients;
    private final String emailFrom;
    private final String smtpHost;
    private final int smtpPort;
    private final String smtpUsername;
    private final String smtpPassword;
    private final boolean smtpUseTls;
    private final long smtpTimeoutMs;
    private final List<String> webhookUrls;
    private final long webhookTimeoutMs;

    // ---------------------------------------------------------------
    // API
    // ---------------------------------------------------------------
    private final int apiPort;

    private ServiceConfig(Builder b) {
        this.databaseUrl = b.databaseUrl;
        this.databaseUser = b.databaseUser;
        this.databasePassword = b.databasePassword;
        this.databasePoolSize = b.databasePoolSize;
        this.lookbackDays = b.lookbackDays;
        this.metricsCatalogPath = b.metricsCatalogPath;
        this.notifyBatchLimit = b.notifyBatchLimit;
        this.emailRecipients = Collections.unmodifiableList(b.emailRecipients);
        this.emailFrom = b.emailFrom;
        this.smtpHost = b.smtpHost;
        this.smtpPort = b.smtpPort;
        this.smtpUsername = b.smtpUsername;
        this.smtpPassword = b.smtpPassword;
        this.smtpUseTls = b.smtpUseTls;
        this.smtpTimeoutMs = b.smtpTimeoutMs;
        this.webhookUrls = Collections.unmodifiableList(b.webhookUrls);
        this.webhookTimeoutMs = b.webhookTimeoutMs;
        this.apiPort = b.apiPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link ServiceConfig} from an environment-style map.
     *
     * @param env variable names to values; must not be {@code null}
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .databaseUrl(env(env, "DATABASE_URL", null))
                    .databaseUser(env(env, "DATABASE_USER", null))
                    .databasePassword(env(env, "DATABASE_PASSWORD", null))
                    .databasePoolSize(Integer.parseInt(env(env, "DATABASE_POOL_SIZE", "5")))
                    .lookbackDays(Integer.parseInt(env(env, "LOOKBACK_DAYS", "30")))
                    .metricsCatalogPath(env(env, "METRICS_CATALOG_PATH", null))
                    .notifyBatchLimit(Integer.parseInt(env(env, "NOTIFY_BATCH_LIMIT", "50")))
                    .emailRecipients(splitList(env(env, "ALERT_EMAIL_TO", "")))
                    .emailFrom(env(env, "ALERT_EMAIL_FROM", "alerts@kpi-sentinel.local"))
                    .smtpHost(env(env, "SMTP_HOST", "localhost"))
                    .smtpPort(Integer.parseInt(env(env, "SMTP_PORT", "25")))
                    .smtpUsername(env(env, "SMTP_USERNAME", null))
                    .smtpPassword(env(env, "SMTP_PASSWORD", null))
                    .smtpUseTls(Boolean.parseBoolean(env(env, "SMTP_USE_TLS", "false")))
                    .smtpTimeoutMs(Long.parseLong(env(env, "SMTP_TIMEOUT_MS", "5000")))
                    .webhookUrls(splitList(env(env, "ALERT_WEBHOOK_URLS", "")))
                    .webhookTimeoutMs(Long.parseLong(env(env, "WEBHOOK_TIMEOUT_MS", "5000")))
                    .apiPort(Integer.parseInt(env(env, "API_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Split a comma-separated list, trimming entries and dropping blanks.
     *
     * @param raw list text, may be {@code null}
     * @return the entries, possibly empty
     */
    public static List<String> splitList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    // ---------------------------------------------------------------
    // Derived
    // ---------------------------------------------------------------

    public boolean isEmailEnabled() {
        return !emailRecipients.isEmpty();
    }

    public boolean isWebhookEnabled() {
        return !webhookUrls.isEmpty();
    }

    public boolean hasSmtpCredentials() {
        return smtpUsername != null && !smtpUsername.isBlank()
                && smtpPassword != null && !smtpPassword.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public String getDatabaseUser() {
        return databaseUser;
    }

    public String getDatabasePassword() {
        return databasePassword;
    }

    public int getDatabasePoolSize() {
        return databasePoolSize;
    }

    public int getLookbackDays() {
        return lookbackDays;
    }

    public String getMetricsCatalogPath() {
        return metricsCatalogPath;
    }

    public int getNotifyBatchLimit() {
        return notifyBatchLimit;
    }

    public List<String> getEmailRecipients() {
        return emailRecipients;
    }

    public String getEmailFrom() {
        return emailFrom;
    }

    public String getSmtpHost() {
        return smtpHost;
    }

    public int getSmtpPort() {
        return smtpPort;
    }

    public String getSmtpUsername() {
        return smtpUsername;
    }

    public String getSmtpPassword() {
        return smtpPassword;
    }

    public boolean isSmtpUseTls() {
        return smtpUseTls;
    }

    public long getSmtpTimeoutMs() {
        return smtpTimeoutMs;
    }

    public List<String> getWebhookUrls() {
        return webhookUrls;
    }

    public long getWebhookTimeoutMs() {
        return webhookTimeoutMs;
    }

    public int getApiPort() {
        return apiPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (non-blank database URL, pool size &gt; 0, lookback &gt;= 8 days,
     * batch limit &gt; 0, ports in range, timeout &gt; 0).
     * </p>
     */
    public static class Builder {
        private String databaseUrl;
        private String databaseUser;
        private String databasePassword;
        private int databasePoolSize = 5;
        private int lookbackDays = 30;
        private String metricsCatalogPath;
        private int notifyBatchLimit = 50;
        private List<String> emailRecipients = List.of();
        private String emailFrom = "alerts@kpi-sentinel.local";
        private String smtpHost = "localhost";
        private int smtpPort = 25;
        private String smtpUsername;
        private String smtpPassword;
        private boolean smtpUseTls;
        private long smtpTimeoutMs = 5_000;
        private List<String> webhookUrls = List.of();
        private long webhookTimeoutMs = 5_000;
        private int apiPort = 8080;

        public Builder databaseUrl(String v) {
            this.databaseUrl = v;
            return this;
        }

        public Builder databaseUser(String v) {
            this.databaseUser = v;
            return this;
        }

        public Builder databasePassword(String v) {
            this.databasePassword = v;
            return this;
        }

        public Builder databasePoolSize(int v) {
            this.databasePoolSize = v;
            return this;
        }

        public Builder lookbackDays(int v) {
            this.lookbackDays = v;
            return this;
        }

        public Builder metricsCatalogPath(String v) {
            this.metricsCatalogPath = v;
            return this;
        }

        public Builder notifyBatchLimit(int v) {
            this.notifyBatchLimit = v;
            return this;
        }

        public Builder emailRecipients(List<String> v) {
            this.emailRecipients = v != null ? List.copyOf(v) : List.of();
            return this;
        }

        public Builder emailFrom(String v) {
            this.emailFrom = v;
            return this;
        }

        public Builder smtpHost(String v) {
            this.smtpHost = v;
            return this;
        }

        public Builder smtpPort(int v) {
            this.smtpPort = v;
            return this;
        }

        public Builder smtpUsername(String v) {
            this.smtpUsername = v;
            return this;
        }

        public Builder smtpPassword(String v) {
            this.smtpPassword = v;
            return this;
        }

        public Builder smtpUseTls(boolean v) {
            this.smtpUseTls = v;
            return this;
        }

        public Builder smtpTimeoutMs(long v) {
            this.smtpTimeoutMs = v;
            return this;
        }

        public Builder webhookUrls(List<String> v) {
            this.webhookUrls = v != null ? List.copyOf(v) : List.of();
            return this;
        }

        public Builder webhookTimeoutMs(long v) {
            this.webhookTimeoutMs = v;
            return this;
        }

        public Builder apiPort(int v) {
            this.apiPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            requireNonBlank(databaseUrl, "databaseUrl (DATABASE_URL)");
            requireNonBlank(emailFrom, "emailFrom");
            requireNonBlank(smtpHost, "smtpHost");

            if (databasePoolSize < 1) {
                throw new IllegalArgumentException(
                        "databasePoolSize must be >= 1, got: " + databasePoolSize);
            }
            if (lookbackDays < 8) {
                throw new IllegalArgumentException(
                        "lookbackDays must be >= 8 to cover the baseline week, got: " + lookbackDays);
            }
            if (notifyBatchLimit < 1) {
                throw new IllegalArgumentException(
                        "notifyBatchLimit must be >= 1, got: " + notifyBatchLimit);
            }
            requirePort(smtpPort, "smtpPort", 1);
            requirePort(apiPort, "apiPort", 0);
            if (smtpTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "smtpTimeoutMs must be >= 1, got: " + smtpTimeoutMs);
            }
            if (webhookTimeoutMs < 1) {
                throw new IllegalArgumentException(
                        "webhookTimeoutMs must be >= 1, got: " + webhookTimeoutMs);
            }

            return new ServiceConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requirePort(int port, String name, int min) {
            if (port < min || port > 65_535) {
                throw new IllegalArgumentException(
                        name + " must be in [" + min + ", 65535], got: " + port);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", databasePoolSize=" + databasePoolSize +
                ", lookbackDays=" + lookbackDays +
                ", notifyBatchLimit=" + notifyBatchLimit +
                ", emailRecipients=" + emailRecipients.size() +
                ", smtpHost='" + smtpHost + '\'' +
                ", smtpPort=" + smtpPort +
                ", smtpUseTls=" + smtpUseTls +
                ", webhookUrls=" + webhookUrls.size() +
                ", apiPort=" + apiPort +
                '}';
    }
}
