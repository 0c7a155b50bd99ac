package com.kpisentinel.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ServiceConfig}.
 */
class ServiceConfigTest {

    @Test
    @DisplayName("Should apply defaults when only the database URL is set")
    void shouldApplyDefaults() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of("DATABASE_URL", "jdbc:postgresql://db/kpi"));

        assertThat(config.getDatabaseUrl()).isEqualTo("jdbc:postgresql://db/kpi");
        assertThat(config.getDatabasePoolSize()).isEqualTo(5);
        assertThat(config.getApiPort()).isEqualTo(8080);
        assertThat(config.getLookbackDays()).isEqualTo(30);
        assertThat(config.getNotifyBatchLimit()).isEqualTo(50);
        assertThat(config.getEmailFrom()).isEqualTo("alerts@kpi-sentinel.local");
        assertThat(config.getSmtpHost()).isEqualTo("localhost");
        assertThat(config.getSmtpPort()).isEqualTo(25);
        assertThat(config.isSmtpUseTls()).isFalse();
        assertThat(config.getWebhookTimeoutMs()).isEqualTo(5000);
        assertThat(config.getSmtpTimeoutMs()).isEqualTo(5000);
        assertThat(config.isEmailEnabled()).isFalse();
        assertThat(config.isWebhookEnabled()).isFalse();
        assertThat(config.hasSmtpCredentials()).isFalse();
    }

    @Test
    @DisplayName("Should split comma-separated recipients and webhook URLs")
    void shouldSplitLists() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of(
                "DATABASE_URL", "jdbc:postgresql://db/kpi",
                "ALERT_EMAIL_TO", " ops@example.com, ,cfo@example.com ",
                "ALERT_WEBHOOK_URLS", "https://hooks.example.com/a,https://hooks.example.com/b",
                "SMTP_USE_TLS", "true",
                "SMTP_USERNAME", "mailer",
                "SMTP_PASSWORD", "secret"));

        assertThat(config.getEmailRecipients()).containsExactly("ops@example.com", "cfo@example.com");
        assertThat(config.getWebhookUrls()).hasSize(2);
        assertThat(config.isEmailEnabled()).isTrue();
        assertThat(config.isWebhookEnabled()).isTrue();
        assertThat(config.isSmtpUseTls()).isTrue();
        assertThat(config.hasSmtpCredentials()).isTrue();
    }

    @Test
    @DisplayName("SMTP and webhook timeouts should be configured independently")
    void shouldReadSmtpTimeoutSeparately() {
        ServiceConfig config = ServiceConfig.fromEnvironment(Map.of(
                "DATABASE_URL", "jdbc:postgresql://db/kpi",
                "SMTP_TIMEOUT_MS", "15000",
                "WEBHOOK_TIMEOUT_MS", "2000"));

        assertThat(config.getSmtpTimeoutMs()).isEqualTo(15000);
        assertThat(config.getWebhookTimeoutMs()).isEqualTo(2000);
        assertThatThrownBy(() -> TestDatabase.config().smtpTimeoutMs(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("smtpTimeoutMs");
    }

    @Test
    @DisplayName("Should require a database URL")
    void shouldRequireDatabaseUrl() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DATABASE_URL");
    }

    @Test
    @DisplayName("Should fail fast on an unparseable number")
    void shouldRejectUnparseableNumber() {
        assertThatThrownBy(() -> ServiceConfig.fromEnvironment(Map.of(
                "DATABASE_URL", "jdbc:postgresql://db/kpi",
                "NOTIFY_BATCH_LIMIT", "lots")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> TestDatabase.config().notifyBatchLimit(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("notifyBatchLimit");
        assertThatThrownBy(() -> TestDatabase.config().lookbackDays(3).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lookbackDays");
        assertThatThrownBy(() -> TestDatabase.config().apiPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("apiPort");
    }

    @Test
    @DisplayName("Should not print credentials")
    void toStringShouldHideSecrets() {
        ServiceConfig config = TestDatabase.config().smtpPassword("hunter2").databasePassword("pg-secret").build();

        assertThat(config.toString()).doesNotContain("hunter2").doesNotContain("pg-secret");
    }
}
