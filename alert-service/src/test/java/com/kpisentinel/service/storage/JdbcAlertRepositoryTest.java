package com.kpisentinel.service.storage;

import com.kpisentinel.core.model.Alert;
import com.kpisentinel.core.model.AlertDraft;
import com.kpisentinel.core.model.AlertStatus;
import com.kpisentinel.core.model.Severity;
import com.kpisentinel.service.ServiceContext;
import com.kpisentinel.service.TestDatabase;
import com.kpisentinel.service.notify.NotificationStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JdbcAlertRepository} against H2.
 */
class JdbcAlertRepositoryTest {

    private ServiceContext context;
    private JdbcAlertRepository alerts;

    @BeforeEach
    void setUp() {
        context = TestDatabase.newContext();
        alerts = context.getAlertRepository();
    }

    @AfterEach
    void tearDown() {
        context.close();
    }

    @Test
    @DisplayName("Should store a draft as an OPEN alert and read it back")
    void shouldInsertAndFind() {
        AlertDraft draft = AlertDraft.builder()
                .metricName("tx_fail_rate")
                .metricDate(LocalDate.of(2024, 3, 13))
                .severity(Severity.CRITICAL)
                .ruleVersion("v2")
                .riskScore(18.5)
                .message("tx_fail_rate anomalous")
                .method("regime_shift")
                .context("var_ratio", Double.POSITIVE_INFINITY)
                .context("mean_shift", true)
                .build();

        Alert inserted = alerts.insert(draft);
        Alert found = alerts.findById(inserted.getAlertId()).orElseThrow();

        assertThat(inserted.getAlertId()).isPositive();
        assertThat(inserted.getStatus()).isEqualTo(AlertStatus.OPEN);
        assertThat(found.getCreatedAt()).isEqualTo(TestDatabase.NOW);
        assertThat(found.getMetricName()).isEqualTo("tx_fail_rate");
        assertThat(found.getMetricDate()).isEqualTo(LocalDate.of(2024, 3, 13));
        assertThat(found.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(found.getRuleVersion()).isEqualTo("v2");
        assertThat(found.getRiskScore()).isEqualTo(18.5);
        assertThat(found.getStatus()).isEqualTo(AlertStatus.OPEN);
        assertThat(found.getMethod()).isEqualTo("regime_shift");
        assertThat(found.getContext()).containsEntry("mean_shift", true);
        assertThat(found.getAckedBy()).isNull();
        assertThat(found.getResolvedAt()).isNull();
    }

    @Test
    @DisplayName("Should report a missing alert as empty")
    void shouldReturnEmptyForUnknownId() {
        assertThat(alerts.findById(4242)).isEmpty();
        assertThat(alerts.acknowledge(4242, "ana")).isEmpty();
        assertThat(alerts.resolve(4242, "ana")).isEmpty();
    }

    @Test
    @DisplayName("Should list the newest alerts first up to the limit")
    void shouldListRecent() {
        Alert first = TestDatabase.insertAlert(context, "dau", Severity.WARN);
        Alert second = TestDatabase.insertAlert(context, "tx_completed", Severity.WARN);
        Alert third = TestDatabase.insertAlert(context, "latency_p95_ms", Severity.CRITICAL);

        assertThat(alerts.listRecent(2)).extracting(Alert::getAlertId)
                .containsExactly(third.getAlertId(), second.getAlertId());
        assertThat(alerts.listRecent(10)).hasSize(3).last().isEqualTo(first);
    }

    @Test
    @DisplayName("Undelivered alerts should exclude those already sent to the same target")
    void shouldFindUndelivered() {
        Alert sent = TestDatabase.insertAlert(context, "dau", Severity.WARN);
        Alert failed = TestDatabase.insertAlert(context, "tx_completed", Severity.WARN);
        Alert fresh = TestDatabase.insertAlert(context, "tx_fail_rate", Severity.CRITICAL);
        JdbcNotificationRepository notifications = context.getNotificationRepository();
        notifications.record(sent.getAlertId(), "webhook", "https://a", NotificationStatus.SENT, Map.of(), null);
        notifications.record(failed.getAlertId(), "webhook", "https://a", NotificationStatus.FAILED, Map.of(), "500");

        List<Alert> pendingA = alerts.findUndelivered("webhook", "https://a", 10);
        List<Alert> pendingB = alerts.findUndelivered("webhook", "https://b", 10);

        assertThat(pendingA).containsExactly(failed, fresh);
        assertThat(pendingB).containsExactly(sent, failed, fresh);
        assertThat(alerts.findUndelivered("webhook", "https://b", 1)).containsExactly(sent);
    }
}
