package com.kpisentinel.service.notify;

import com.kpisentinel.service.ServiceContext;
import com.kpisentinel.service.TestDatabase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the channel wiring of {@link DispatchJob}.
 */
class DispatchJobTest {

    @Test
    @DisplayName("Should wire no channel when nothing is configured")
    void shouldWireNoChannels() {
        try (ServiceContext context = TestDatabase.newContext()) {
            DispatchJob job = DispatchJob.from(context);

            assertThat(job.getChannels()).isEmpty();
            assertThat(job.runDispatch()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should wire e-mail and webhook channels from the configuration")
    void shouldWireConfiguredChannels() {
        try (ServiceContext context = TestDatabase.newContext(TestDatabase.config()
                .emailRecipients(List.of("ops@example.com"))
                .webhookUrls(List.of("https://hooks.example.com/a", "https://hooks.example.com/b"))
                .build())) {
            DispatchJob job = DispatchJob.from(context);

            assertThat(job.getChannels()).extracting(NotificationChannel::getName)
                    .containsExactly(EmailChannel.NAME, WebhookChannel.NAME);
            assertThat(job.getChannels().get(1).getTargets()).hasSize(2);
        }
    }
}
