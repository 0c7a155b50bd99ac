package com.kpisentinel.service.notify;

import com.kpisentinel.core.model.Alert;
import com.kpisentinel.service.SentinelMetrics;
import com.kpisentinel.service.ServiceContext;
import com.kpisentinel.service.storage.JdbcAlertRepository;
import com.kpisentinel.service.storage.JdbcNotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Delivers alerts that have no {@code sent} notification yet for a channel
 * target, oldest first.
 *
 * <h3>Delivery semantics</h3>
 * <p>
 * At-least-once: the outcome row is written after the external send, so a
 * crash in between re-sends the alert on the next run. A failed send is
 * recorded as {@code failed} and retried on every later run; it never
 * blocks the remaining alerts of the batch. Each target is processed in
 * its own transaction.
 * </p>
 */
public class NotificationDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final JdbcAlertRepository alerts;
    private final JdbcNotificationRepository notifications;
    private final TransactionTemplate transactions;
    private final SentinelMetrics metrics;

    public NotificationDispatcher(JdbcAlertRepository alerts, JdbcNotificationRepository notifications,
            TransactionTemplate transactions, SentinelMetrics metrics) {
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
        this.transactions = Objects.requireNonNull(transactions, "transactions must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public static NotificationDispatcher from(ServiceContext context) {
        return new NotificationDispatcher(context.getAlertRepository(), context.getNotificationRepository(),
                context.getTransactions(), context.getMetrics());
    }

    /**
     * Dispatch pending alerts over every target of {@code channel}.
     *
     * @param channel channel to deliver through
     * @param limit   maximum number of alerts considered per target
     * @return number of alerts delivered successfully across all targets
     * @throws IllegalArgumentException if {@code limit < 1}
     */
    public int dispatch(NotificationChannel channel, int limit) {
        Objects.requireNonNull(channel, "channel must not be null");
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        List<String> targets = channel.getTargets();
        if (targets.isEmpty()) {
            LOG.info("Channel [{}] has no targets configured; skipping", channel.getName());
            return 0;
        }

        int delivered = 0;
        for (String target : targets) {
            Integer count = transactions.execute(status -> dispatchTarget(channel, target, limit));
            delivered += count != null ? count : 0;
        }
        LOG.info("Channel [{}] dispatch complete: {} delivered across {} target(s)",
                channel.getName(), delivered, targets.size());
        return delivered;
    }

    private int dispatchTarget(NotificationChannel channel, String target, int limit) {
        String name = channel.getName();
        List<Alert> pending = alerts.findUndelivered(name, target, limit);
        if (pending.isEmpty()) {
            LOG.debug("Channel [{}] target [{}]: nothing pending", name, target);
            return 0;
        }

        int delivered = 0;
        for (Alert alert : pending) {
            Map<String, Object> payload = channel.renderPayload(alert, target);
            try {
                channel.send(alert, target, payload);
            } catch (DeliveryException | RuntimeException e) {
                LOG.error("Channel [{}] failed to deliver alert {} to [{}]: {}",
                        name, alert.getAlertId(), target, e.getMessage(), e);
                notifications.record(alert.getAlertId(), name, target, NotificationStatus.FAILED,
                        payload, describe(e));
                metrics.incrementNotificationsFailed(name);
                continue;
            }
            notifications.record(alert.getAlertId(), name, target, NotificationStatus.SENT, payload, null);
            metrics.incrementNotificationsSent(name);
            delivered++;
        }
        LOG.info("Channel [{}] target [{}]: {}/{} delivered", name, target, delivered, pending.size());
        return delivered;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
