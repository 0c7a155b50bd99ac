package com.kpisentinel.service.lifecycle;

import com.kpisentinel.core.model.Alert;
import com.kpisentinel.service.ServiceContext;
import com.kpisentinel.service.notify.NotificationRecord;
import com.kpisentinel.service.storage.JdbcAlertRepository;
import com.kpisentinel.service.storage.JdbcAuditLog;
import com.kpisentinel.service.storage.JdbcNotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Operator-facing alert operations: acknowledge, resolve and the recent
 * alert and notification listings.
 *
 * <h3>Access</h3>
 * <p>
 * Mutations require at least {@link Role#OPERATOR}; listings are open to
 * every role. The role check happens before the alert is looked up.
 * </p>
 *
 * <h3>Idempotence</h3>
 * <p>
 * Acknowledging twice keeps the first actor and timestamp; resolving twice
 * keeps the first resolver. Each successful call appends an audit row in
 * the same transaction as the update.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertLifecycleService {

    private static final Logger LOG = LoggerFactory.getLogger(AlertLifecycleService.class);

    public static final Role REQUIRED_ROLE = Role.OPERATOR;
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    static final String ACTION_ACK = "alert.ack";
    static final String ACTION_RESOLVE = "alert.resolve";
    static final String ENTITY_ALERT = "alert";

    private final JdbcAlertRepository alerts;
    private final JdbcNotificationRepository notifications;
    private final JdbcAuditLog auditLog;
    private final TransactionTemplate transactions;

    public AlertLifecycleService(JdbcAlertRepository alerts, JdbcNotificationRepository notifications,
            JdbcAuditLog auditLog, TransactionTemplate transactions) {
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog must not be null");
        this.transactions = Objects.requireNonNull(transactions, "transactions must not be null");
    }

    public static AlertLifecycleService from(ServiceContext context) {
        return new AlertLifecycleService(context.getAlertRepository(), context.getNotificationRepository(),
                context.getAuditLog(), context.getTransactions());
    }

    /**
     * Acknowledge an alert.
     *
     * @param alertId id of the alert
     * @param actor   who acknowledges; must not be blank
     * @param role    caller's role
     * @return the alert after the update
     * @throws InsufficientRoleException if {@code role} is below operator
     * @throws AlertNotFoundException    if the alert does not exist
     * @throws IllegalArgumentException  if {@code actor} is blank
     */
    public Alert acknowledge(long alertId, String actor, Role role) {
        return mutate(alertId, actor, role, ACTION_ACK, alerts::acknowledge);
    }

    /**
     * Resolve an alert, acknowledging it as well when it never was.
     *
     * @param alertId id of the alert
     * @param actor   who resolves; must not be blank
     * @param role    caller's role
     * @return the alert after the update
     * @throws InsufficientRoleException if {@code role} is below operator
     * @throws AlertNotFoundException    if the alert does not exist
     * @throws IllegalArgumentException  if {@code actor} is blank
     */
    public Alert resolve(long alertId, String actor, Role role) {
        return mutate(alertId, actor, role, ACTION_RESOLVE, alerts::resolve);
    }

    public List<Alert> listRecentAlerts(int limit) {
        return alerts.listRecent(checkLimit(limit));
    }

    public List<NotificationRecord> listRecentNotifications(int limit) {
        return notifications.listRecent(checkLimit(limit));
    }

    /**
     * @throws IllegalArgumentException if {@code limit} is outside {@code [1, 200]}
     */
    public static int checkLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be in [1, " + MAX_LIMIT + "], got: " + limit);
        }
        return limit;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface Mutation {
        Optional<Alert> apply(long alertId, String actor);
    }

    private Alert mutate(long alertId, String actor, Role role, String action, Mutation mutation) {
        Objects.requireNonNull(role, "role must not be null").require(REQUIRED_ROLE);
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor must not be blank");
        }
        String who = actor.trim();

        Alert alert = transactions.execute(status -> {
            Alert updated = mutation.apply(alertId, who)
                    .orElseThrow(() -> new AlertNotFoundException(alertId));
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("status", updated.getStatus().name());
            auditLog.record(who, action, ENTITY_ALERT, String.valueOf(alertId), payload);
            return updated;
        });
        LOG.info("{} on alert {} by {} -> {}", action, alertId, who, alert.getStatus());
        return alert;
    }
}
