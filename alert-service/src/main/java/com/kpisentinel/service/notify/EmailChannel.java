package com.kpisentinel.service.notify;

import com.kpisentinel.core.model.Alert;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Direct-message channel: one e-mail per alert to every configured
 * recipient. All recipients form a single target, the comma-joined list.
 */
public class EmailChannel implements NotificationChannel {

    public static final String NAME = "email";
    static final String SUBJECT_PREFIX = "[KPI-Sentinel]";

    private final List<String> recipients;
    private final String from;
    private final MailSender mailSender;

    public EmailChannel(List<String> recipients, String from, MailSender mailSender) {
        this.recipients = List.copyOf(Objects.requireNonNull(recipients, "recipients must not be null"));
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.mailSender = Objects.requireNonNull(mailSender, "mailSender must not be null");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<String> getTargets() {
        return recipients.isEmpty() ? List.of() : List.of(String.join(",", recipients));
    }

    @Override
    public Map<String, Object> renderPayload(Alert alert, String target) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("subject", subject(alert));
        payload.put("recipients", recipients);
        payload.put("alert_id", alert.getAlertId());
        return payload;
    }

    @Override
    public void send(Alert alert, String target, Map<String, Object> payload) throws DeliveryException {
        mailSender.send(new MailMessage(from, recipients, subject(alert), body(alert)));
    }

    static String subject(Alert alert) {
        return SUBJECT_PREFIX + " " + alert.getSeverity() + " " + alert.getMetricName() + " " + alert.getMetricDate();
    }

    static String body(Alert alert) {
        StringBuilder body = new StringBuilder()
                .append("Metric: ").append(alert.getMetricName()).append('\n')
                .append("Date: ").append(alert.getMetricDate()).append('\n')
                .append("Severity: ").append(alert.getSeverity()).append('\n')
                .append("Risk score: ").append(String.format(Locale.ROOT, "%.4f", alert.getRiskScore())).append('\n')
                .append("Message: ").append(alert.getMessage()).append('\n')
                .append("Created at: ").append(alert.getCreatedAt()).append('\n')
                .append('\n')
                .append("Context:").append('\n');
        alert.getContext().forEach((key, value) -> body.append("  ").append(key).append(": ").append(value).append('\n'));
        return body.toString();
    }
}
