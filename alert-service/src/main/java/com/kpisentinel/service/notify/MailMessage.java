package com.kpisentinel.service.notify;

import java.util.List;
import java.util.Objects;

/**
 * A plain-text e-mail ready to hand to a {@link MailSender}.
 */
public final class MailMessage {

    private final String from;
    private final List<String> recipients;
    private final String subject;
    private final String body;

    public MailMessage(String from, List<String> recipients, String subject, String body) {
        this.from = Objects.requireNonNull(from, "from must not be null");
        this.recipients = List.copyOf(Objects.requireNonNull(recipients, "recipients must not be null"));
        this.subject = Objects.requireNonNull(subject, "subject must not be null");
        this.body = Objects.requireNonNull(body, "body must not be null");
    }

    public String getFrom() {
        return from;
    }

    public List<String> getRecipients() {
        return recipients;
    }

    public String getSubject() {
        return subject;
    }

    public String getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "MailMessage{to=" + recipients + ", subject='" + subject + "'}";
    }
}
