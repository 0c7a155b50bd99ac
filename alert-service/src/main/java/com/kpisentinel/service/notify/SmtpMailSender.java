package com.kpisentinel.service.notify;

import com.kpisentinel.service.ServiceConfig;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Sends mail over SMTP with Jakarta Mail. STARTTLS is required when
 * {@code SMTP_USE_TLS} is set; authentication is used when both a user name
 * and a password are configured. Socket timeouts come from {@code SMTP_TIMEOUT_MS}.
 */
public class SmtpMailSender implements MailSender {

    private static final Logger LOG = LoggerFactory.getLogger(SmtpMailSender.class);

    private final Session session;
    private final String username;
    private final String password;
    private final boolean authenticate;

    public SmtpMailSender(ServiceConfig config) {
        this.authenticate = config.hasSmtpCredentials();
        this.username = config.getSmtpUsername();
        this.password = config.getSmtpPassword();

        String timeout = String.valueOf(config.getSmtpTimeoutMs());
        Properties props = new Properties();
        props.put("mail.smtp.host", config.getSmtpHost());
        props.put("mail.smtp.port", String.valueOf(config.getSmtpPort()));
        props.put("mail.smtp.auth", String.valueOf(authenticate));
        props.put("mail.smtp.connectiontimeout", timeout);
        props.put("mail.smtp.timeout", timeout);
        props.put("mail.smtp.writetimeout", timeout);
        if (config.isSmtpUseTls()) {
            props.put("mail.smtp.starttls.enable", "true");
            props.put("mail.smtp.starttls.required", "true");
        }
        this.session = Session.getInstance(props);
        LOG.info("SMTP sender configured for {}:{} (tls={}, auth={})",
                config.getSmtpHost(), config.getSmtpPort(), config.isSmtpUseTls(), authenticate);
    }

    @Override
    public void send(MailMessage message) throws DeliveryException {
        try {
            MimeMessage mime = new MimeMessage(session);
            mime.setFrom(new InternetAddress(message.getFrom()));
            mime.setRecipients(Message.RecipientType.TO,
                    InternetAddress.parse(String.join(",", message.getRecipients())));
            mime.setSubject(message.getSubject(), StandardCharsets.UTF_8.name());
            mime.setText(message.getBody(), StandardCharsets.UTF_8.name());
            if (authenticate) {
                Transport.send(mime, username, password);
            } else {
                Transport.send(mime);
            }
        } catch (MessagingException e) {
            throw new DeliveryException("SMTP delivery failed: " + e.getMessage(), e);
        }
    }

    Properties sessionProperties() {
        return session.getProperties();
    }
}
