package com.kpisentinel.service.notify;

/**
 * Transport used by {@link EmailChannel}.
 */
@FunctionalInterface
public interface MailSender {

    void send(MailMessage message) throws DeliveryException;
}
