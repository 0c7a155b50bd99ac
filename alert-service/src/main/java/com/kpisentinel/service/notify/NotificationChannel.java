package com.kpisentinel.service.notify;

import com.kpisentinel.core.model.Alert;

import java.util.List;
import java.util.Map;

/**
 * A delivery mechanism for alerts, such as e-mail or webhooks.
 *
 * <p>
 * Each channel exposes one or more targets. Delivery state is tracked per
 * {@code (alert, channel name, target)}, so targets are dispatched
 * independently.
 * </p>
 */
public interface NotificationChannel {

    /**
     * @return stable channel name stored with each notification row
     */
    String getName();

    /**
     * @return configured targets; empty when the channel is disabled
     */
    List<String> getTargets();

    /**
     * Build the payload recorded with the notification row.
     */
    Map<String, Object> renderPayload(Alert alert, String target);

    /**
     * Deliver one alert to one target.
     *
     * @throws DeliveryException if the target did not accept the alert
     */
    void send(Alert alert, String target, Map<String, Object> payload) throws DeliveryException;
}
