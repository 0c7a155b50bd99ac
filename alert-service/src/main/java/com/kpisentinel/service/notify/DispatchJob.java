package com.kpisentinel.service.notify;

import com.kpisentinel.service.ServiceConfig;
import com.kpisentinel.service.ServiceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One dispatch pass over every enabled channel.
 */
public class DispatchJob {

    private static final Logger LOG = LoggerFactory.getLogger(DispatchJob.class);

    private final NotificationDispatcher dispatcher;
    private final List<NotificationChannel> channels;
    private final int batchLimit;

    public DispatchJob(NotificationDispatcher dispatcher, List<NotificationChannel> channels, int batchLimit) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.channels = List.copyOf(Objects.requireNonNull(channels, "channels must not be null"));
        this.batchLimit = batchLimit;
    }

    /**
     * Wire the channels enabled by the context's configuration, using SMTP
     * for e-mail.
     */
    public static DispatchJob from(ServiceContext context) {
        ServiceConfig config = context.getConfig();
        List<NotificationChannel> channels = new ArrayList<>();
        if (config.isEmailEnabled()) {
            channels.add(new EmailChannel(config.getEmailRecipients(), config.getEmailFrom(),
                    new SmtpMailSender(config)));
        } else {
            LOG.info("E-mail channel disabled: ALERT_EMAIL_TO is not set");
        }
        if (config.isWebhookEnabled()) {
            channels.add(new WebhookChannel(config.getWebhookUrls(), context.getObjectMapper(),
                    Duration.ofMillis(config.getWebhookTimeoutMs())));
        } else {
            LOG.info("Webhook channel disabled: ALERT_WEBHOOK_URLS is not set");
        }
        return new DispatchJob(NotificationDispatcher.from(context), channels, config.getNotifyBatchLimit());
    }

    /**
     * @return alerts delivered per channel name
     */
    public Map<String, Integer> runDispatch() {
        LOG.info("Dispatch started for {} channel(s), batch limit {}", channels.size(), batchLimit);
        Map<String, Integer> delivered = new LinkedHashMap<>();
        for (NotificationChannel channel : channels) {
            delivered.put(channel.getName(), dispatcher.dispatch(channel, batchLimit));
        }
        LOG.info("Dispatch complete: {}", delivered);
        return delivered;
    }

    public List<NotificationChannel> getChannels() {
        return channels;
    }
}
