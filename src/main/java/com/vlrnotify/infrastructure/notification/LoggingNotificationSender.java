package com.vlrnotify.infrastructure.notification;

import com.vlrnotify.domain.model.DeliveryResult;
import com.vlrnotify.domain.model.Notification;
import com.vlrnotify.domain.ports.NotificationSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Writes rendered notifications to the log instead of Discord. Active unless Discord delivery is enabled.
 */
@Component
@ConditionalOnProperty(name = "vlr.discord.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingNotificationSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationSender.class);

    private final NotificationMessageFormatter formatter = new NotificationMessageFormatter();

    @Override
    public DeliveryResult send(long channelId, Notification notification) {
        logger.info("[channel {}] {}", channelId, formatter.format(notification, Instant.now()));
        return DeliveryResult.ok();
    }
}
