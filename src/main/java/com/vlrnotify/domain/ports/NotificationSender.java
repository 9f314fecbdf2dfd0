package com.vlrnotify.domain.ports;

import com.vlrnotify.domain.model.DeliveryResult;
import com.vlrnotify.domain.model.Notification;

/**
 * Port for delivering a notification to a chat channel.
 */
public interface NotificationSender {

    /**
     * Sends one notification, bounded by the configured timeouts. Failures are returned,
     * never thrown.
     */
    DeliveryResult send(long channelId, Notification notification);
}
