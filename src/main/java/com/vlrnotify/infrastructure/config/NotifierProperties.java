package com.vlrnotify.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Notification timing settings.
 *
 * @param defaultLeadTime lead time used when no guild has one configured
 * @param pollTimeout     hard bound on one source poll, including all of its requests
 * @param retention       how long settled events are kept after they were last seen
 */
@ConfigurationProperties(prefix = "vlr.notifier")
public record NotifierProperties(
        Duration defaultLeadTime,
        Duration pollTimeout,
        Duration retention
) {

    public NotifierProperties {
        if (defaultLeadTime == null) defaultLeadTime = Duration.ofMinutes(15);
        if (pollTimeout == null) pollTimeout = Duration.ofSeconds(30);
        if (retention == null) retention = Duration.ofDays(7);
    }

    public static NotifierProperties defaults() {
        return new NotifierProperties(null, null, null);
    }
}
