package com.vlrnotify.application.usecase;

import com.vlrnotify.application.service.SubscriptionResolver;
import com.vlrnotify.domain.model.DeliveryResult;
import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.Notification;
import com.vlrnotify.domain.ports.EventStore;
import com.vlrnotify.domain.ports.EventStoreException;
import com.vlrnotify.domain.ports.GuildSettingsRepository;
import com.vlrnotify.domain.ports.NotificationSender;
import com.vlrnotify.infrastructure.config.NotifierProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Use case for one notification tick.
 *
 * Flow:
 * 1) Collect matches starting within the largest configured lead time, plus matches already
 *    started that were never announced (sent late)
 * 2) For each, resolve subscribed guilds and hand each guild one notification
 * 3) Mark the match notified once no guild is still waiting for its own lead window
 * 4) Announce results of tracked matches that completed since the last tick
 *
 * A guild is claimed in the event's sent-log before its message goes out, so a guild never
 * receives the same lead-time notification twice, even across a crash.
 */
@Service
public class DispatchNotificationsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(DispatchNotificationsUseCase.class);

    private final EventStore eventStore;
    private final GuildSettingsRepository guildSettingsRepository;
    private final SubscriptionResolver subscriptionResolver;
    private final NotificationSender notificationSender;
    private final Duration defaultLeadTime;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public DispatchNotificationsUseCase(EventStore eventStore,
                                        GuildSettingsRepository guildSettingsRepository,
                                        SubscriptionResolver subscriptionResolver,
                                        NotificationSender notificationSender,
                                        NotifierProperties properties) {
        this.eventStore = eventStore;
        this.guildSettingsRepository = guildSettingsRepository;
        this.subscriptionResolver = subscriptionResolver;
        this.notificationSender = notificationSender;
        this.defaultLeadTime = properties.defaultLeadTime();
    }

    /**
     * Runs one tick at {@code now}. Skipped when a previous tick is still running.
     */
    public DispatchSummary execute(Instant now) {
        if (!running.compareAndSet(false, true)) {
            logger.info("Notification tick already in progress, skipping");
            return DispatchSummary.skippedRun();
        }
        try {
            return tick(now);
        } finally {
            running.set(false);
        }
    }

    private DispatchSummary tick(Instant now) {
        DispatchSummary summary = new DispatchSummary(false);
        List<GuildSettings> guilds = guildSettingsRepository.findAll().stream()
            .filter(g -> g.getChannelId() != null)
            .toList();

        Duration maxLead = guilds.stream()
            .map(GuildSettings::leadTime)
            .max(Comparator.naturalOrder())
            .orElse(defaultLeadTime);

        for (MatchEvent event : eventStore.dueForNotification(now, maxLead)) {
            dispatchUpcoming(event, false, now, guilds, summary);
        }
        for (MatchEvent event : eventStore.overdueForNotification(now)) {
            dispatchUpcoming(event, true, now, guilds, summary);
        }
        for (MatchEvent event : eventStore.dueResultNotifications()) {
            dispatchResult(event, guilds, summary);
        }

        if (summary.getDelivered() > 0 || !summary.getFailures().isEmpty()) {
            logger.info("Notification tick: {} delivered, {} failed, {} events marked notified, {} results announced",
                summary.getDelivered(), summary.getFailures().size(), summary.getNotified(), summary.getResults());
        }
        return summary;
    }

    private void dispatchUpcoming(MatchEvent event, boolean late, Instant now,
                                  List<GuildSettings> guilds, DispatchSummary summary) {
        String id = event.getExternalId();
        try {
            Map<Long, String> recipients = subscriptionResolver.resolve(event, guilds);
            boolean deferred = false;

            for (GuildSettings guild : guilds) {
                String reason = recipients.get(guild.getGuildId());
                if (reason == null || event.getDeliveredGuilds().contains(guild.getGuildId())) {
                    continue;
                }
                if (!late && event.getScheduledTime().minus(guild.leadTime()).isAfter(now)) {
                    // This guild's own window has not opened yet
                    deferred = true;
                    continue;
                }
                if (!eventStore.claimDelivery(id, guild.getGuildId())) {
                    continue;
                }
                deliver(guild, Notification.upcoming(event, reason, late), summary);
            }

            if (deferred) {
                summary.deferred++;
            } else if (eventStore.markNotified(id, late)) {
                summary.notified++;
                if (late) {
                    logger.info("Match {} announced late, it started at {}", id, event.getScheduledTime());
                }
            }
        } catch (EventStoreException e) {
            logger.error("Store error while notifying match {}", id, e);
            summary.failures.add(id + ": " + e.getMessage());
        }
    }

    private void dispatchResult(MatchEvent event, List<GuildSettings> guilds, DispatchSummary summary) {
        String id = event.getExternalId();
        try {
            Map<Long, String> recipients = subscriptionResolver.resolve(event, guilds);
            for (GuildSettings guild : guilds) {
                String reason = recipients.get(guild.getGuildId());
                if (reason != null) {
                    deliver(guild, Notification.result(event, reason), summary);
                }
            }
            if (eventStore.markResultNotified(id)) {
                summary.results++;
            }
        } catch (EventStoreException e) {
            logger.error("Store error while announcing result {}", id, e);
            summary.failures.add(id + ": " + e.getMessage());
        }
    }

    private void deliver(GuildSettings guild, Notification notification, DispatchSummary summary) {
        String id = notification.event().getExternalId();
        DeliveryResult result;
        try {
            result = notificationSender.send(guild.getChannelId(), notification);
        } catch (RuntimeException e) {
            result = DeliveryResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (result.isOk()) {
            summary.delivered++;
            logger.debug("Sent {} notification for {} to guild {}", notification.type(), id, guild.getGuildId());
        } else {
            logger.warn("Failed to send {} notification for {} to guild {}: {}",
                notification.type(), id, guild.getGuildId(), result.getError());
            summary.failures.add(id + " -> guild " + guild.getGuildId() + ": " + result.getError());
        }
    }

    /**
     * Counters of one tick.
     */
    public static class DispatchSummary {
        private final boolean skipped;
        private int delivered;
        private int notified;
        private int deferred;
        private int results;
        private final List<String> failures = new ArrayList<>();

        DispatchSummary(boolean skipped) {
            this.skipped = skipped;
        }

        static DispatchSummary skippedRun() {
            return new DispatchSummary(true);
        }

        public boolean isSkipped() {
            return skipped;
        }

        public int getDelivered() {
            return delivered;
        }

        /** Events whose notified flag this tick flipped. */
        public int getNotified() {
            return notified;
        }

        /** Events left unnotified because some guild's lead window has not opened. */
        public int getDeferred() {
            return deferred;
        }

        public int getResults() {
            return results;
        }

        public List<String> getFailures() {
            return failures;
        }
    }
}
