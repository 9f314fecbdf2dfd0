package com.vlrnotify.application.usecase;

import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.Subscription;
import com.vlrnotify.domain.model.SubscriptionKind;
import com.vlrnotify.domain.ports.GuildSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Iterator;

/**
 * Use case for the guild admin commands: notification channel, lead time and subscriptions.
 *
 * Each command reads, modifies and saves the whole guild record; commands are serialized
 * so concurrent admins do not lose each other's changes.
 */
@Service
public class GuildSettingsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(GuildSettingsUseCase.class);

    public static final int MAX_LEAD_TIME_MINUTES = 24 * 60;

    public enum ToggleResult {
        SUBSCRIBED,
        UNSUBSCRIBED
    }

    private final GuildSettingsRepository repository;

    public GuildSettingsUseCase(GuildSettingsRepository repository) {
        this.repository = repository;
    }

    public GuildSettings get(long guildId) {
        return repository.get(guildId);
    }

    public synchronized GuildSettings setChannel(long guildId, long channelId) {
        GuildSettings settings = repository.get(guildId);
        settings.setChannelId(channelId);
        repository.save(settings);
        logger.info("Guild {} notifications now go to channel {}", guildId, channelId);
        return settings;
    }

    public synchronized GuildSettings clearChannel(long guildId) {
        GuildSettings settings = repository.get(guildId);
        settings.setChannelId(null);
        repository.save(settings);
        logger.info("Guild {} notifications disabled", guildId);
        return settings;
    }

    public synchronized GuildSettings setLeadTime(long guildId, int minutes) {
        if (minutes < 0 || minutes > MAX_LEAD_TIME_MINUTES) {
            throw new IllegalArgumentException(
                "Lead time must be between 0 and " + MAX_LEAD_TIME_MINUTES + " minutes, got " + minutes);
        }
        GuildSettings settings = repository.get(guildId);
        settings.setLeadTimeMinutes(minutes);
        repository.save(settings);
        logger.info("Guild {} lead time set to {} minutes", guildId, minutes);
        return settings;
    }

    /**
     * @return false if an equivalent subscription already existed
     */
    public synchronized boolean subscribe(long guildId, SubscriptionKind kind, String value) {
        Subscription subscription = newSubscription(guildId, kind, value);
        GuildSettings settings = repository.get(guildId);
        if (settings.getSubscriptions().stream().anyMatch(subscription::sameFilterAs)) {
            return false;
        }
        settings.getSubscriptions().add(subscription);
        repository.save(settings);
        logger.info("Guild {} subscribed to {}", guildId, subscription);
        return true;
    }

    /**
     * @return false if no matching subscription existed
     */
    public synchronized boolean unsubscribe(long guildId, SubscriptionKind kind, String value) {
        Subscription subscription = newSubscription(guildId, kind, value);
        GuildSettings settings = repository.get(guildId);
        boolean removed = false;
        Iterator<Subscription> it = settings.getSubscriptions().iterator();
        while (it.hasNext()) {
            if (subscription.sameFilterAs(it.next())) {
                it.remove();
                removed = true;
            }
        }
        if (removed) {
            repository.save(settings);
            logger.info("Guild {} unsubscribed from {}", guildId, subscription);
        }
        return removed;
    }

    /**
     * Subscribes, or unsubscribes when the guild already follows that value.
     */
    public synchronized ToggleResult toggle(long guildId, SubscriptionKind kind, String value) {
        if (unsubscribe(guildId, kind, value)) {
            return ToggleResult.UNSUBSCRIBED;
        }
        subscribe(guildId, kind, value);
        return ToggleResult.SUBSCRIBED;
    }

    private static Subscription newSubscription(long guildId, SubscriptionKind kind, String value) {
        if (kind == null) {
            throw new IllegalArgumentException("Subscription kind is required (TEAM or EVENT_GROUP)");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Subscription value must not be blank");
        }
        return new Subscription(guildId, kind, value.trim());
    }
}
