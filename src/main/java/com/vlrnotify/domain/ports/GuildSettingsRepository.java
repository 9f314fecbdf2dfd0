package com.vlrnotify.domain.ports;

import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.Subscription;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Port for per-guild notification configuration.
 */
public interface GuildSettingsRepository {

    /**
     * @return Stored settings, or defaults for a guild never configured
     */
    GuildSettings get(long guildId);

    List<GuildSettings> findAll();

    void save(GuildSettings settings);

    default Optional<Long> getNotificationChannel(long guildId) {
        return Optional.ofNullable(get(guildId).getChannelId());
    }

    default Duration getLeadTime(long guildId) {
        return get(guildId).leadTime();
    }

    default List<Subscription> getSubscriptions(long guildId) {
        return get(guildId).getSubscriptions();
    }
}
