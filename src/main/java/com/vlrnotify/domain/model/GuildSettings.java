package com.vlrnotify.domain.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-guild notification configuration.
 */
public class GuildSettings {

    public static final int DEFAULT_LEAD_TIME_MINUTES = 15;

    private long guildId;

    /** Channel receiving notifications. Null disables notifications for the guild. */
    private Long channelId;

    /** How many minutes before the scheduled start a match notification is sent. */
    private int leadTimeMinutes = DEFAULT_LEAD_TIME_MINUTES;

    private List<Subscription> subscriptions = new ArrayList<>();

    public GuildSettings() {
    }

    public GuildSettings(long guildId) {
        this.guildId = guildId;
    }

    public long getGuildId() {
        return guildId;
    }

    public void setGuildId(long guildId) {
        this.guildId = guildId;
    }

    public Long getChannelId() {
        return channelId;
    }

    public void setChannelId(Long channelId) {
        this.channelId = channelId;
    }

    public int getLeadTimeMinutes() {
        return leadTimeMinutes;
    }

    public void setLeadTimeMinutes(int leadTimeMinutes) {
        this.leadTimeMinutes = leadTimeMinutes;
    }

    public List<Subscription> getSubscriptions() {
        return subscriptions;
    }

    public void setSubscriptions(List<Subscription> subscriptions) {
        this.subscriptions = subscriptions != null ? subscriptions : new ArrayList<>();
    }

    public Duration leadTime() {
        return Duration.ofMinutes(leadTimeMinutes);
    }

    public GuildSettings copy() {
        GuildSettings copy = new GuildSettings(guildId);
        copy.channelId = channelId;
        copy.leadTimeMinutes = leadTimeMinutes;
        copy.subscriptions = new ArrayList<>();
        for (Subscription s : subscriptions) {
            copy.subscriptions.add(new Subscription(s.getGuildId(), s.getKind(), s.getValue()));
        }
        return copy;
    }
}
