package com.vlrnotify.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Guild-scoped notification filter on a team name or an event group name.
 * Matching is case-insensitive and exact on trimmed text.
 */
public class Subscription {

    private long guildId;

    private SubscriptionKind kind;

    private String value;

    public Subscription() {
    }

    public Subscription(long guildId, SubscriptionKind kind, String value) {
        this.guildId = guildId;
        this.kind = kind;
        this.value = value;
    }

    public long getGuildId() {
        return guildId;
    }

    public void setGuildId(long guildId) {
        this.guildId = guildId;
    }

    public SubscriptionKind getKind() {
        return kind;
    }

    public void setKind(SubscriptionKind kind) {
        this.kind = kind;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    /**
     * Checks a team or event group name against this subscription's value.
     */
    public boolean matches(String candidate) {
        if (candidate == null || value == null) {
            return false;
        }
        return normalize(candidate).equals(normalize(value));
    }

    /**
     * True when both subscriptions filter on the same kind and value, ignoring case.
     */
    public boolean sameFilterAs(Subscription other) {
        return other != null && kind == other.kind && matches(other.value);
    }

    static String normalize(String text) {
        return text.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Subscription)) return false;
        Subscription that = (Subscription) o;
        return guildId == that.guildId && kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(guildId, kind, value);
    }

    @Override
    public String toString() {
        return kind + ":" + value;
    }
}
