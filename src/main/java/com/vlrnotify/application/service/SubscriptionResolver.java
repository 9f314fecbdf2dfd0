package com.vlrnotify.application.service;

import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.Participants;
import com.vlrnotify.domain.model.Subscription;
import com.vlrnotify.domain.model.SubscriptionKind;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the guilds subscribed to an event and the subscription that selected each of them.
 *
 * Event group subscriptions are checked before team subscriptions, so a guild following both
 * the tournament and a team in it gets one entry with the event group as reason.
 */
@Service
public class SubscriptionResolver {

    public static final String EVENT_REASON_PREFIX = "Event: ";
    public static final String TEAM_REASON_PREFIX = "Team: ";

    /**
     * @return guild id to reason, in the order the guilds were given
     */
    public Map<Long, String> resolve(MatchEvent event, List<GuildSettings> guilds) {
        Map<Long, String> recipients = new LinkedHashMap<>();
        for (GuildSettings guild : guilds) {
            if (recipients.containsKey(guild.getGuildId())) {
                continue;
            }
            reasonFor(event, guild.getSubscriptions())
                .ifPresent(reason -> recipients.put(guild.getGuildId(), reason));
        }
        return recipients;
    }

    Optional<String> reasonFor(MatchEvent event, List<Subscription> subscriptions) {
        for (Subscription subscription : subscriptions) {
            if (subscription.getKind() == SubscriptionKind.EVENT_GROUP
                    && subscription.matches(event.getEventGroup())) {
                return Optional.of(EVENT_REASON_PREFIX + subscription.getValue());
            }
        }
        Participants participants = event.getParticipants();
        if (participants == null) {
            return Optional.empty();
        }
        for (Subscription subscription : subscriptions) {
            if (subscription.getKind() == SubscriptionKind.TEAM
                    && (subscription.matches(participants.getFirst())
                        || subscription.matches(participants.getSecond()))) {
                return Optional.of(TEAM_REASON_PREFIX + subscription.getValue());
            }
        }
        return Optional.empty();
    }
}
