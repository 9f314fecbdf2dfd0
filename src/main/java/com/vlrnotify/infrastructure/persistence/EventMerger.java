package com.vlrnotify.infrastructure.persistence;

import com.vlrnotify.domain.model.EventKind;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.MatchScore;
import com.vlrnotify.domain.model.UpsertResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;

/**
 * Merge rules shared by the event store implementations.
 *
 * Rules:
 * 1. A new id is stored with fresh notification state
 * 2. Polled fields overwrite stored ones when the poll provides them
 * 3. Notification state and first-seen time are never touched by a poll
 * 4. A result never turns back into a match
 * 5. A match turning into a result records the completion time once
 */
public final class EventMerger {

    private EventMerger() {
    }

    /** Matches by scheduled start, then by id. */
    public static final Comparator<MatchEvent> EARLIEST_START_FIRST =
        Comparator.comparing(MatchEvent::getScheduledTime, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing((a, b) -> a.compareIdTo(b));

    /** Results by first sighting, newest first. Source ids grow over time and break ties. */
    public static final Comparator<MatchEvent> NEWEST_FIRST =
        Comparator.comparing(MatchEvent::getFirstSeenAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing((a, b) -> b.compareIdTo(a));

    public record Merge(MatchEvent record, UpsertResult result) {}

    public static Merge merge(MatchEvent existing, MatchEvent incoming, Instant seenAt) {
        if (existing == null) {
            MatchEvent created = incoming.copy();
            created.setNotified(false);
            created.setLate(false);
            created.setDeliveredGuilds(new LinkedHashSet<>());
            created.setCompletedAt(null);
            created.setResultNotified(false);
            created.setFirstSeenAt(seenAt);
            created.setLastSeenAt(seenAt);
            created.setVersion(1);
            return new Merge(created, UpsertResult.inserted());
        }

        MatchEvent merged = existing.copy();
        merged.setLastSeenAt(seenAt);
        merged.setVersion(existing.getVersion() + 1);

        // Stale listing of a finished match
        if (existing.getKind() == EventKind.RESULT && incoming.getKind() == EventKind.MATCH) {
            return new Merge(merged, UpsertResult.updated(false));
        }

        if (existing.getKind() == EventKind.MATCH && incoming.getKind() == EventKind.RESULT
                && existing.getCompletedAt() == null) {
            merged.setCompletedAt(seenAt);
        }

        merged.setKind(incoming.getKind());
        if (incoming.getParticipants() != null) {
            merged.setParticipants(incoming.getParticipants().copy());
        }
        if (incoming.getEventGroup() != null) {
            merged.setEventGroup(incoming.getEventGroup());
        }
        if (incoming.getSeries() != null) {
            merged.setSeries(incoming.getSeries());
        }
        if (incoming.getStatus() != null) {
            merged.setStatus(incoming.getStatus());
        }
        if (incoming.getScheduledTime() != null) {
            merged.setScheduledTime(incoming.getScheduledTime());
        }
        if (incoming.getScore() != null) {
            merged.setScore(new MatchScore(incoming.getScore().getFirst(), incoming.getScore().getSecond()));
        }
        if (incoming.getUrl() != null) {
            merged.setUrl(incoming.getUrl());
        }

        return new Merge(merged, UpsertResult.updated(!merged.hasSameContentAs(existing)));
    }

    /**
     * Unnotified match starting within {@code [now, now + leadTime]}.
     */
    public static boolean isDue(MatchEvent event, Instant now, Duration leadTime) {
        if (event.getKind() != EventKind.MATCH || event.isNotified() || event.getScheduledTime() == null) {
            return false;
        }
        Instant start = event.getScheduledTime();
        return !start.isBefore(now) && !start.isAfter(now.plus(leadTime));
    }

    /**
     * Unnotified match whose start has already passed.
     */
    public static boolean isOverdue(MatchEvent event, Instant now) {
        return event.getKind() == EventKind.MATCH
            && !event.isNotified()
            && event.getScheduledTime() != null
            && event.getScheduledTime().isBefore(now);
    }

    public static boolean isResultDue(MatchEvent event) {
        return event.getKind() == EventKind.RESULT
            && event.getCompletedAt() != null
            && !event.isResultNotified();
    }

    /**
     * Settled records that no poll has reported since the cutoff.
     */
    public static boolean isStale(MatchEvent event, Instant seenBefore) {
        boolean settled = event.getKind() == EventKind.RESULT || event.isNotified();
        return settled && event.getLastSeenAt() != null && event.getLastSeenAt().isBefore(seenBefore);
    }
}
