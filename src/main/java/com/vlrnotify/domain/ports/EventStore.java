package com.vlrnotify.domain.ports;

import com.vlrnotify.domain.model.EventKind;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.UpsertResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Port for the durable, deduplicated table of known events.
 *
 * <p>Writes for one external id are serialized; writes for different ids do not block each other.
 * Every mutation replaces a record as a whole. Implementations throw
 * {@link EventStoreException} when the backing storage fails.
 */
public interface EventStore {

    /**
     * Merges a polled event by its external id. Notification state is never reset.
     *
     * @param event normalized event from a poll
     * @param seenAt time of the poll that produced it
     * @return Inserted, or Updated with whether any polled field changed
     */
    UpsertResult upsert(MatchEvent event, Instant seenAt);

    /**
     * Matches not yet notified whose start lies within {@code [now, now + leadTime]}.
     */
    List<MatchEvent> dueForNotification(Instant now, Duration leadTime);

    /**
     * Matches not yet notified whose start is already in the past.
     */
    List<MatchEvent> overdueForNotification(Instant now);

    /**
     * Results that turned from a tracked match and have not been announced yet.
     */
    List<MatchEvent> dueResultNotifications();

    /**
     * Sets the notified flag.
     *
     * @return true only for the call that flipped the flag
     */
    boolean markNotified(String externalId, boolean late);

    /**
     * Records that a guild is being handed the lead-time notification. Durable before returning.
     *
     * @return true only for the first claim of this guild on this event
     */
    boolean claimDelivery(String externalId, long guildId);

    /**
     * @return true only for the call that flipped the flag
     */
    boolean markResultNotified(String externalId);

    Optional<MatchEvent> findByExternalId(String externalId);

    /**
     * Matches ordered by scheduled start; results ordered most recently seen first.
     */
    List<MatchEvent> findByKind(EventKind kind);

    /**
     * Deletes settled records not seen by any poll since {@code seenBefore}.
     *
     * @return number of deleted records
     */
    int removeStale(Instant seenBefore);
}
