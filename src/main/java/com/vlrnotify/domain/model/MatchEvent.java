package com.vlrnotify.domain.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A single match or result, keyed by the source's stable id.
 *
 * <p>The first group of fields is produced by a source poll. The notification state and
 * bookkeeping fields are owned by the event store and are ignored when a polled event is merged.
 */
public class MatchEvent {

    /** Stable identifier from the source (vlr.gg match id). */
    private String externalId;

    private EventKind kind;

    private Participants participants;

    /** Competition or series name, used for subscription filtering. */
    private String eventGroup;

    /** Stage or round inside the event group (e.g. "Playoffs: Upper Final"). May be null. */
    private String series;

    /** Source status label: Upcoming, LIVE, Completed. */
    private String status;

    /** Scheduled start. Required for matches, may be null for results. */
    private Instant scheduledTime;

    /** Final score. Only set for results. */
    private MatchScore score;

    /** Link to the match page. */
    private String url;

    // Notification state, owned by the store

    /** True once the lead-time notification has fired. Never reset. */
    private boolean notified;

    /** True when the lead-time notification fired after the scheduled start. */
    private boolean late;

    /** Guilds that were already handed the lead-time notification. */
    private Set<Long> deliveredGuilds = new LinkedHashSet<>();

    /** When the store saw this event turn from a match into a result. */
    private Instant completedAt;

    /** True once the match-complete notification has fired. */
    private boolean resultNotified;

    // Bookkeeping

    private Instant firstSeenAt;

    /** Most recent successful poll that contained this event. */
    private Instant lastSeenAt;

    /** Incremented on every stored write. */
    private long version;

    public String getExternalId() {
        return externalId;
    }

    public void setExternalId(String externalId) {
        this.externalId = externalId;
    }

    public EventKind getKind() {
        return kind;
    }

    public void setKind(EventKind kind) {
        this.kind = kind;
    }

    public Participants getParticipants() {
        return participants;
    }

    public void setParticipants(Participants participants) {
        this.participants = participants;
    }

    public String getEventGroup() {
        return eventGroup;
    }

    public void setEventGroup(String eventGroup) {
        this.eventGroup = eventGroup;
    }

    public String getSeries() {
        return series;
    }

    public void setSeries(String series) {
        this.series = series;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getScheduledTime() {
        return scheduledTime;
    }

    public void setScheduledTime(Instant scheduledTime) {
        this.scheduledTime = scheduledTime;
    }

    public MatchScore getScore() {
        return score;
    }

    public void setScore(MatchScore score) {
        this.score = score;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public boolean isNotified() {
        return notified;
    }

    public void setNotified(boolean notified) {
        this.notified = notified;
    }

    public boolean isLate() {
        return late;
    }

    public void setLate(boolean late) {
        this.late = late;
    }

    public Set<Long> getDeliveredGuilds() {
        return deliveredGuilds;
    }

    public void setDeliveredGuilds(Set<Long> deliveredGuilds) {
        this.deliveredGuilds = deliveredGuilds != null ? deliveredGuilds : new LinkedHashSet<>();
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public boolean isResultNotified() {
        return resultNotified;
    }

    public void setResultNotified(boolean resultNotified) {
        this.resultNotified = resultNotified;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public void setFirstSeenAt(Instant firstSeenAt) {
        this.firstSeenAt = firstSeenAt;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(Instant lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }

    public long getVersion() {
        return version;
    }

    public void setVersion(long version) {
        this.version = version;
    }

    /**
     * Compares only the fields a source poll produces.
     */
    public boolean hasSameContentAs(MatchEvent other) {
        if (other == null) {
            return false;
        }
        return Objects.equals(externalId, other.externalId)
            && kind == other.kind
            && Objects.equals(participants, other.participants)
            && Objects.equals(eventGroup, other.eventGroup)
            && Objects.equals(series, other.series)
            && Objects.equals(status, other.status)
            && Objects.equals(scheduledTime, other.scheduledTime)
            && Objects.equals(score, other.score)
            && Objects.equals(url, other.url);
    }

    /**
     * Orders by external id, numerically when both ids are numeric.
     */
    public int compareIdTo(MatchEvent other) {
        String a = externalId != null ? externalId : "";
        String b = other.externalId != null ? other.externalId : "";
        if (a.matches("\\d+") && b.matches("\\d+")) {
            return a.length() != b.length() ? Integer.compare(a.length(), b.length()) : a.compareTo(b);
        }
        return a.compareTo(b);
    }

    /**
     * Deep copy, so stored records are never shared with callers.
     */
    public MatchEvent copy() {
        MatchEvent copy = new MatchEvent();
        copy.externalId = externalId;
        copy.kind = kind;
        copy.participants = participants != null ? participants.copy() : null;
        copy.eventGroup = eventGroup;
        copy.series = series;
        copy.status = status;
        copy.scheduledTime = scheduledTime;
        copy.score = score != null ? new MatchScore(score.getFirst(), score.getSecond()) : null;
        copy.url = url;
        copy.notified = notified;
        copy.late = late;
        copy.deliveredGuilds = new LinkedHashSet<>(deliveredGuilds);
        copy.completedAt = completedAt;
        copy.resultNotified = resultNotified;
        copy.firstSeenAt = firstSeenAt;
        copy.lastSeenAt = lastSeenAt;
        copy.version = version;
        return copy;
    }

    @Override
    public String toString() {
        return kind + "[" + externalId + "] " + participants + " (" + eventGroup + ")";
    }
}
