package com.vlrnotify.domain.model;

import java.util.List;

/**
 * Result of one fetch-and-normalize cycle. A failed outcome never carries events,
 * so callers cannot act on a partial list.
 */
public final class PollOutcome {

    private final List<MatchEvent> events;
    private final String failureReason;

    private PollOutcome(List<MatchEvent> events, String failureReason) {
        this.events = events;
        this.failureReason = failureReason;
    }

    public static PollOutcome success(List<MatchEvent> events) {
        return new PollOutcome(List.copyOf(events), null);
    }

    public static PollOutcome failed(String reason) {
        return new PollOutcome(List.of(), reason != null ? reason : "unknown error");
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    public List<MatchEvent> getEvents() {
        return events;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
