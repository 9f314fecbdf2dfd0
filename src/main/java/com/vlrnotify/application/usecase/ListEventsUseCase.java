package com.vlrnotify.application.usecase;

import com.vlrnotify.domain.model.EventKind;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.ports.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Use case for the upcoming-match and recent-result listings.
 */
@Service
public class ListEventsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(ListEventsUseCase.class);

    public static final int DEFAULT_LIMIT = 5;
    public static final int MAX_LIMIT = 20;

    /**
     * Event group filters offered by the list commands.
     */
    public enum Filter {
        ALL(null),
        VCT("Champions Tour"),
        GC("Game Changers");

        private final String groupMarker;

        Filter(String groupMarker) {
            this.groupMarker = groupMarker;
        }

        public boolean accepts(MatchEvent event) {
            if (groupMarker == null) {
                return true;
            }
            String group = event.getEventGroup();
            return group != null && group.toLowerCase(Locale.ROOT).contains(groupMarker.toLowerCase(Locale.ROOT));
        }

        /**
         * Parses a filter name, case-insensitive. Null or blank means ALL.
         */
        public static Filter parse(String name) {
            if (name == null || name.isBlank()) {
                return ALL;
            }
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown filter '" + name + "', expected ALL, VCT or GC");
            }
        }
    }

    /**
     * @param events      listed events, at most the requested count
     * @param retrievedAt last successful poll, null if none happened yet
     */
    public record EventListing(List<MatchEvent> events, Instant retrievedAt) {}

    private final EventStore eventStore;
    private final PollEventsUseCase pollEventsUseCase;

    public ListEventsUseCase(EventStore eventStore, PollEventsUseCase pollEventsUseCase) {
        this.eventStore = eventStore;
        this.pollEventsUseCase = pollEventsUseCase;
    }

    public EventListing listMatches(Integer limit, Filter filter) {
        return list(EventKind.MATCH, limit, filter);
    }

    public EventListing listResults(Integer limit, Filter filter) {
        return list(EventKind.RESULT, limit, filter);
    }

    private EventListing list(EventKind kind, Integer limit, Filter filter) {
        int n = clampLimit(limit);
        Filter effective = filter != null ? filter : Filter.ALL;

        List<MatchEvent> stored = eventStore.findByKind(kind);
        if (stored.isEmpty()) {
            logger.info("No {} events stored, polling before listing", kind);
            pollEventsUseCase.execute();
            stored = eventStore.findByKind(kind);
        }

        List<MatchEvent> events = stored.stream()
            .filter(effective::accepts)
            .limit(n)
            .toList();
        return new EventListing(events, pollEventsUseCase.getLastSuccessfulPoll());
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        if (limit < 1) {
            throw new IllegalArgumentException("Count must be at least 1");
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
