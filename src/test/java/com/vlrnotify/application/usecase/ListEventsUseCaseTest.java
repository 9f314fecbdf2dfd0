package com.vlrnotify.application.usecase;

import com.vlrnotify.domain.model.EventKind;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.Participants;
import com.vlrnotify.domain.model.PollOutcome;
import com.vlrnotify.domain.ports.EventSource;
import com.vlrnotify.infrastructure.config.NotifierProperties;
import com.vlrnotify.infrastructure.persistence.JsonFileEventStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ListEventsUseCaseTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private JsonFileEventStore store;
    private CountingSource source;
    private PollEventsUseCase pollEventsUseCase;
    private ListEventsUseCase useCase;

    @BeforeEach
    void setUp() {
        store = new JsonFileEventStore(tempDir.resolve("events.json"));
        source = new CountingSource();
        pollEventsUseCase = new PollEventsUseCase(List.of(source), store, NotifierProperties.defaults());
        useCase = new ListEventsUseCase(store, pollEventsUseCase);
    }

    @AfterEach
    void tearDown() {
        pollEventsUseCase.shutdown();
    }

    @Test
    void testEmptyStoreIsPolledFirst() {
        ListEventsUseCase.EventListing listing = useCase.listMatches(null, ListEventsUseCase.Filter.ALL);

        assertEquals(1, source.polls.get());
        assertEquals(5, listing.events().size());
        assertNotNull(listing.retrievedAt());
    }

    @Test
    void testFilledStoreIsNotPolled() {
        for (int i = 0; i < 3; i++) {
            store.upsert(match(String.valueOf(i), "Champions Tour 2024: Masters Shanghai", i), NOW);
        }

        ListEventsUseCase.EventListing listing = useCase.listMatches(10, ListEventsUseCase.Filter.ALL);

        assertEquals(0, source.polls.get());
        assertEquals(3, listing.events().size());
        assertNull(listing.retrievedAt());
    }

    @Test
    void testLimitIsCapped() {
        for (int i = 0; i < 30; i++) {
            store.upsert(match(String.valueOf(i), "Some Cup", i), NOW);
        }

        assertEquals(20, useCase.listMatches(50, ListEventsUseCase.Filter.ALL).events().size());
        assertEquals(5, useCase.listMatches(null, null).events().size());
        assertEquals("0", useCase.listMatches(1, null).events().get(0).getExternalId());
        assertThrows(IllegalArgumentException.class, () -> useCase.listMatches(0, null));
    }

    @Test
    void testEventGroupFilters() {
        store.upsert(match("1", "Champions Tour 2024: Americas Stage 2", 1), NOW);
        store.upsert(match("2", "Game Changers 2024: North America", 2), NOW);
        store.upsert(match("3", "Challengers League 2024", 3), NOW);

        List<MatchEvent> vct = useCase.listMatches(null, ListEventsUseCase.Filter.VCT).events();
        List<MatchEvent> gc = useCase.listMatches(null, ListEventsUseCase.Filter.parse("gc")).events();

        assertEquals(List.of("1"), vct.stream().map(MatchEvent::getExternalId).toList());
        assertEquals(List.of("2"), gc.stream().map(MatchEvent::getExternalId).toList());
    }

    @Test
    void testFilterParsing() {
        assertEquals(ListEventsUseCase.Filter.ALL, ListEventsUseCase.Filter.parse(null));
        assertEquals(ListEventsUseCase.Filter.VCT, ListEventsUseCase.Filter.parse(" vct "));
        assertThrows(IllegalArgumentException.class, () -> ListEventsUseCase.Filter.parse("worlds"));
    }

    @Test
    void testResultsListing() {
        MatchEvent result = match("7", "Some Cup", 0);
        result.setKind(EventKind.RESULT);
        store.upsert(result, NOW);
        store.upsert(match("8", "Some Cup", 1), NOW);

        List<MatchEvent> results = useCase.listResults(null, ListEventsUseCase.Filter.ALL).events();

        assertEquals(List.of("7"), results.stream().map(MatchEvent::getExternalId).toList());
    }

    private static MatchEvent match(String id, String group, int hoursAhead) {
        MatchEvent event = new MatchEvent();
        event.setExternalId(id);
        event.setKind(EventKind.MATCH);
        event.setParticipants(new Participants("A" + id, "B" + id));
        event.setEventGroup(group);
        event.setStatus("Upcoming");
        event.setScheduledTime(NOW.plusSeconds(3600L * hoursAhead));
        return event;
    }

    private static class CountingSource implements EventSource {
        private final AtomicInteger polls = new AtomicInteger();

        @Override
        public String getSourceName() {
            return "counting";
        }

        @Override
        public PollOutcome poll() {
            polls.incrementAndGet();
            List<MatchEvent> events = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                events.add(match("10" + i, "Some Cup", i));
            }
            return PollOutcome.success(events);
        }
    }
}
