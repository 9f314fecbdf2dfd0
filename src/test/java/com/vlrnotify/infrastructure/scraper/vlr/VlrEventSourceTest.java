package com.vlrnotify.infrastructure.scraper.vlr;

import com.fasterxml.jackson.databind.JsonNode;
import com.vlrnotify.domain.model.EventKind;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.PollOutcome;
import com.vlrnotify.infrastructure.scraper.HttpClientUtil;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VlrEventSource with the network call replaced.
 */
class VlrEventSourceTest {

    @Test
    void testPollCombinesListingsWithResultsWinning() {
        VlrEventSource source = new FixtureSource(Map.of("upcoming", "upcoming.json", "results", "results.json"));

        PollOutcome outcome = source.poll();

        assertFalse(outcome.isFailed());
        List<MatchEvent> events = outcome.getEvents();
        assertEquals(4, events.size());
        MatchEvent finished = events.stream()
            .filter(e -> e.getExternalId().equals("353177"))
            .findFirst()
            .orElseThrow();
        assertEquals(EventKind.RESULT, finished.getKind());
        assertEquals(1, events.stream().filter(e -> e.getExternalId().equals("353177")).count());
    }

    @Test
    void testTransportFailureIsReportedNotThrown() {
        VlrEventSource source = new VlrEventSource("http://localhost", Duration.ofSeconds(1), new VlrEventMapper()) {
            @Override
            protected JsonNode fetch(String query) throws IOException {
                throw new HttpClientUtil.HttpStatusException(503, "unavailable");
            }
        };

        PollOutcome outcome = source.poll();

        assertTrue(outcome.isFailed());
        assertTrue(outcome.getFailureReason().contains("503"));
    }

    @Test
    void testMalformedResultsFailWholeCycle() {
        VlrEventSource source = new VlrEventSource("http://localhost", Duration.ofSeconds(1), new VlrEventMapper()) {
            @Override
            protected JsonNode fetch(String query) throws IOException {
                if (query.equals("upcoming")) {
                    return VlrEventMapperTest.fixture("upcoming.json");
                }
                return VlrEventMapperTest.fixture("upcoming.json").get("data");
            }
        };

        assertTrue(source.poll().isFailed());
    }

    @Test
    void testSourceName() {
        assertEquals("vlr", new VlrEventSource("https://example.org/", 1000).getSourceName());
    }

    private static class FixtureSource extends VlrEventSource {
        private final Map<String, String> fixtures;

        FixtureSource(Map<String, String> fixtures) {
            super("http://localhost", Duration.ofSeconds(1), new VlrEventMapper());
            this.fixtures = fixtures;
        }

        @Override
        protected JsonNode fetch(String query) throws IOException {
            return VlrEventMapperTest.fixture(fixtures.get(query));
        }
    }
}
