package com.vlrnotify.infrastructure.rest;

import com.vlrnotify.application.usecase.ListEventsUseCase;
import com.vlrnotify.application.usecase.PollEventsUseCase;
import com.vlrnotify.domain.model.EventKind;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.MatchScore;
import com.vlrnotify.domain.model.Participants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for match polling and listings.
 */
@RestController
@RequestMapping("/vlr")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final PollEventsUseCase pollEventsUseCase;
    private final ListEventsUseCase listEventsUseCase;

    public EventController(PollEventsUseCase pollEventsUseCase, ListEventsUseCase listEventsUseCase) {
        this.pollEventsUseCase = pollEventsUseCase;
        this.listEventsUseCase = listEventsUseCase;
    }

    /**
     * Endpoint to poll all sources now. Does not send notifications.
     *
     * POST /vlr/update
     *
     * @return Summary of the poll
     */
    @PostMapping("/update")
    public ResponseEntity<PollEventsUseCase.PollSummary> update() {
        logger.info("Received request to poll matches");

        try {
            PollEventsUseCase.PollSummary summary = pollEventsUseCase.execute();
            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            logger.error("Error polling matches", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /vlr/matches?n=5&amp;filter=ALL|VCT|GC
     */
    @GetMapping("/matches")
    public ResponseEntity<?> matches(@RequestParam(name = "n", required = false) Integer n,
                                     @RequestParam(name = "filter", required = false) String filter) {
        try {
            ListEventsUseCase.EventListing listing =
                listEventsUseCase.listMatches(n, ListEventsUseCase.Filter.parse(filter));
            return ResponseEntity.ok(ListingResponse.of(listing, Instant.now()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error listing matches", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /vlr/results?n=5&amp;filter=ALL|VCT|GC
     */
    @GetMapping("/results")
    public ResponseEntity<?> results(@RequestParam(name = "n", required = false) Integer n,
                                     @RequestParam(name = "filter", required = false) String filter) {
        try {
            ListEventsUseCase.EventListing listing =
                listEventsUseCase.listResults(n, ListEventsUseCase.Filter.parse(filter));
            return ResponseEntity.ok(ListingResponse.of(listing, Instant.now()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error listing results", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * @param retrievedMinutesAgo whole minutes since the last successful poll, null if none yet
     */
    public record ListingResponse(List<EventView> events, Instant retrievedAt, Long retrievedMinutesAgo) {

        static ListingResponse of(ListEventsUseCase.EventListing listing, Instant now) {
            Long minutesAgo = listing.retrievedAt() != null
                ? Duration.between(listing.retrievedAt(), now).toMinutes()
                : null;
            List<EventView> events = listing.events().stream().map(EventView::of).toList();
            return new ListingResponse(events, listing.retrievedAt(), minutesAgo);
        }
    }

    /**
     * Polled fields of a match or result. Notification state stays internal.
     */
    public record EventView(String id, EventKind kind, String eventGroup, String series, String status,
                            Instant scheduledTime, String url,
                            String firstTeam, String firstFlag, String secondTeam, String secondFlag,
                            Integer firstScore, Integer secondScore) {

        static EventView of(MatchEvent event) {
            Participants participants = event.getParticipants();
            MatchScore score = event.getScore();
            return new EventView(event.getExternalId(), event.getKind(), event.getEventGroup(), event.getSeries(),
                event.getStatus(), event.getScheduledTime(), event.getUrl(),
                participants != null ? participants.getFirst() : null,
                participants != null ? participants.getFirstFlag() : null,
                participants != null ? participants.getSecond() : null,
                participants != null ? participants.getSecondFlag() : null,
                score != null ? score.getFirst() : null,
                score != null ? score.getSecond() : null);
        }
    }
}
