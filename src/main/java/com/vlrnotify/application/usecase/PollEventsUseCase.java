package com.vlrnotify.application.usecase;

import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.PollOutcome;
import com.vlrnotify.domain.model.UpsertResult;
import com.vlrnotify.domain.ports.EventSource;
import com.vlrnotify.domain.ports.EventStore;
import com.vlrnotify.domain.ports.EventStoreException;
import com.vlrnotify.infrastructure.config.NotifierProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Use case for polling every event source in parallel and merging the results into the store.
 *
 * Only one poll runs at a time; a poll requested while another is in flight is skipped.
 */
@Service
public class PollEventsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(PollEventsUseCase.class);

    private final List<EventSource> sources;
    private final EventStore eventStore;
    private final Duration pollTimeout;
    private final ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Instant lastSuccessfulPoll;

    public PollEventsUseCase(List<EventSource> sources, EventStore eventStore, NotifierProperties properties) {
        this.sources = sources;
        this.eventStore = eventStore;
        this.pollTimeout = properties.pollTimeout();
        // One thread per source, polls do not overlap
        this.executorService = Executors.newFixedThreadPool(Math.max(sources.size(), 1));
    }

    /**
     * Runs one poll cycle over all sources.
     *
     * @return Summary of the poll, flagged as skipped if another poll was running
     */
    public PollSummary execute() {
        if (!running.compareAndSet(false, true)) {
            logger.info("Poll already in progress, skipping");
            return PollSummary.skippedRun();
        }
        try {
            return pollAll();
        } finally {
            running.set(false);
        }
    }

    private PollSummary pollAll() {
        logger.info("Starting event poll with {} sources", sources.size());

        Map<String, Integer> eventsBySource = new HashMap<>();
        Map<String, String> errors = new HashMap<>();
        int inserted = 0;
        int changed = 0;
        int unchanged = 0;

        List<CompletableFuture<SourceResult>> futures = sources.stream()
            .map(source -> CompletableFuture.supplyAsync(() -> pollSource(source), executorService)
                .completeOnTimeout(
                    new SourceResult(source.getSourceName(),
                        PollOutcome.failed("timed out after " + pollTimeout.toMillis() + " ms")),
                    pollTimeout.toMillis(), TimeUnit.MILLISECONDS))
            .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        boolean anySuccess = false;
        for (CompletableFuture<SourceResult> future : futures) {
            SourceResult result = future.join();
            PollOutcome outcome = result.outcome();
            if (outcome.isFailed()) {
                // Store stays untouched for this source
                errors.put(result.sourceName(), outcome.getFailureReason());
                logger.error("Source {} failed: {}", result.sourceName(), outcome.getFailureReason());
                continue;
            }
            anySuccess = true;
            eventsBySource.put(result.sourceName(), outcome.getEvents().size());

            Instant seenAt = Instant.now();
            for (MatchEvent event : outcome.getEvents()) {
                try {
                    UpsertResult upsert = eventStore.upsert(event, seenAt);
                    if (upsert.isInserted()) {
                        inserted++;
                    } else if (upsert.isChanged()) {
                        changed++;
                    } else {
                        unchanged++;
                    }
                } catch (EventStoreException e) {
                    logger.error("Error storing event {}", event.getExternalId(), e);
                    errors.put("store:" + event.getExternalId(), e.getMessage());
                }
            }
        }

        if (anySuccess) {
            lastSuccessfulPoll = Instant.now();
        }
        logger.info("Poll finished: {} inserted, {} updated, {} unchanged, {} errors",
            inserted, changed, unchanged, errors.size());
        return new PollSummary(false, eventsBySource, errors, inserted, changed, unchanged);
    }

    private SourceResult pollSource(EventSource source) {
        String sourceName = source.getSourceName();
        try {
            return new SourceResult(sourceName, source.poll());
        } catch (Exception e) {
            logger.error("Source {} threw during poll", sourceName, e);
            return new SourceResult(sourceName, PollOutcome.failed(e.getMessage()));
        }
    }

    /**
     * Time of the last poll in which at least one source succeeded, null before the first one.
     */
    public Instant getLastSuccessfulPoll() {
        return lastSuccessfulPoll;
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }

    private record SourceResult(String sourceName, PollOutcome outcome) {}

    public record PollSummary(
        boolean skipped,
        Map<String, Integer> eventsBySource,
        Map<String, String> errors,
        int inserted,
        int updated,
        int unchanged
    ) {
        static PollSummary skippedRun() {
            return new PollSummary(true, Map.of(), Map.of(), 0, 0, 0);
        }
    }
}
