package com.vlrnotify.infrastructure.scraper.vlr;

import com.fasterxml.jackson.databind.JsonNode;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.PollOutcome;
import com.vlrnotify.domain.ports.EventSource;
import com.vlrnotify.infrastructure.scraper.HttpClientUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Poller for vlr.gg upcoming matches and results.
 *
 * Flow:
 * 1) Fetch the upcoming/live listing
 * 2) Fetch the completed-results listing
 * 3) Normalize both, results win when an id appears in both
 *
 * Either fetch failing fails the whole cycle.
 */
@Component
public class VlrEventSource implements EventSource {

    private static final Logger logger = LoggerFactory.getLogger(VlrEventSource.class);

    private static final String SOURCE_NAME = "vlr";

    private static final Map<String, String> HEADERS = Map.of(
        "accept", "application/json",
        "user-agent", "vlr-match-notifier/1.0"
    );

    private final String baseUrl;
    private final Duration timeout;
    private final VlrEventMapper mapper;

    @Autowired
    public VlrEventSource(
            @Value("${vlr.source.base-url:https://vlrggapi.vercel.app}") String baseUrl,
            @Value("${vlr.source.timeout-ms:10000}") long timeoutMs) {
        this(baseUrl, Duration.ofMillis(timeoutMs), new VlrEventMapper());
    }

    VlrEventSource(String baseUrl, Duration timeout, VlrEventMapper mapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.mapper = mapper;
    }

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    @Override
    public PollOutcome poll() {
        logger.info("Polling vlr matches from {}", baseUrl);
        try {
            List<MatchEvent> upcoming = mapper.mapUpcoming(fetch("upcoming"));
            List<MatchEvent> results = mapper.mapResults(fetch("results"));
            logger.info("Fetched {} upcoming matches and {} results from vlr", upcoming.size(), results.size());
            return PollOutcome.success(combine(upcoming, results));
        } catch (IOException e) {
            logger.error("vlr poll failed: {}", e.getMessage());
            return PollOutcome.failed(e.getMessage());
        } catch (RuntimeException e) {
            logger.error("vlr poll failed unexpectedly", e);
            return PollOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Hook for tests to replace the network call.
     */
    protected JsonNode fetch(String query) throws IOException {
        return HttpClientUtil.getJson(baseUrl + "/match", Map.of("q", query), HEADERS, timeout);
    }

    static List<MatchEvent> combine(List<MatchEvent> upcoming, List<MatchEvent> results) {
        Map<String, MatchEvent> byId = new LinkedHashMap<>();
        for (MatchEvent event : upcoming) {
            byId.putIfAbsent(event.getExternalId(), event);
        }
        for (MatchEvent event : results) {
            byId.put(event.getExternalId(), event);
        }
        return new ArrayList<>(byId.values());
    }
}
