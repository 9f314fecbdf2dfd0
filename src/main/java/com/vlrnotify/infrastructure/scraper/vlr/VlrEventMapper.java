package com.vlrnotify.infrastructure.scraper.vlr;

import com.fasterxml.jackson.databind.JsonNode;
import com.vlrnotify.domain.model.EventKind;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.MatchScore;
import com.vlrnotify.domain.model.Participants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps vlr.gg match listings into MatchEvent records.
 *
 * Payload shape: {@code {"data": {"status": 200, "segments": [ ... ]}}}, one segment per match.
 * The mapping is deterministic: nothing derived from the current time ends up in an event,
 * so an unchanged listing always yields equal events.
 */
public class VlrEventMapper {

    private static final Logger logger = LoggerFactory.getLogger(VlrEventMapper.class);

    public static final String BASE_URL = "https://www.vlr.gg";
    public static final String STATUS_UPCOMING = "Upcoming";
    public static final String STATUS_LIVE = "LIVE";
    public static final String STATUS_COMPLETED = "Completed";

    private static final Pattern MATCH_ID = Pattern.compile("^(?:https?://(?:www\\.)?vlr\\.gg)?/(\\d+)(?:/.*)?$");
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Listing payload without the expected envelope.
     */
    public static class MalformedPayloadException extends IOException {
        public MalformedPayloadException(String message) {
            super(message);
        }
    }

    /**
     * Maps the upcoming/live listing. Segments that cannot be mapped are skipped with a warning.
     */
    public List<MatchEvent> mapUpcoming(JsonNode root) throws MalformedPayloadException {
        List<MatchEvent> events = new ArrayList<>();
        for (JsonNode segment : segments(root)) {
            try {
                events.add(mapUpcomingSegment(segment));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping upcoming match record: {}", e.getMessage());
            }
        }
        return events;
    }

    /**
     * Maps the completed-results listing. Segments that cannot be mapped are skipped with a warning.
     */
    public List<MatchEvent> mapResults(JsonNode root) throws MalformedPayloadException {
        List<MatchEvent> events = new ArrayList<>();
        for (JsonNode segment : segments(root)) {
            try {
                events.add(mapResultSegment(segment));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping result record: {}", e.getMessage());
            }
        }
        return events;
    }

    MatchEvent mapUpcomingSegment(JsonNode segment) {
        MatchEvent event = baseEvent(segment, EventKind.MATCH);
        event.setEventGroup(cleanText(text(segment, "match_event")));
        event.setSeries(cleanText(text(segment, "match_series")));

        String eta = text(segment, "time_until_match");
        event.setStatus(eta != null && eta.trim().equalsIgnoreCase(STATUS_LIVE) ? STATUS_LIVE : STATUS_UPCOMING);

        Instant scheduled = parseTimestamp(text(segment, "unix_timestamp"));
        if (scheduled == null) {
            throw new IllegalArgumentException("match " + event.getExternalId() + " has no start time");
        }
        event.setScheduledTime(scheduled);
        return event;
    }

    MatchEvent mapResultSegment(JsonNode segment) {
        MatchEvent event = baseEvent(segment, EventKind.RESULT);
        event.setEventGroup(cleanText(text(segment, "tournament_name")));
        event.setSeries(cleanText(text(segment, "round_info")));
        event.setStatus(STATUS_COMPLETED);
        event.setScore(new MatchScore(parseScore(segment, "score1"), parseScore(segment, "score2")));
        return event;
    }

    private MatchEvent baseEvent(JsonNode segment, EventKind kind) {
        String page = text(segment, "match_page");
        String externalId = extractMatchId(page);
        if (externalId == null) {
            throw new IllegalArgumentException("no match id in match_page '" + page + "'");
        }
        String team1 = cleanText(text(segment, "team1"));
        String team2 = cleanText(text(segment, "team2"));
        if (team1 == null || team2 == null) {
            throw new IllegalArgumentException("match " + externalId + " is missing a team name");
        }

        Participants participants = new Participants(team1, team2);
        participants.setFirstFlag(flagCode(text(segment, "flag1")));
        participants.setSecondFlag(flagCode(text(segment, "flag2")));

        MatchEvent event = new MatchEvent();
        event.setExternalId(externalId);
        event.setKind(kind);
        event.setParticipants(participants);
        event.setUrl(absoluteUrl(page));
        return event;
    }

    private static List<JsonNode> segments(JsonNode root) throws MalformedPayloadException {
        if (root == null || !root.has("data")) {
            throw new MalformedPayloadException("missing 'data' envelope");
        }
        JsonNode segments = root.get("data").get("segments");
        if (segments == null || !segments.isArray()) {
            throw new MalformedPayloadException("missing 'data.segments' array");
        }
        List<JsonNode> list = new ArrayList<>();
        segments.forEach(list::add);
        return list;
    }

    /**
     * Extracts the numeric match id from a match page link, absolute or relative.
     */
    public static String extractMatchId(String matchPage) {
        if (matchPage == null) {
            return null;
        }
        Matcher m = MATCH_ID.matcher(matchPage.trim());
        return m.matches() ? m.group(1) : null;
    }

    static String absoluteUrl(String page) {
        String trimmed = page.trim();
        return trimmed.startsWith("http") ? trimmed : BASE_URL + trimmed;
    }

    /**
     * Turns "flag_us", "mod-us" or "us" into "us". Anything that is not a two-letter code yields null.
     */
    static String flagCode(String raw) {
        if (raw == null) {
            return null;
        }
        String code = raw.trim();
        int cut = Math.max(code.lastIndexOf('_'), code.lastIndexOf('-'));
        if (cut >= 0) {
            code = code.substring(cut + 1);
        }
        code = code.toLowerCase(Locale.ROOT);
        return code.matches("[a-z]{2}") ? code : null;
    }

    /**
     * Accepts "yyyy-MM-dd HH:mm:ss" in UTC or epoch seconds.
     */
    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (value.matches("\\d{9,}")) {
            return Instant.ofEpochSecond(Long.parseLong(value));
        }
        try {
            return LocalDateTime.parse(value, TIMESTAMP_FORMATTER).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unparseable start time '" + value + "'");
        }
    }

    private static Integer parseScore(JsonNode segment, String field) {
        String raw = text(segment, field);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad " + field + " '" + raw + "'");
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Trims and collapses the tabs and newlines the site leaves in names.
     */
    static String cleanText(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replaceAll("\\s+", " ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }
}
