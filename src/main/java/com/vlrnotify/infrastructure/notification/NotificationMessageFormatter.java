package com.vlrnotify.infrastructure.notification;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.MatchScore;
import com.vlrnotify.domain.model.Notification;
import com.vlrnotify.domain.model.Participants;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders notifications as Discord message payloads with a single embed.
 */
public class NotificationMessageFormatter {

    public static final int EMBED_COLOR = 0xff4654;

    private static final String BELL = "🔔";
    private static final String CHECK_MARK = "✅";
    private static final String TROPHY = "🏆";
    private static final int REGIONAL_INDICATOR_OFFSET = 127397;
    private static final String BLANK_FIELD = "\u200B";

    private static final DateTimeFormatter START_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'", Locale.ROOT).withZone(ZoneOffset.UTC);

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    /**
     * Builds the {@code POST /channels/{id}/messages} body for a notification.
     *
     * @param now reference time for the "in 12m" / "started 3m ago" title
     */
    public ObjectNode format(Notification notification, Instant now) {
        ObjectNode embed = notification.type() == Notification.Type.RESULT
            ? resultEmbed(notification)
            : upcomingEmbed(notification, now);

        ObjectNode message = nodes.objectNode();
        message.putArray("embeds").add(embed);
        // No pings from team or event names
        message.putObject("allowed_mentions").putArray("parse");
        return message;
    }

    ObjectNode upcomingEmbed(Notification notification, Instant now) {
        MatchEvent event = notification.event();
        String title;
        if (notification.late()) {
            long minutes = Math.max(0, Duration.between(event.getScheduledTime(), now).toMinutes());
            title = BELL + " Match started " + minutes + " min ago";
        } else {
            title = BELL + " Upcoming Match in " + formatEta(Duration.between(now, event.getScheduledTime()));
        }

        ObjectNode embed = baseEmbed(title, notification.reason(), event.getUrl());
        ArrayNode fields = embed.putArray("fields");
        fields.add(field(orDash(event.getEventGroup()),
            orDash(event.getSeries()) + " | " + START_FORMATTER.format(event.getScheduledTime()), false));

        Participants participants = event.getParticipants();
        fields.add(field(withFlag(participants.getFirstFlag(), participants.getFirst()), BLANK_FIELD, true));
        fields.add(field(withFlag(participants.getSecondFlag(), participants.getSecond()), BLANK_FIELD, true));
        return embed;
    }

    ObjectNode resultEmbed(Notification notification) {
        MatchEvent event = notification.event();
        ObjectNode embed = baseEmbed(CHECK_MARK + " Match Complete", notification.reason(), event.getUrl());

        Participants participants = event.getParticipants();
        String matchup = withFlag(participants.getFirstFlag(), participants.getFirst())
            + " vs. " + withFlag(participants.getSecondFlag(), participants.getSecond());

        ArrayNode fields = embed.putArray("fields");
        fields.add(field(matchup, "||" + scoreLine(event.getScore()) + "||", false));
        fields.add(field("Event", "*" + orDash(event.getEventGroup()) + "*", false));
        return embed;
    }

    private ObjectNode baseEmbed(String title, String reason, String url) {
        ObjectNode embed = nodes.objectNode();
        embed.put("title", title);
        if (reason != null) {
            embed.put("description", "*Subscribed: " + reason + "*");
        }
        embed.put("color", EMBED_COLOR);
        if (url != null) {
            embed.put("url", url);
        }
        return embed;
    }

    private ObjectNode field(String name, String value, boolean inline) {
        ObjectNode field = nodes.objectNode();
        field.put("name", name);
        field.put("value", value);
        field.put("inline", inline);
        return field;
    }

    static String scoreLine(MatchScore score) {
        if (score == null || score.getFirst() == null || score.getSecond() == null) {
            return "? : ?";
        }
        int winner = score.winner();
        return (winner == 1 ? TROPHY + " " : "") + score.getFirst() + " : " + score.getSecond()
            + (winner == 2 ? " " + TROPHY : "");
    }

    /**
     * "45m", "2h 5m" or "now".
     */
    static String formatEta(Duration untilStart) {
        long minutes = untilStart.toMinutes();
        if (minutes <= 0) {
            return "now";
        }
        long hours = minutes / 60;
        long rest = minutes % 60;
        if (hours == 0) {
            return rest + "m";
        }
        return rest == 0 ? hours + "h" : hours + "h " + rest + "m";
    }

    /**
     * Two-letter country code to regional indicator flag, e.g. "us" to 🇺🇸. Empty for anything else.
     */
    public static String flagEmoji(String countryCode) {
        if (countryCode == null || !countryCode.matches("[A-Za-z]{2}")) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (char c : countryCode.toUpperCase(Locale.ROOT).toCharArray()) {
            sb.appendCodePoint(c + REGIONAL_INDICATOR_OFFSET);
        }
        return sb.toString();
    }

    private static String withFlag(String countryCode, String name) {
        String flag = flagEmoji(countryCode);
        return flag.isEmpty() ? orDash(name) : flag + " " + orDash(name);
    }

    private static String orDash(String text) {
        return text == null || text.isBlank() ? "-" : text;
    }
}
