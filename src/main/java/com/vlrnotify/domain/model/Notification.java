package com.vlrnotify.domain.model;

/**
 * A message about one event, addressed to one guild.
 *
 * @param type   upcoming-match or match-complete
 * @param event  snapshot of the event being announced
 * @param reason the subscription that selected this guild, e.g. "Team: Sentinels"
 * @param late   true when an upcoming notification is sent after the scheduled start
 */
public record Notification(Type type, MatchEvent event, String reason, boolean late) {

    public enum Type {
        UPCOMING,
        RESULT
    }

    public static Notification upcoming(MatchEvent event, String reason, boolean late) {
        return new Notification(Type.UPCOMING, event, reason, late);
    }

    public static Notification result(MatchEvent event, String reason) {
        return new Notification(Type.RESULT, event, reason, false);
    }
}
