package com.vlrnotify.application.usecase;

import com.vlrnotify.application.service.SubscriptionResolver;
import com.vlrnotify.domain.model.DeliveryResult;
import com.vlrnotify.domain.model.EventKind;
import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.MatchScore;
import com.vlrnotify.domain.model.Notification;
import com.vlrnotify.domain.model.Participants;
import com.vlrnotify.domain.model.Subscription;
import com.vlrnotify.domain.model.SubscriptionKind;
import com.vlrnotify.domain.ports.NotificationSender;
import com.vlrnotify.infrastructure.config.NotifierProperties;
import com.vlrnotify.infrastructure.persistence.JsonFileEventStore;
import com.vlrnotify.infrastructure.persistence.JsonFileGuildSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DispatchNotificationsUseCase against the file-backed stores.
 */
class DispatchNotificationsUseCaseTest {

    private static final Instant START = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private JsonFileEventStore store;
    private JsonFileGuildSettingsRepository guilds;
    private RecordingSender sender;
    private DispatchNotificationsUseCase useCase;

    @BeforeEach
    void setUp() {
        store = new JsonFileEventStore(tempDir.resolve("events.json"));
        guilds = new JsonFileGuildSettingsRepository(tempDir.resolve("guilds.json"));
        sender = new RecordingSender();
        useCase = newUseCase();
    }

    private DispatchNotificationsUseCase newUseCase() {
        return new DispatchNotificationsUseCase(store, guilds, new SubscriptionResolver(), sender,
            NotifierProperties.defaults());
    }

    @Test
    void testFailedGuildDoesNotBlockOthers() {
        guild(1L, 101L, 15, team("Sentinels"));
        guild(2L, 102L, 15, team("NRG"));
        sender.failingChannels.add(101L);
        store.upsert(match("900", START), START.minus(Duration.ofHours(1)));

        DispatchNotificationsUseCase.DispatchSummary summary = useCase.execute(START.minus(Duration.ofMinutes(10)));

        assertEquals(1, summary.getDelivered());
        assertEquals(1, summary.getFailures().size());
        assertTrue(summary.getFailures().get(0).contains("guild 1"));
        assertEquals(1, summary.getNotified());
        assertEquals(2, sender.sent.size());
        assertTrue(store.findByExternalId("900").orElseThrow().isNotified());

        useCase.execute(START.minus(Duration.ofMinutes(9)));
        assertEquals(2, sender.sent.size());
        assertEquals(1, sender.sentTo(102L).size());
    }

    @Test
    void testNoRepeatAcrossTicksAndRestart() {
        guild(1L, 101L, 15, team("Sentinels"));
        store.upsert(match("900", START), START.minus(Duration.ofHours(1)));

        useCase.execute(START.minus(Duration.ofMinutes(14)));
        useCase.execute(START.minus(Duration.ofMinutes(13)));

        store = new JsonFileEventStore(tempDir.resolve("events.json"));
        guilds = new JsonFileGuildSettingsRepository(tempDir.resolve("guilds.json"));
        newUseCase().execute(START.minus(Duration.ofMinutes(12)));
        newUseCase().execute(START.plus(Duration.ofMinutes(1)));

        assertEquals(1, sender.sent.size());
        assertFalse(sender.sent.get(0).notification().late());
    }

    @Test
    void testClaimedGuildIsNotSentAgain() {
        guild(1L, 101L, 15, team("Sentinels"));
        guild(2L, 102L, 15, team("Sentinels"));
        store.upsert(match("900", START), START.minus(Duration.ofHours(1)));
        // Previous run handed guild 1 the message and stopped before marking the match
        store.claimDelivery("900", 1L);

        useCase.execute(START.minus(Duration.ofMinutes(5)));

        assertEquals(List.of(102L), sender.channels());
        assertTrue(store.findByExternalId("900").orElseThrow().isNotified());
    }

    @Test
    void testGuildWithShorterLeadTimeIsDeferred() {
        guild(1L, 101L, 60, team("Sentinels"));
        guild(2L, 102L, 10, team("Sentinels"));
        store.upsert(match("900", START), START.minus(Duration.ofHours(2)));

        DispatchNotificationsUseCase.DispatchSummary early = useCase.execute(START.minus(Duration.ofMinutes(30)));

        assertEquals(List.of(101L), sender.channels());
        assertEquals(1, early.getDeferred());
        assertFalse(store.findByExternalId("900").orElseThrow().isNotified());

        useCase.execute(START.minus(Duration.ofMinutes(9)));

        assertEquals(List.of(101L, 102L), sender.channels());
        assertTrue(store.findByExternalId("900").orElseThrow().isNotified());
    }

    @Test
    void testMissedMatchIsSentLateOnce() {
        guild(1L, 101L, 15, team("NRG"));
        store.upsert(match("900", START), START.minus(Duration.ofHours(1)));

        DispatchNotificationsUseCase.DispatchSummary summary = useCase.execute(START.plus(Duration.ofMinutes(5)));
        useCase.execute(START.plus(Duration.ofMinutes(6)));

        assertEquals(1, summary.getNotified());
        assertEquals(1, sender.sent.size());
        assertTrue(sender.sent.get(0).notification().late());
        MatchEvent stored = store.findByExternalId("900").orElseThrow();
        assertTrue(stored.isNotified());
        assertTrue(stored.isLate());
    }

    @Test
    void testUnsubscribedMatchIsSettledWithoutMessages() {
        guild(1L, 101L, 15, team("LOUD"));
        store.upsert(match("900", START), START.minus(Duration.ofHours(1)));

        DispatchNotificationsUseCase.DispatchSummary summary = useCase.execute(START.minus(Duration.ofMinutes(5)));

        assertTrue(sender.sent.isEmpty());
        assertEquals(1, summary.getNotified());
        assertTrue(store.findByExternalId("900").orElseThrow().isNotified());
    }

    @Test
    void testGuildWithoutChannelIsSkipped() {
        GuildSettings settings = new GuildSettings(1L);
        settings.getSubscriptions().add(new Subscription(1L, SubscriptionKind.TEAM, "Sentinels"));
        guilds.save(settings);
        store.upsert(match("900", START), START.minus(Duration.ofHours(1)));

        useCase.execute(START.minus(Duration.ofMinutes(5)));

        assertTrue(sender.sent.isEmpty());
    }

    @Test
    void testSenderExceptionIsRecordedAsFailure() {
        guild(1L, 101L, 15, team("Sentinels"));
        sender.throwing = true;
        store.upsert(match("900", START), START.minus(Duration.ofHours(1)));

        DispatchNotificationsUseCase.DispatchSummary summary = useCase.execute(START.minus(Duration.ofMinutes(5)));

        assertEquals(1, summary.getFailures().size());
        assertTrue(store.findByExternalId("900").orElseThrow().isNotified());
    }

    @Test
    void testResultIsAnnouncedOnceAfterCompletion() {
        guild(1L, 101L, 15, event("Champions Tour 2024: Americas Stage 2"));
        store.upsert(match("900", START), START.minus(Duration.ofHours(1)));
        useCase.execute(START.minus(Duration.ofMinutes(5)));

        MatchEvent result = match("900", null);
        result.setKind(EventKind.RESULT);
        result.setStatus("Completed");
        result.setScore(new MatchScore(2, 1));
        store.upsert(result, START.plus(Duration.ofHours(1)));

        DispatchNotificationsUseCase.DispatchSummary summary = useCase.execute(START.plus(Duration.ofHours(1)));
        useCase.execute(START.plus(Duration.ofMinutes(61)));

        assertEquals(1, summary.getResults());
        assertEquals(2, sender.sent.size());
        Notification announced = sender.sent.get(1).notification();
        assertEquals(Notification.Type.RESULT, announced.type());
        assertEquals("Event: Champions Tour 2024: Americas Stage 2", announced.reason());
        assertTrue(store.findByExternalId("900").orElseThrow().isResultNotified());
    }

    @Test
    void testResultMarkedOnlyAfterDeliveryAttempts() {
        guild(1L, 101L, 15, team("Sentinels"));
        store.upsert(match("900", START), START.minus(Duration.ofHours(1)));
        useCase.execute(START.minus(Duration.ofMinutes(5)));

        MatchEvent result = match("900", null);
        result.setKind(EventKind.RESULT);
        result.setStatus("Completed");
        result.setScore(new MatchScore(0, 2));
        store.upsert(result, START.plus(Duration.ofHours(1)));

        List<Boolean> flagDuringSend = new ArrayList<>();
        sender.onSend = notification -> {
            if (notification.type() == Notification.Type.RESULT) {
                flagDuringSend.add(store.findByExternalId("900").orElseThrow().isResultNotified());
            }
        };
        sender.throwing = true;

        DispatchNotificationsUseCase.DispatchSummary summary = useCase.execute(START.plus(Duration.ofHours(1)));

        assertEquals(List.of(false), flagDuringSend);
        assertEquals(1, summary.getFailures().size());
        assertEquals(1, summary.getResults());
        assertTrue(store.findByExternalId("900").orElseThrow().isResultNotified());
    }

    private void guild(long guildId, long channelId, int leadMinutes, Subscription... subscriptions) {
        GuildSettings settings = new GuildSettings(guildId);
        settings.setChannelId(channelId);
        settings.setLeadTimeMinutes(leadMinutes);
        for (Subscription s : subscriptions) {
            settings.getSubscriptions().add(new Subscription(guildId, s.getKind(), s.getValue()));
        }
        guilds.save(settings);
    }

    private static Subscription team(String name) {
        return new Subscription(0L, SubscriptionKind.TEAM, name);
    }

    private static Subscription event(String name) {
        return new Subscription(0L, SubscriptionKind.EVENT_GROUP, name);
    }

    private static MatchEvent match(String id, Instant start) {
        MatchEvent event = new MatchEvent();
        event.setExternalId(id);
        event.setKind(EventKind.MATCH);
        event.setParticipants(new Participants("Sentinels", "NRG"));
        event.setEventGroup("Champions Tour 2024: Americas Stage 2");
        event.setStatus("Upcoming");
        event.setScheduledTime(start);
        event.setUrl("https://www.vlr.gg/" + id);
        return event;
    }

    private record Sent(long channelId, Notification notification) {}

    private static class RecordingSender implements NotificationSender {
        private final List<Sent> sent = new ArrayList<>();
        private final Set<Long> failingChannels = new HashSet<>();
        private boolean throwing;
        private Consumer<Notification> onSend = notification -> { };

        @Override
        public DeliveryResult send(long channelId, Notification notification) {
            sent.add(new Sent(channelId, notification));
            onSend.accept(notification);
            if (throwing) {
                throw new IllegalStateException("boom");
            }
            return failingChannels.contains(channelId) ? DeliveryResult.failed("Missing Access") : DeliveryResult.ok();
        }

        List<Long> channels() {
            return sent.stream().map(Sent::channelId).toList();
        }

        List<Sent> sentTo(long channelId) {
            return sent.stream().filter(s -> s.channelId() == channelId).toList();
        }
    }
}
