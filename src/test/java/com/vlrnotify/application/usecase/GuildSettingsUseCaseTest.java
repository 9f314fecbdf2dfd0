package com.vlrnotify.application.usecase;

import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.SubscriptionKind;
import com.vlrnotify.infrastructure.persistence.JsonFileGuildSettingsRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GuildSettingsUseCaseTest {

    @TempDir
    Path tempDir;

    private JsonFileGuildSettingsRepository repository;
    private GuildSettingsUseCase useCase;

    @BeforeEach
    void setUp() {
        repository = new JsonFileGuildSettingsRepository(tempDir.resolve("guilds.json"));
        useCase = new GuildSettingsUseCase(repository);
    }

    @Test
    void testSetAndClearChannel() {
        useCase.setChannel(1L, 500L);
        assertEquals(500L, repository.getNotificationChannel(1L).orElseThrow());

        useCase.clearChannel(1L);
        assertTrue(repository.getNotificationChannel(1L).isEmpty());
    }

    @Test
    void testLeadTimeBounds() {
        assertEquals(0, useCase.setLeadTime(1L, 0).getLeadTimeMinutes());
        assertEquals(1440, useCase.setLeadTime(1L, 1440).getLeadTimeMinutes());
        assertThrows(IllegalArgumentException.class, () -> useCase.setLeadTime(1L, -1));
        assertThrows(IllegalArgumentException.class, () -> useCase.setLeadTime(1L, 1441));
        assertEquals(1440, repository.get(1L).getLeadTimeMinutes());
    }

    @Test
    void testSubscribeIgnoresCaseDuplicates() {
        assertTrue(useCase.subscribe(1L, SubscriptionKind.TEAM, "Sentinels"));
        assertFalse(useCase.subscribe(1L, SubscriptionKind.TEAM, " sentinels "));
        assertTrue(useCase.subscribe(1L, SubscriptionKind.EVENT_GROUP, "Sentinels"));

        assertEquals(2, repository.getSubscriptions(1L).size());
    }

    @Test
    void testUnsubscribe() {
        useCase.subscribe(1L, SubscriptionKind.TEAM, "NRG");

        assertFalse(useCase.unsubscribe(1L, SubscriptionKind.EVENT_GROUP, "NRG"));
        assertTrue(useCase.unsubscribe(1L, SubscriptionKind.TEAM, "nrg"));
        assertTrue(repository.getSubscriptions(1L).isEmpty());
    }

    @Test
    void testToggle() {
        assertEquals(GuildSettingsUseCase.ToggleResult.SUBSCRIBED,
            useCase.toggle(1L, SubscriptionKind.TEAM, "LOUD"));
        assertEquals(GuildSettingsUseCase.ToggleResult.UNSUBSCRIBED,
            useCase.toggle(1L, SubscriptionKind.TEAM, "LOUD"));
        assertTrue(repository.getSubscriptions(1L).isEmpty());
    }

    @Test
    void testInvalidSubscriptionIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> useCase.subscribe(1L, SubscriptionKind.TEAM, "  "));
        assertThrows(IllegalArgumentException.class, () -> useCase.subscribe(1L, null, "NRG"));
    }

    @Test
    void testSettingsOfOtherGuildsUntouched() {
        useCase.setChannel(1L, 10L);
        useCase.subscribe(2L, SubscriptionKind.TEAM, "NRG");

        GuildSettings first = useCase.get(1L);
        assertTrue(first.getSubscriptions().isEmpty());
        assertNull(useCase.get(2L).getChannelId());
    }
}
