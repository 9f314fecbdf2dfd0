package com.vlrnotify.infrastructure.persistence;

import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.Subscription;
import com.vlrnotify.domain.model.SubscriptionKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileGuildSettingsRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void testUnknownGuildGetsDefaults() {
        JsonFileGuildSettingsRepository repository = new JsonFileGuildSettingsRepository(tempDir.resolve("guilds.json"));

        GuildSettings settings = repository.get(1L);

        assertEquals(1L, settings.getGuildId());
        assertTrue(repository.getNotificationChannel(1L).isEmpty());
        assertEquals(Duration.ofMinutes(15), repository.getLeadTime(1L));
        assertTrue(settings.getSubscriptions().isEmpty());
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    void testSavedSettingsSurviveReopen() {
        Path file = tempDir.resolve("guilds.json");
        JsonFileGuildSettingsRepository repository = new JsonFileGuildSettingsRepository(file);
        GuildSettings settings = new GuildSettings(9L);
        settings.setChannelId(123L);
        settings.setLeadTimeMinutes(5);
        settings.getSubscriptions().add(new Subscription(9L, SubscriptionKind.TEAM, "NRG"));
        repository.save(settings);

        JsonFileGuildSettingsRepository reopened = new JsonFileGuildSettingsRepository(file);

        assertEquals(123L, reopened.getNotificationChannel(9L).orElseThrow());
        assertEquals(Duration.ofMinutes(5), reopened.getLeadTime(9L));
        assertEquals(1, reopened.getSubscriptions(9L).size());
        assertTrue(reopened.getSubscriptions(9L).get(0).matches("nrg"));
        assertEquals(1, reopened.findAll().size());
    }

    @Test
    void testCallerChangesDoNotLeakIntoStore() {
        JsonFileGuildSettingsRepository repository = new JsonFileGuildSettingsRepository(tempDir.resolve("guilds.json"));
        repository.save(new GuildSettings(9L));

        repository.get(9L).setChannelId(55L);

        assertNull(repository.get(9L).getChannelId());
    }
}
