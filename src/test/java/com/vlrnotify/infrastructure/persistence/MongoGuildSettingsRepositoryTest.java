package com.vlrnotify.infrastructure.persistence;

import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.Subscription;
import com.vlrnotify.domain.model.SubscriptionKind;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MongoGuildSettingsRepositoryTest {

    @Test
    void testDocumentMapping() {
        GuildSettings settings = new GuildSettings(77L);
        settings.setChannelId(88L);
        settings.setLeadTimeMinutes(30);
        settings.getSubscriptions().add(new Subscription(77L, SubscriptionKind.TEAM, "Sentinels"));
        settings.getSubscriptions().add(new Subscription(77L, SubscriptionKind.EVENT_GROUP, "VCT Stage 2"));

        GuildSettings back = MongoGuildSettingsRepository.fromDocument(MongoGuildSettingsRepository.toDocument(settings));

        assertEquals(77L, back.getGuildId());
        assertEquals(88L, back.getChannelId());
        assertEquals(30, back.getLeadTimeMinutes());
        assertEquals(settings.getSubscriptions(), back.getSubscriptions());
    }

    @Test
    void testMissingFieldsFallBackToDefaults() {
        GuildSettings settings = MongoGuildSettingsRepository.fromDocument(new Document("guildId", 5));

        assertNull(settings.getChannelId());
        assertEquals(GuildSettings.DEFAULT_LEAD_TIME_MINUTES, settings.getLeadTimeMinutes());
        assertEquals(List.of(), settings.getSubscriptions());
    }
}
