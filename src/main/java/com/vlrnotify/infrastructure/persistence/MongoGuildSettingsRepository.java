package com.vlrnotify.infrastructure.persistence;

import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.model.Sorts;
import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.Subscription;
import com.vlrnotify.domain.model.SubscriptionKind;
import com.vlrnotify.domain.ports.EventStoreException;
import com.vlrnotify.domain.ports.GuildSettingsRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * MongoDB implementation of GuildSettingsRepository, one document per guild.
 */
@Repository
@ConditionalOnProperty(name = "vlr.store.type", havingValue = "mongo")
public class MongoGuildSettingsRepository implements GuildSettingsRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoGuildSettingsRepository.class);

    private final MongoCollection<Document> collection;

    public MongoGuildSettingsRepository(
            MongoClient mongoClient,
            @Value("${mongodb.database:vlr}") String databaseName,
            @Value("${mongodb.collection.guilds:guilds}") String collectionName) {
        this.collection = mongoClient.getDatabase(databaseName).getCollection(collectionName);
        try {
            collection.createIndex(Indexes.ascending("guildId"), new IndexOptions().unique(true));
            logger.info("MongoDB indexes initialized for collection: {}", collectionName);
        } catch (MongoException e) {
            throw new EventStoreException("Cannot open guild collection " + collectionName, e);
        }
    }

    @Override
    public GuildSettings get(long guildId) {
        try {
            Document doc = collection.find(Filters.eq("guildId", guildId)).first();
            return doc != null ? fromDocument(doc) : new GuildSettings(guildId);
        } catch (MongoException e) {
            throw new EventStoreException("Cannot load settings for guild " + guildId, e);
        }
    }

    @Override
    public List<GuildSettings> findAll() {
        try {
            List<GuildSettings> all = new ArrayList<>();
            collection.find().sort(Sorts.ascending("guildId")).forEach(doc -> all.add(fromDocument(doc)));
            return all;
        } catch (MongoException e) {
            throw new EventStoreException("Cannot load guild settings", e);
        }
    }

    @Override
    public void save(GuildSettings settings) {
        try {
            collection.replaceOne(
                Filters.eq("guildId", settings.getGuildId()),
                toDocument(settings),
                new ReplaceOptions().upsert(true));
        } catch (MongoException e) {
            throw new EventStoreException("Cannot save settings for guild " + settings.getGuildId(), e);
        }
    }

    static Document toDocument(GuildSettings settings) {
        List<Document> subscriptions = new ArrayList<>();
        for (Subscription s : settings.getSubscriptions()) {
            subscriptions.add(new Document("kind", s.getKind().name()).append("value", s.getValue()));
        }
        return new Document("guildId", settings.getGuildId())
            .append("channelId", settings.getChannelId())
            .append("leadTimeMinutes", settings.getLeadTimeMinutes())
            .append("subscriptions", subscriptions);
    }

    static GuildSettings fromDocument(Document doc) {
        long guildId = doc.get("guildId", Number.class).longValue();
        GuildSettings settings = new GuildSettings(guildId);
        Number channelId = doc.get("channelId", Number.class);
        settings.setChannelId(channelId != null ? channelId.longValue() : null);
        settings.setLeadTimeMinutes(doc.getInteger("leadTimeMinutes", GuildSettings.DEFAULT_LEAD_TIME_MINUTES));
        List<Subscription> subscriptions = new ArrayList<>();
        for (Document s : doc.getList("subscriptions", Document.class, List.of())) {
            subscriptions.add(new Subscription(guildId, SubscriptionKind.valueOf(s.getString("kind")), s.getString("value")));
        }
        settings.setSubscriptions(subscriptions);
        return settings;
    }
}
