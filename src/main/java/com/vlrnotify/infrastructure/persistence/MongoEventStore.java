package com.vlrnotify.infrastructure.persistence;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import com.vlrnotify.domain.model.EventKind;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.MatchScore;
import com.vlrnotify.domain.model.Participants;
import com.vlrnotify.domain.model.UpsertResult;
import com.vlrnotify.domain.ports.EventStore;
import com.vlrnotify.domain.ports.EventStoreException;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB implementation of EventStore.
 *
 * One document per external id. Writes are serialized per id without any global lock:
 * - upserts replace the document only if its version is unchanged since it was read
 *   (optimistic concurrency, retried on conflict)
 * - notification flags are flipped with conditional single-document updates, so exactly
 *   one caller observes the transition
 */
@Repository
@ConditionalOnProperty(name = "vlr.store.type", havingValue = "mongo")
public class MongoEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoEventStore.class);
    private static final int MAX_UPSERT_ATTEMPTS = 5;

    private final MongoCollection<Document> collection;

    public MongoEventStore(
            MongoClient mongoClient,
            @Value("${mongodb.database:vlr}") String databaseName,
            @Value("${mongodb.collection.events:events}") String collectionName) {
        this.collection = mongoClient.getDatabase(databaseName).getCollection(collectionName);
        initializeIndexes(collectionName);
    }

    /**
     * Opens the collection. Failure here means the store cannot be opened and aborts startup.
     */
    private void initializeIndexes(String collectionName) {
        try {
            collection.createIndex(Indexes.ascending("externalId"), new IndexOptions().unique(true));
            collection.createIndex(Indexes.compoundIndex(
                Indexes.ascending("kind"),
                Indexes.ascending("notified"),
                Indexes.ascending("scheduledTime")));
            collection.createIndex(Indexes.ascending("lastSeenAt"));
            logger.info("MongoDB indexes initialized for collection: {}", collectionName);
        } catch (MongoException e) {
            throw new EventStoreException("Cannot open event collection " + collectionName, e);
        }
    }

    @Override
    public UpsertResult upsert(MatchEvent event, Instant seenAt) {
        if (event == null || event.getExternalId() == null) {
            throw new IllegalArgumentException("Event without externalId");
        }
        String id = event.getExternalId();
        try {
            for (int attempt = 1; attempt <= MAX_UPSERT_ATTEMPTS; attempt++) {
                Document existingDoc = collection.find(Filters.eq("externalId", id)).first();
                MatchEvent existing = existingDoc != null ? fromDocument(existingDoc) : null;
                EventMerger.Merge merge = EventMerger.merge(existing, event, seenAt);

                if (existing == null) {
                    try {
                        collection.insertOne(toDocument(merge.record()));
                        return merge.result();
                    } catch (MongoWriteException e) {
                        if (e.getError().getCategory() != ErrorCategory.DUPLICATE_KEY) {
                            throw e;
                        }
                        // Inserted concurrently, merge into that one
                        continue;
                    }
                }

                UpdateResult result = collection.replaceOne(
                    Filters.and(Filters.eq("externalId", id), Filters.eq("version", existing.getVersion())),
                    toDocument(merge.record()));
                if (result.getModifiedCount() == 1) {
                    return merge.result();
                }
                logger.debug("Version conflict on event {}, attempt {}", id, attempt);
            }
        } catch (MongoException e) {
            throw new EventStoreException("Upsert failed for event " + id, e);
        }
        throw new EventStoreException("Upsert for event " + id + " kept conflicting after "
            + MAX_UPSERT_ATTEMPTS + " attempts");
    }

    @Override
    public List<MatchEvent> dueForNotification(Instant now, Duration leadTime) {
        return findAll(Filters.and(
            Filters.eq("kind", EventKind.MATCH.name()),
            Filters.eq("notified", false),
            Filters.gte("scheduledTime", Date.from(now)),
            Filters.lte("scheduledTime", Date.from(now.plus(leadTime)))
        ), Sorts.ascending("scheduledTime"));
    }

    @Override
    public List<MatchEvent> overdueForNotification(Instant now) {
        return findAll(Filters.and(
            Filters.eq("kind", EventKind.MATCH.name()),
            Filters.eq("notified", false),
            Filters.lt("scheduledTime", Date.from(now))
        ), Sorts.ascending("scheduledTime"));
    }

    @Override
    public List<MatchEvent> dueResultNotifications() {
        return findAll(Filters.and(
            Filters.eq("kind", EventKind.RESULT.name()),
            Filters.ne("completedAt", null),
            Filters.eq("resultNotified", false)
        ), Sorts.ascending("completedAt"));
    }

    @Override
    public boolean markNotified(String externalId, boolean late) {
        return conditionalUpdate(
            Filters.and(Filters.eq("externalId", externalId), Filters.eq("notified", false)),
            Updates.combine(Updates.set("notified", true), Updates.set("late", late), Updates.inc("version", 1L)));
    }

    @Override
    public boolean claimDelivery(String externalId, long guildId) {
        return conditionalUpdate(
            Filters.and(Filters.eq("externalId", externalId), Filters.ne("deliveredGuilds", guildId)),
            Updates.combine(Updates.addToSet("deliveredGuilds", guildId), Updates.inc("version", 1L)));
    }

    @Override
    public boolean markResultNotified(String externalId) {
        return conditionalUpdate(
            Filters.and(Filters.eq("externalId", externalId), Filters.eq("resultNotified", false)),
            Updates.combine(Updates.set("resultNotified", true), Updates.inc("version", 1L)));
    }

    @Override
    public Optional<MatchEvent> findByExternalId(String externalId) {
        try {
            Document doc = collection.find(Filters.eq("externalId", externalId)).first();
            return doc != null ? Optional.of(fromDocument(doc)) : Optional.empty();
        } catch (MongoException e) {
            throw new EventStoreException("Lookup failed for event " + externalId, e);
        }
    }

    @Override
    public List<MatchEvent> findByKind(EventKind kind) {
        List<MatchEvent> events = findAll(Filters.eq("kind", kind.name()), Sorts.ascending("scheduledTime"));
        events.sort(kind == EventKind.MATCH ? EventMerger.EARLIEST_START_FIRST : EventMerger.NEWEST_FIRST);
        return events;
    }

    @Override
    public int removeStale(Instant seenBefore) {
        try {
            DeleteResult result = collection.deleteMany(Filters.and(
                Filters.lt("lastSeenAt", Date.from(seenBefore)),
                Filters.or(Filters.eq("kind", EventKind.RESULT.name()), Filters.eq("notified", true))));
            int removed = (int) result.getDeletedCount();
            if (removed > 0) {
                logger.info("Removed {} stale events last seen before {}", removed, seenBefore);
            }
            return removed;
        } catch (MongoException e) {
            throw new EventStoreException("Stale cleanup failed", e);
        }
    }

    private boolean conditionalUpdate(Bson filter, Bson update) {
        try {
            return collection.updateOne(filter, update).getModifiedCount() == 1;
        } catch (MongoException e) {
            throw new EventStoreException("Update failed", e);
        }
    }

    private List<MatchEvent> findAll(Bson filter, Bson sort) {
        try {
            List<MatchEvent> events = new ArrayList<>();
            collection.find(filter).sort(sort).forEach(doc -> events.add(fromDocument(doc)));
            return events;
        } catch (MongoException e) {
            throw new EventStoreException("Query failed", e);
        }
    }

    static Document toDocument(MatchEvent event) {
        Document doc = new Document("externalId", event.getExternalId())
            .append("kind", event.getKind() != null ? event.getKind().name() : null)
            .append("eventGroup", event.getEventGroup())
            .append("series", event.getSeries())
            .append("status", event.getStatus())
            .append("scheduledTime", toDate(event.getScheduledTime()))
            .append("url", event.getUrl())
            .append("notified", event.isNotified())
            .append("late", event.isLate())
            .append("deliveredGuilds", new ArrayList<>(event.getDeliveredGuilds()))
            .append("completedAt", toDate(event.getCompletedAt()))
            .append("resultNotified", event.isResultNotified())
            .append("firstSeenAt", toDate(event.getFirstSeenAt()))
            .append("lastSeenAt", toDate(event.getLastSeenAt()))
            .append("version", event.getVersion());

        Participants participants = event.getParticipants();
        if (participants != null) {
            doc.append("participants", new Document("first", participants.getFirst())
                .append("second", participants.getSecond())
                .append("firstFlag", participants.getFirstFlag())
                .append("secondFlag", participants.getSecondFlag()));
        }
        MatchScore score = event.getScore();
        if (score != null) {
            doc.append("score", new Document("first", score.getFirst()).append("second", score.getSecond()));
        }
        return doc;
    }

    static MatchEvent fromDocument(Document doc) {
        MatchEvent event = new MatchEvent();
        event.setExternalId(doc.getString("externalId"));
        String kind = doc.getString("kind");
        event.setKind(kind != null ? EventKind.valueOf(kind) : null);
        event.setEventGroup(doc.getString("eventGroup"));
        event.setSeries(doc.getString("series"));
        event.setStatus(doc.getString("status"));
        event.setScheduledTime(toInstant(doc.getDate("scheduledTime")));
        event.setUrl(doc.getString("url"));
        event.setNotified(doc.getBoolean("notified", false));
        event.setLate(doc.getBoolean("late", false));
        event.setCompletedAt(toInstant(doc.getDate("completedAt")));
        event.setResultNotified(doc.getBoolean("resultNotified", false));
        event.setFirstSeenAt(toInstant(doc.getDate("firstSeenAt")));
        event.setLastSeenAt(toInstant(doc.getDate("lastSeenAt")));
        Number version = doc.get("version", Number.class);
        event.setVersion(version != null ? version.longValue() : 0L);

        Set<Long> delivered = new LinkedHashSet<>();
        List<?> guilds = doc.get("deliveredGuilds", List.class);
        if (guilds != null) {
            for (Object guild : guilds) {
                delivered.add(((Number) guild).longValue());
            }
        }
        event.setDeliveredGuilds(delivered);

        Document participantsDoc = doc.get("participants", Document.class);
        if (participantsDoc != null) {
            Participants participants = new Participants(
                participantsDoc.getString("first"), participantsDoc.getString("second"));
            participants.setFirstFlag(participantsDoc.getString("firstFlag"));
            participants.setSecondFlag(participantsDoc.getString("secondFlag"));
            event.setParticipants(participants);
        }
        Document scoreDoc = doc.get("score", Document.class);
        if (scoreDoc != null) {
            event.setScore(new MatchScore(scoreDoc.getInteger("first"), scoreDoc.getInteger("second")));
        }
        return event;
    }

    private static Date toDate(Instant instant) {
        return instant != null ? Date.from(instant) : null;
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
