package com.vlrnotify.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vlrnotify.domain.model.EventKind;
import com.vlrnotify.domain.model.MatchEvent;
import com.vlrnotify.domain.model.UpsertResult;
import com.vlrnotify.domain.ports.EventStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * File-backed EventStore.
 *
 * Records live in a ConcurrentHashMap: every write goes through {@code compute} for its key,
 * which serializes writers of one id without blocking other ids, and swaps in a fresh copy
 * so readers never see a partially updated record. Mutations mark the JSON snapshot dirty and a
 * background flusher writes the table. Upserts return without waiting for the write; the
 * notification flag and sent-log updates return only once the change is on disk.
 */
@Repository
@ConditionalOnProperty(name = "vlr.store.type", havingValue = "file", matchIfMissing = true)
public class JsonFileEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileEventStore.class);

    private final ConcurrentHashMap<String, MatchEvent> records = new ConcurrentHashMap<>();
    private final JsonSnapshotFile<List<MatchEvent>> snapshot;

    @Autowired
    public JsonFileEventStore(@Value("${vlr.store.file.events:data/events.json}") String path) {
        this(Path.of(path));
    }

    public JsonFileEventStore(Path path) {
        this(path, null);
    }

    JsonFileEventStore(Path path, Executor flusher) {
        this.snapshot = new JsonSnapshotFile<>(path, new TypeReference<List<MatchEvent>>() {},
            this::sortedRecords, flusher);
        List<MatchEvent> stored = snapshot.read();
        if (stored != null) {
            for (MatchEvent event : stored) {
                records.put(event.getExternalId(), event);
            }
        }
        logger.info("Event store opened at {} with {} records", path, records.size());
    }

    @Override
    public UpsertResult upsert(MatchEvent event, Instant seenAt) {
        if (event == null || event.getExternalId() == null) {
            throw new IllegalArgumentException("Event without externalId");
        }
        AtomicReference<UpsertResult> result = new AtomicReference<>();
        records.compute(event.getExternalId(), (id, existing) -> {
            EventMerger.Merge merge = EventMerger.merge(existing, event, seenAt);
            result.set(merge.result());
            return merge.record();
        });
        snapshot.markDirty();
        return result.get();
    }

    @Override
    public List<MatchEvent> dueForNotification(Instant now, Duration leadTime) {
        return select(e -> EventMerger.isDue(e, now, leadTime), byScheduledTime());
    }

    @Override
    public List<MatchEvent> overdueForNotification(Instant now) {
        return select(e -> EventMerger.isOverdue(e, now), byScheduledTime());
    }

    @Override
    public List<MatchEvent> dueResultNotifications() {
        return select(EventMerger::isResultDue, Comparator.comparing(MatchEvent::getCompletedAt));
    }

    @Override
    public boolean markNotified(String externalId, boolean late) {
        return update(externalId, current -> {
            if (current.isNotified()) {
                return null;
            }
            MatchEvent updated = current.copy();
            updated.setNotified(true);
            updated.setLate(late);
            return updated;
        });
    }

    @Override
    public boolean claimDelivery(String externalId, long guildId) {
        return update(externalId, current -> {
            if (current.getDeliveredGuilds().contains(guildId)) {
                return null;
            }
            MatchEvent updated = current.copy();
            updated.getDeliveredGuilds().add(guildId);
            return updated;
        });
    }

    @Override
    public boolean markResultNotified(String externalId) {
        return update(externalId, current -> {
            if (current.isResultNotified()) {
                return null;
            }
            MatchEvent updated = current.copy();
            updated.setResultNotified(true);
            return updated;
        });
    }

    @Override
    public Optional<MatchEvent> findByExternalId(String externalId) {
        MatchEvent event = records.get(externalId);
        return event != null ? Optional.of(event.copy()) : Optional.empty();
    }

    @Override
    public List<MatchEvent> findByKind(EventKind kind) {
        Comparator<MatchEvent> order = kind == EventKind.MATCH ? byScheduledTime() : EventMerger.NEWEST_FIRST;
        return select(e -> e.getKind() == kind, order);
    }

    @Override
    public int removeStale(Instant seenBefore) {
        int removed = 0;
        for (String id : new ArrayList<>(records.keySet())) {
            AtomicBoolean deleted = new AtomicBoolean();
            records.computeIfPresent(id, (k, current) -> {
                if (EventMerger.isStale(current, seenBefore)) {
                    deleted.set(true);
                    return null;
                }
                return current;
            });
            if (deleted.get()) {
                removed++;
            }
        }
        if (removed > 0) {
            snapshot.markDirty();
            logger.info("Removed {} stale events last seen before {}", removed, seenBefore);
        }
        return removed;
    }

    /**
     * Applies a conditional change to one record. The mutator returns null to leave it as is.
     */
    private boolean update(String externalId, UnaryOperator<MatchEvent> mutator) {
        AtomicBoolean applied = new AtomicBoolean();
        records.computeIfPresent(externalId, (id, current) -> {
            MatchEvent updated = mutator.apply(current);
            if (updated == null) {
                return current;
            }
            updated.setVersion(current.getVersion() + 1);
            applied.set(true);
            return updated;
        });
        if (applied.get()) {
            snapshot.flush();
        }
        return applied.get();
    }

    private List<MatchEvent> select(Predicate<MatchEvent> filter, Comparator<MatchEvent> order) {
        return records.values().stream()
            .filter(filter)
            .sorted(order)
            .map(MatchEvent::copy)
            .collect(Collectors.toList());
    }

    private static Comparator<MatchEvent> byScheduledTime() {
        return EventMerger.EARLIEST_START_FIRST;
    }

    private List<MatchEvent> sortedRecords() {
        return records.values().stream()
            .sorted(Comparator.comparing(MatchEvent::getExternalId))
            .collect(Collectors.toList());
    }

    /**
     * Writes out pending changes and stops the flusher.
     */
    @PreDestroy
    public void close() {
        snapshot.close();
    }
}
