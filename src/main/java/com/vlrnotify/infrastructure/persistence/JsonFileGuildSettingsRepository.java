package com.vlrnotify.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.ports.GuildSettingsRepository;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * File-backed guild configuration, one JSON file for all guilds.
 */
@Repository
@ConditionalOnProperty(name = "vlr.store.type", havingValue = "file", matchIfMissing = true)
public class JsonFileGuildSettingsRepository implements GuildSettingsRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileGuildSettingsRepository.class);

    private final ConcurrentHashMap<Long, GuildSettings> guilds = new ConcurrentHashMap<>();
    private final JsonSnapshotFile<List<GuildSettings>> snapshot;

    @Autowired
    public JsonFileGuildSettingsRepository(@Value("${vlr.store.file.guilds:data/guilds.json}") String path) {
        this(Path.of(path));
    }

    public JsonFileGuildSettingsRepository(Path path) {
        this.snapshot = new JsonSnapshotFile<>(path, new TypeReference<List<GuildSettings>>() {},
            () -> guilds.values().stream()
                .sorted(Comparator.comparingLong(GuildSettings::getGuildId))
                .collect(Collectors.toList()));
        List<GuildSettings> stored = snapshot.read();
        if (stored != null) {
            stored.forEach(settings -> guilds.put(settings.getGuildId(), settings));
        }
        logger.info("Guild settings opened at {} with {} guilds", path, guilds.size());
    }

    @Override
    public GuildSettings get(long guildId) {
        GuildSettings settings = guilds.get(guildId);
        return settings != null ? settings.copy() : new GuildSettings(guildId);
    }

    @Override
    public List<GuildSettings> findAll() {
        return guilds.values().stream()
            .sorted(Comparator.comparingLong(GuildSettings::getGuildId))
            .map(GuildSettings::copy)
            .collect(Collectors.toList());
    }

    @Override
    public void save(GuildSettings settings) {
        guilds.put(settings.getGuildId(), settings.copy());
        snapshot.flush();
    }

    @PreDestroy
    public void close() {
        snapshot.close();
    }
}
