package com.vlrnotify.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vlrnotify.domain.ports.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * A JSON file holding a whole table, replaced atomically on each flush.
 *
 * Writers never touch the file themselves. A mutation calls {@link #markDirty()}, which returns a
 * sequence number and schedules a flush; a single flusher writes the latest state of the table, so
 * any number of mutations made while a write is in progress are covered by the next one.
 * Callers that must be durable before returning wait with {@link #awaitFlushed(long)}.
 */
public class JsonSnapshotFile<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JsonSnapshotFile.class);
    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
    }

    private final Path path;
    private final TypeReference<T> type;
    private final Supplier<T> source;
    private final Executor flusher;
    private final ExecutorService ownedFlusher;

    private final AtomicLong requested = new AtomicLong();
    private final AtomicBoolean flushScheduled = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Object fileLock = new Object();

    // Guarded by flushMonitor
    private final Object flushMonitor = new Object();
    private long flushed;
    private long failedThrough;
    private EventStoreException lastFailure;

    /**
     * @param source produces the current table; called on the flusher thread
     */
    public JsonSnapshotFile(Path path, TypeReference<T> type, Supplier<T> source) {
        this(path, type, source, null);
    }

    JsonSnapshotFile(Path path, TypeReference<T> type, Supplier<T> source, Executor flusher) {
        this.path = path;
        this.type = type;
        this.source = source;
        if (flusher == null) {
            this.ownedFlusher = Executors.newSingleThreadExecutor(task -> {
                Thread thread = new Thread(task, "snapshot-" + path.getFileName());
                thread.setDaemon(true);
                return thread;
            });
            this.flusher = ownedFlusher;
        } else {
            this.ownedFlusher = null;
            this.flusher = flusher;
        }
    }

    /**
     * Reads the table.
     *
     * @return The stored value, or null when the file does not exist yet
     * @throws EventStoreException if the file exists but cannot be read or parsed
     */
    public T read() {
        if (!Files.exists(path)) {
            logger.info("No snapshot at {}, starting empty", path);
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new EventStoreException("Cannot read snapshot " + path, e);
        }
    }

    /**
     * Records that the table changed and schedules a flush. Does not wait for it.
     *
     * @return sequence number covered once {@link #awaitFlushed(long)} returns for it
     */
    public long markDirty() {
        long sequence = requested.incrementAndGet();
        if (flushScheduled.compareAndSet(false, true)) {
            flusher.execute(this::flushPending);
        }
        return sequence;
    }

    /**
     * Blocks until a flush that started after {@code sequence} was requested has completed.
     *
     * @throws EventStoreException if that flush failed
     */
    public void awaitFlushed(long sequence) {
        synchronized (flushMonitor) {
            while (flushed < sequence) {
                if (failedThrough >= sequence) {
                    throw new EventStoreException("Snapshot " + path + " was not written", lastFailure);
                }
                try {
                    flushMonitor.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EventStoreException("Interrupted while waiting for snapshot " + path, e);
                }
            }
        }
    }

    /**
     * Marks the table dirty and waits for it to be on disk.
     */
    public void flush() {
        awaitFlushed(markDirty());
    }

    /**
     * Flushes pending changes and stops the flusher.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (requested.get() > 0) {
            flush();
        }
        if (ownedFlusher != null) {
            ownedFlusher.shutdown();
            try {
                if (!ownedFlusher.awaitTermination(5, TimeUnit.SECONDS)) {
                    logger.warn("Snapshot flusher for {} did not stop in time", path);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void flushPending() {
        // Reset before reading the target so a request arriving mid-write schedules another flush
        flushScheduled.set(false);
        long target = requested.get();
        synchronized (flushMonitor) {
            if (flushed >= target) {
                return;
            }
        }

        EventStoreException failure = null;
        try {
            synchronized (fileLock) {
                writeFile(source.get());
            }
        } catch (EventStoreException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new EventStoreException("Cannot serialize snapshot " + path, e);
        }

        synchronized (flushMonitor) {
            if (failure == null) {
                flushed = Math.max(flushed, target);
            } else {
                logger.error("Failed to write snapshot {}", path, failure);
                failedThrough = Math.max(failedThrough, target);
                lastFailure = failure;
            }
            flushMonitor.notifyAll();
        }
    }

    private void writeFile(T value) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            OBJECT_MAPPER.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new EventStoreException("Cannot write snapshot " + path, e);
        }
    }
}
