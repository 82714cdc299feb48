package com.overseer.core.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.overseer.core.OverseerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Append-only JSON-lines record of one run, shared by every component.
 *
 * <p>All writers go through {@link #append}, which serializes on this instance: a record is
 * written and flushed to the file before the call returns, so the order of lines in the file is
 * the total order of events. The log also keeps the succeeded-task projection the scheduler
 * reads, and delivers each appended event to subscribers after it is durable.
 */
public class EventLog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventLog.class);

    private final Path file;
    private final String runId;
    private final ObjectMapper mapper;
    private final boolean fsync;
    private final Clock clock;

    private FileChannel channel;
    private boolean closed;
    private final List<LogEvent> events = new ArrayList<>();
    private final Set<String> succeeded = ConcurrentHashMap.newKeySet();
    private final CopyOnWriteArrayList<Consumer<LogEvent>> subscribers = new CopyOnWriteArrayList<>();

    public EventLog(Path file, String runId, ObjectMapper mapper, boolean fsync, Clock clock) {
        this.file = file;
        this.runId = runId;
        this.mapper = mapper;
        this.fsync = fsync;
        this.clock = clock;
    }

    /** An event log that keeps records in memory only, used for dry runs. */
    public static EventLog inMemory(String runId, Clock clock) {
        return new EventLog(null, runId, newObjectMapper(), false, clock);
    }

    /** Mapper configured for event records: ISO-8601 timestamps, unknown fields tolerated. */
    public static ObjectMapper newObjectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public String runId() {
        return runId;
    }

    public Path file() {
        return file;
    }

    public LogEvent append(String taskId, EventType type) {
        return append(taskId, type, Map.of());
    }

    /**
     * Appends one record and flushes it.
     *
     * @throws OverseerException when the record cannot be written; the transition it describes
     *                           must then be treated as not having happened
     */
    public LogEvent append(String taskId, EventType type, Map<String, Object> payload) {
        LogEvent event;
        synchronized (this) {
            if (closed) {
                throw new OverseerException("Event log is closed: " + file);
            }
            event = LogEvent.of(clock.instant(), runId, taskId, type, new LinkedHashMap<>(payload));
            if (file != null) {
                write(event);
            }
            events.add(event);
            if (type == EventType.TASK_SUCCEEDED && taskId != null) {
                succeeded.add(taskId);
            }
        }
        log.debug("Event {} task={} {}", type.wireName(), taskId, payload);
        for (Consumer<LogEvent> subscriber : subscribers) {
            deliverSafely(subscriber, event);
        }
        return event;
    }

    private void write(LogEvent event) {
        try {
            if (channel == null) {
                Path parent = file.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                channel = FileChannel.open(file, StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            }
            byte[] line = (mapper.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
            var buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            if (fsync) {
                channel.force(false);
            }
        } catch (IOException e) {
            throw new OverseerException("Cannot append to event log " + file + ": " + e.getMessage(), e);
        }
    }

    /** Ids of tasks with a {@code task_succeeded} record in this run. */
    public Set<String> succeededTasks() {
        return Collections.unmodifiableSet(succeeded);
    }

    /** Snapshot of every record appended by this instance, in append order. */
    public synchronized List<LogEvent> events() {
        return List.copyOf(events);
    }

    public Subscription subscribe(Consumer<LogEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<LogEvent> subscriber, LogEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                log.warn("Failed to close event log {}: {}", file, e.getMessage());
            }
            channel = null;
        }
    }

    // ── Reading ──────────────────────────────────────────────────────────

    /**
     * Reads every record of an event log file. A torn last line (from a crashed writer) is skipped.
     */
    public static List<LogEvent> readAll(Path file, ObjectMapper mapper) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OverseerException("Cannot read event log " + file + ": " + e.getMessage(), e);
        }
        var result = new ArrayList<LogEvent>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                result.add(mapper.readValue(line, LogEvent.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable line {} of {}: {}", i + 1, file, e.getOriginalMessage());
            }
        }
        return result;
    }

    /** Records of a single run, in append order. */
    public static List<LogEvent> readRun(Path file, ObjectMapper mapper, String runId) {
        return readAll(file, mapper).stream()
                .filter(e -> runId.equals(e.runId()))
                .toList();
    }

    /** Run ids found in the file, oldest first. */
    public static List<String> runIds(Path file, ObjectMapper mapper) {
        var ids = new LinkedHashSet<String>();
        for (LogEvent event : readAll(file, mapper)) {
            if (event.runId() != null) {
                ids.add(event.runId());
            }
        }
        return List.copyOf(ids);
    }
}
