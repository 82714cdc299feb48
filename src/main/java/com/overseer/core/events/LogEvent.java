package com.overseer.core.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * One record of the append-only run event log, written as a single JSON line.
 *
 * @param timestamp  when the event was appended
 * @param runId      the run this event belongs to
 * @param taskId     the task this event relates to (null for run-level events)
 * @param eventType  wire name of the {@link EventType}
 * @param payload    event-specific details
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEvent(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("run_id") String runId,
    @JsonProperty("task_id") String taskId,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("payload") Map<String, Object> payload
) {
    public LogEvent {
        payload = payload == null ? Map.of() : payload;
    }

    public static LogEvent of(Instant timestamp, String runId, String taskId,
                              EventType type, Map<String, Object> payload) {
        return new LogEvent(timestamp, runId, taskId, type.wireName(), payload);
    }

    public boolean is(EventType type) {
        return type.wireName().equals(eventType);
    }

    /** Payload value as a string, or null when absent. */
    public String text(String key) {
        Object value = payload.get(key);
        return value == null ? null : String.valueOf(value);
    }
}
