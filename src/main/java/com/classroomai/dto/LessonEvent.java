package com.classroomai.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.classroomai.dto.ErrorResponse.ErrorCode;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outbound event envelope. Serialized flat: {@code {"type": ..., <fields>, "timestamp": ...}}.
 */
@JsonPropertyOrder({"type", "timestamp"})
public final class LessonEvent {

    private final EventType type;
    private final Instant timestamp;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private LessonEvent(EventType type, Instant timestamp) {
        this.type = type;
        this.timestamp = timestamp;
    }

    public static LessonEvent of(EventType type, Instant timestamp) {
        return new LessonEvent(type, timestamp);
    }

    public static LessonEvent error(ErrorCode code, String message, Instant timestamp) {
        return new LessonEvent(EventType.ERROR, timestamp)
                .with("code", code.getCode())
                .with("message", message);
    }

    /**
     * Add a payload field. Events are built in one place and not modified once emitted.
     */
    public LessonEvent with(String name, Object value) {
        fields.put(name, value);
        return this;
    }

    @JsonProperty("type")
    public EventType getType() {
        return type;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonAnyGetter
    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Object field(String name) {
        return fields.get(name);
    }

    @Override
    public String toString() {
        return "LessonEvent{" + type.wireName() + ", " + fields + '}';
    }
}
