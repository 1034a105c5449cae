package me.golemcore.runstream.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable unit of run output delivered to every channel. {@code sequenceNo}
 * is strictly increasing per conversation and is the only ordering key.
 */
@Builder
public record StreamEvent(EventKind kind, String conversationId, String messageId, Map<String, Object> payload,
        long sequenceNo, Instant timestamp) {

    public StreamEvent {
        if (kind == null) {
            throw new IllegalArgumentException("event kind is required");
        }
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId is required");
        }
        payload = payload == null || payload.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Object payloadValue(String key) {
        return payload.get(key);
    }

    public String payloadText(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }
}
