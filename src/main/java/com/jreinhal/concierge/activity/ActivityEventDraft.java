package com.jreinhal.concierge.activity;

import java.time.Instant;
import java.util.Map;

/**
 * An event before the stream has numbered it. {@code eventId} and {@code timestamp} are optional;
 * collaborators that redeliver should send a stable {@code eventId}.
 */
public record ActivityEventDraft(
    String eventId,
    String eventType,
    String source,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static ActivityEventDraft of(String eventType, String source, Map<String, Object> payload) {
        return new ActivityEventDraft(null, eventType, source, payload, null);
    }
}
