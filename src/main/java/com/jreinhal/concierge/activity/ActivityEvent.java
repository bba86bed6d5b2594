package com.jreinhal.concierge.activity;

import java.time.Instant;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One entry of a tenant's activity log. {@code sequenceNo} is the ordering authority;
 * {@code timestamp} is advisory. {@code eventId} identifies the logical event and may repeat when
 * an upstream collaborator redelivers, so consumers dedupe on it.
 */
@Document(collection="activity_events")
@CompoundIndexes({
    @CompoundIndex(name="tenant_seq_idx", def="{'tenantId': 1, 'sequenceNo': 1}", unique=true),
    @CompoundIndex(name="tenant_type_idx", def="{'tenantId': 1, 'eventType': 1}")
})
public record ActivityEvent(
    @Id String id,
    String eventId,
    String tenantId,
    String eventType,
    String source,
    Map<String, Object> payload,
    Instant timestamp,
    long sequenceNo
) {
    public static String storageId(String tenantId, long sequenceNo) {
        return tenantId + ":" + String.format("%019d", sequenceNo);
    }

    public String payloadString(String key) {
        Object value = payload != null ? payload.get(key) : null;
        return value != null ? String.valueOf(value) : null;
    }

    public boolean mentionsSubject(String subjectId) {
        if (payload == null || subjectId == null) {
            return false;
        }
        for (String key : ActivityEventTypes.SUBJECT_KEYS) {
            if (subjectId.equals(payloadString(key))) {
                return true;
            }
        }
        return false;
    }
}
