package com.jreinhal.concierge.hitl.escalation;

import java.time.Instant;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "hitl_reviewers")
@CompoundIndexes({
    @CompoundIndex(name = "tenant_available_idx", def = "{'tenantId': 1, 'available': 1, 'reviewerId': 1}")
})
public record Reviewer(
    @Id String id,
    String tenantId,
    String reviewerId,
    String name,
    List<String> skills,
    int maxWorkload,
    boolean available,
    Instant registeredAt,
    Instant updatedAt
) {
    public Reviewer {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }

    public static String storageId(String tenantId, String reviewerId) {
        return tenantId + ":" + reviewerId;
    }

    public Reviewer withAvailability(boolean newAvailable, Instant at) {
        return new Reviewer(id, tenantId, reviewerId, name, skills, maxWorkload, newAvailable, registeredAt, at);
    }
}
