package com.jreinhal.concierge.hitl;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * An approval request raised by an agent. Mutated only through the claim/respond state machine,
 * so every {@code with*} method returns the next state rather than changing this one.
 */
@Document(collection="hitl_requests")
@CompoundIndexes({
    @CompoundIndex(name="tenant_queue_idx", def="{'tenantId': 1, 'status': 1, 'priority': 1, 'createdAt': 1}"),
    @CompoundIndex(name="status_deadline_idx", def="{'status': 1, 'slaDeadline': 1}"),
    @CompoundIndex(name="tenant_assignee_idx", def="{'tenantId': 1, 'assignedTo': 1, 'status': 1}"),
    @CompoundIndex(name="tenant_dedup_idx", def="{'tenantId': 1, 'dedupKey': 1}", unique=true,
            partialFilter="{ 'dedupKey': { '$exists': true } }")
})
public record HitlRequest(
    @Id String requestId,
    String tenantId,
    String agentId,
    HitlRequestType requestType,
    HitlPriority priority,
    HitlStatus status,
    String question,
    Map<String, Object> context,
    List<String> options,
    String dedupKey,
    Instant createdAt,
    String assignedTo,
    Instant assignedAt,
    Instant slaDeadline,
    ReviewDecision decision,
    String notes,
    Map<String, Object> modifiedOutput,
    Instant respondedAt,
    Instant expiredAt,
    List<String> appliedEscalations
) {
    public static final String CTX_TICKET_ID = "ticketId";
    public static final String CTX_CUSTOMER_ID = "customerId";
    public static final String CTX_CATEGORY = "category";
    public static final String CTX_STEPS = "steps";
    public static final String CTX_ARTICLES = "articles";
    public static final String CTX_QUERY = "query";
    public static final String CTX_PROPOSED_RESOLUTION = "proposedResolution";

    public boolean isOpen() {
        return status == HitlStatus.PENDING || status == HitlStatus.ASSIGNED;
    }

    public boolean isPastDeadline(Instant now) {
        return slaDeadline != null && !now.isBefore(slaDeadline);
    }

    public boolean hasEscalation(String ruleName) {
        return appliedEscalations != null && appliedEscalations.contains(ruleName);
    }

    public String contextString(String key) {
        Object value = context != null ? context.get(key) : null;
        return value != null ? String.valueOf(value) : null;
    }

    public List<String> contextList(String key) {
        Object value = context != null ? context.get(key) : null;
        List<String> result = new ArrayList<>();
        if (value instanceof Iterable<?> items) {
            for (Object item : items) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
        } else if (value != null) {
            result.add(String.valueOf(value));
        }
        return result;
    }

    public HitlRequest withAssignment(String reviewerId, Instant at) {
        return new HitlRequest(requestId, tenantId, agentId, requestType, priority, HitlStatus.ASSIGNED, question, context,
                options, dedupKey, createdAt, reviewerId, at, slaDeadline, decision, notes, modifiedOutput, respondedAt,
                expiredAt, appliedEscalations);
    }

    public HitlRequest withRelease() {
        return new HitlRequest(requestId, tenantId, agentId, requestType, priority, HitlStatus.PENDING, question, context,
                options, dedupKey, createdAt, null, null, slaDeadline, decision, notes, modifiedOutput, respondedAt,
                expiredAt, appliedEscalations);
    }

    public HitlRequest withCompletion(ReviewDecision newDecision, String newNotes, Map<String, Object> output, Instant at) {
        return new HitlRequest(requestId, tenantId, agentId, requestType, priority, HitlStatus.COMPLETED, question, context,
                options, dedupKey, createdAt, assignedTo, assignedAt, slaDeadline, newDecision, newNotes, output, at,
                expiredAt, appliedEscalations);
    }

    public HitlRequest withExpiry(Instant at) {
        return new HitlRequest(requestId, tenantId, agentId, requestType, priority, HitlStatus.EXPIRED, question, context,
                options, dedupKey, createdAt, assignedTo, assignedAt, slaDeadline, decision, notes, modifiedOutput,
                respondedAt, at, appliedEscalations);
    }

    public HitlRequest withEscalation(String ruleName, HitlPriority newPriority) {
        List<String> applied = new ArrayList<>(appliedEscalations != null ? appliedEscalations : List.of());
        applied.add(ruleName);
        return new HitlRequest(requestId, tenantId, agentId, requestType, newPriority != null ? newPriority : priority,
                status, question, context, options, dedupKey, createdAt, assignedTo, assignedAt, slaDeadline, decision,
                notes, modifiedOutput, respondedAt, expiredAt, List.copyOf(applied));
    }
}
