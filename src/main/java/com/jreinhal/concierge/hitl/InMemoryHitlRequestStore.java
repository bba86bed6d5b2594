package com.jreinhal.concierge.hitl;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Process-local request store. Open requests are additionally kept in an ordered queue index
 * (tenant, priority, created, id) and a deadline index so listings and sweeps never scan the
 * whole map. Index maintenance happens inside the same {@code compute} as the transition.
 */
public class InMemoryHitlRequestStore implements HitlRequestStore {
    static final Comparator<HitlRequest> QUEUE_ORDER = Comparator
            .comparingInt((HitlRequest r) -> r.priority().rank())
            .thenComparing(HitlRequest::createdAt)
            .thenComparing(HitlRequest::requestId);

    private final Map<String, HitlRequest> requests = new ConcurrentHashMap<>();
    private final Map<String, String> dedupIndex = new ConcurrentHashMap<>();
    private final NavigableSet<QueueKey> queueIndex = new ConcurrentSkipListSet<>();
    private final NavigableSet<DeadlineKey> deadlineIndex = new ConcurrentSkipListSet<>();

    @Override
    public HitlRequest insertIfAbsent(HitlRequest request) {
        if (request.dedupKey() == null) {
            return insert(request);
        }
        // The dedup slot stays locked until the winner's request is in the map.
        String winnerId = this.dedupIndex.compute(dedupKey(request.tenantId(), request.dedupKey()), (key, existingId) -> {
            if (existingId != null && this.requests.containsKey(existingId)) {
                return existingId;
            }
            insert(request);
            return request.requestId();
        });
        return this.requests.get(winnerId);
    }

    private HitlRequest insert(HitlRequest request) {
        return this.requests.compute(request.requestId(), (id, current) -> {
            if (current != null) {
                return current;
            }
            index(request);
            return request;
        });
    }

    @Override
    public Optional<HitlRequest> findById(String requestId) {
        return Optional.ofNullable(requestId != null ? this.requests.get(requestId) : null);
    }

    @Override
    public Optional<HitlRequest> findByDedupKey(String tenantId, String dedupKey) {
        String requestId = this.dedupIndex.get(dedupKey(tenantId, dedupKey));
        return requestId != null ? findById(requestId).filter(r -> r.tenantId().equals(tenantId)) : Optional.empty();
    }

    @Override
    public Optional<HitlRequest> claim(String tenantId, String requestId, String reviewerId, Instant now) {
        return transition(tenantId, requestId,
                r -> r.status() == HitlStatus.PENDING && !r.isPastDeadline(now),
                r -> r.withAssignment(reviewerId, now));
    }

    @Override
    public Optional<HitlRequest> complete(String tenantId, String requestId, String reviewerId, ReviewDecision decision,
                                          String notes, Map<String, Object> modifiedOutput, Instant now) {
        return transition(tenantId, requestId,
                r -> r.status() == HitlStatus.ASSIGNED && Objects.equals(r.assignedTo(), reviewerId) && !r.isPastDeadline(now),
                r -> r.withCompletion(decision, notes, modifiedOutput, now));
    }

    @Override
    public Optional<HitlRequest> release(String tenantId, String requestId, String expectedAssignee) {
        return transition(tenantId, requestId,
                r -> r.status() == HitlStatus.ASSIGNED && Objects.equals(r.assignedTo(), expectedAssignee),
                HitlRequest::withRelease);
    }

    @Override
    public Optional<HitlRequest> expire(String tenantId, String requestId, Instant now) {
        return transition(tenantId, requestId,
                r -> r.isOpen() && r.isPastDeadline(now),
                r -> r.withExpiry(now));
    }

    @Override
    public Optional<HitlRequest> recordEscalation(String tenantId, String requestId, String ruleName, HitlPriority newPriority) {
        return transition(tenantId, requestId,
                r -> r.isOpen() && !r.hasEscalation(ruleName),
                r -> r.withEscalation(ruleName, newPriority));
    }

    @Override
    public List<HitlRequest> findOverdue(Instant now, int limit) {
        List<HitlRequest> result = new ArrayList<>();
        for (DeadlineKey key : this.deadlineIndex) {
            if (key.deadline().isAfter(now) || result.size() >= limit) {
                break;
            }
            HitlRequest request = this.requests.get(key.requestId());
            if (request != null && request.isOpen()) {
                result.add(request);
            }
        }
        return result;
    }

    @Override
    public List<HitlRequest> findOpen(Instant afterCreatedAt, String afterRequestId, int limit) {
        List<HitlRequest> open = new ArrayList<>();
        for (QueueKey key : this.queueIndex) {
            HitlRequest request = this.requests.get(key.requestId());
            if (request != null && request.isOpen() && isAfter(request, afterCreatedAt, afterRequestId)) {
                open.add(request);
            }
        }
        open.sort(Comparator.comparing(HitlRequest::createdAt).thenComparing(HitlRequest::requestId));
        return open.size() > limit ? new ArrayList<>(open.subList(0, limit)) : open;
    }

    @Override
    public List<HitlRequest> list(String tenantId, HitlStatus status, HitlPriority priority, int limit) {
        List<HitlRequest> result = new ArrayList<>();
        if (status != null && !status.isTerminal()) {
            for (QueueKey key : tenantSlice(tenantId)) {
                HitlRequest request = this.requests.get(key.requestId());
                if (request != null && request.status() == status && (priority == null || request.priority() == priority)) {
                    result.add(request);
                    if (result.size() >= limit) {
                        break;
                    }
                }
            }
            return result;
        }
        for (HitlRequest request : this.requests.values()) {
            if (request.tenantId().equals(tenantId) && (status == null || request.status() == status)
                    && (priority == null || request.priority() == priority)) {
                result.add(request);
            }
        }
        result.sort(QUEUE_ORDER);
        return result.size() > limit ? new ArrayList<>(result.subList(0, limit)) : result;
    }

    @Override
    public List<HitlRequest> findOpenByAssignee(String tenantId, String reviewerId) {
        List<HitlRequest> result = new ArrayList<>();
        for (QueueKey key : tenantSlice(tenantId)) {
            HitlRequest request = this.requests.get(key.requestId());
            if (request != null && request.status() == HitlStatus.ASSIGNED && Objects.equals(request.assignedTo(), reviewerId)) {
                result.add(request);
            }
        }
        return result;
    }

    @Override
    public long count(String tenantId, HitlStatus status, HitlPriority priority) {
        return this.requests.values().stream()
                .filter(r -> r.tenantId().equals(tenantId))
                .filter(r -> status == null || r.status() == status)
                .filter(r -> priority == null || r.priority() == priority)
                .count();
    }

    @Override
    public List<HitlRequest> recentCompleted(String tenantId, int limit) {
        return this.requests.values().stream()
                .filter(r -> r.tenantId().equals(tenantId) && r.status() == HitlStatus.COMPLETED && r.respondedAt() != null)
                .sorted(Comparator.comparing(HitlRequest::respondedAt).reversed())
                .limit(limit)
                .toList();
    }

    private Optional<HitlRequest> transition(String tenantId, String requestId, Predicate<HitlRequest> guard,
                                             UnaryOperator<HitlRequest> change) {
        if (requestId == null) {
            return Optional.empty();
        }
        HitlRequest[] applied = new HitlRequest[1];
        this.requests.computeIfPresent(requestId, (id, current) -> {
            if (!Objects.equals(current.tenantId(), tenantId) || !guard.test(current)) {
                return current;
            }
            HitlRequest next = change.apply(current);
            unindex(current);
            index(next);
            applied[0] = next;
            return next;
        });
        return Optional.ofNullable(applied[0]);
    }

    private void index(HitlRequest request) {
        if (!request.isOpen()) {
            return;
        }
        this.queueIndex.add(QueueKey.of(request));
        if (request.slaDeadline() != null) {
            this.deadlineIndex.add(new DeadlineKey(request.slaDeadline(), request.requestId()));
        }
    }

    private void unindex(HitlRequest request) {
        this.queueIndex.remove(QueueKey.of(request));
        if (request.slaDeadline() != null) {
            this.deadlineIndex.remove(new DeadlineKey(request.slaDeadline(), request.requestId()));
        }
    }

    private NavigableSet<QueueKey> tenantSlice(String tenantId) {
        return this.queueIndex.subSet(
                new QueueKey(tenantId, Integer.MIN_VALUE, Instant.MIN, ""), true,
                new QueueKey(tenantId, Integer.MAX_VALUE, Instant.MAX, "\uffff"), true);
    }

    private static boolean isAfter(HitlRequest request, Instant afterCreatedAt, String afterRequestId) {
        if (afterCreatedAt == null) {
            return true;
        }
        int cmp = request.createdAt().compareTo(afterCreatedAt);
        return cmp > 0 || (cmp == 0 && (afterRequestId == null || request.requestId().compareTo(afterRequestId) > 0));
    }

    private static String dedupKey(String tenantId, String dedupKey) {
        return tenantId + "\u0000" + dedupKey;
    }

    private record QueueKey(String tenantId, int rank, Instant createdAt, String requestId) implements Comparable<QueueKey> {
        static QueueKey of(HitlRequest request) {
            return new QueueKey(request.tenantId(), request.priority().rank(), request.createdAt(), request.requestId());
        }

        @Override
        public int compareTo(QueueKey other) {
            int cmp = this.tenantId.compareTo(other.tenantId);
            if (cmp != 0) {
                return cmp;
            }
            cmp = Integer.compare(this.rank, other.rank);
            if (cmp != 0) {
                return cmp;
            }
            cmp = this.createdAt.compareTo(other.createdAt);
            return cmp != 0 ? cmp : this.requestId.compareTo(other.requestId);
        }
    }

    private record DeadlineKey(Instant deadline, String requestId) implements Comparable<DeadlineKey> {
        @Override
        public int compareTo(DeadlineKey other) {
            int cmp = this.deadline.compareTo(other.deadline);
            return cmp != 0 ? cmp : this.requestId.compareTo(other.requestId);
        }
    }
}
