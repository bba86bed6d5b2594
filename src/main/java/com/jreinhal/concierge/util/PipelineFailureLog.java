package com.jreinhal.concierge.util;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Records downstream failures that happened after a committed HITL transition (feedback ingest,
 * event emission, graph projection, playbook extraction). Nothing here is retried inline.
 */
@Component
public class PipelineFailureLog {
    private static final Logger log = LoggerFactory.getLogger(PipelineFailureLog.class);
    private static final int MAX_RECENT_PER_TENANT = 100;
    private final Map<String, Map<String, AtomicLong>> counters = new ConcurrentHashMap<>();
    private final Map<String, Deque<PipelineFailure>> recent = new ConcurrentHashMap<>();
    private final Clock clock;

    public PipelineFailureLog(Clock clock) {
        this.clock = clock;
    }

    public void record(String tenantId, String stage, String subjectId, Throwable error) {
        String message = error != null ? LogSanitizer.sanitize(error.getMessage()) : "unknown";
        PipelineFailure failure = new PipelineFailure(tenantId, stage, subjectId, message, this.clock.instant());
        this.counters.computeIfAbsent(tenantId, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(stage, k -> new AtomicLong())
                .incrementAndGet();
        Deque<PipelineFailure> deque = this.recent.computeIfAbsent(tenantId, k -> new ArrayDeque<>());
        synchronized (deque) {
            if (deque.size() >= MAX_RECENT_PER_TENANT) {
                deque.pollFirst();
            }
            deque.addLast(failure);
        }
        log.warn("Pipeline stage '{}' failed for tenant {} ({}): {}", stage, tenantId, subjectId, message);
    }

    public Map<String, Long> counts(String tenantId) {
        Map<String, Long> result = new TreeMap<>();
        this.counters.getOrDefault(tenantId, Map.of()).forEach((stage, count) -> result.put(stage, count.get()));
        return result;
    }

    public long total(String tenantId) {
        return this.counts(tenantId).values().stream().mapToLong(Long::longValue).sum();
    }

    public List<PipelineFailure> recent(String tenantId) {
        Deque<PipelineFailure> deque = this.recent.get(tenantId);
        if (deque == null) {
            return List.of();
        }
        synchronized (deque) {
            return new ArrayList<>(deque);
        }
    }

    public record PipelineFailure(String tenantId, String stage, String subjectId, String message, Instant at) {
    }
}
