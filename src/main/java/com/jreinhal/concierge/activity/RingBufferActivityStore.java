package com.jreinhal.concierge.activity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local stream store. Each tenant keeps at most {@code capacity} events; the oldest are
 * dropped first and everything is gone after a restart.
 */
public class RingBufferActivityStore implements ActivityStore {
    private final int capacity;
    private final Map<String, TenantRing> rings = new ConcurrentHashMap<>();
    private final AtomicLong evicted = new AtomicLong();

    public RingBufferActivityStore(int capacity) {
        this.capacity = Math.max(16, capacity);
    }

    @Override
    public long allocateSequence(String tenantId) {
        TenantRing ring = ring(tenantId);
        synchronized (ring) {
            ring.counter++;
            return ring.counter;
        }
    }

    @Override
    public void advanceSequenceTo(String tenantId, long floor) {
        TenantRing ring = ring(tenantId);
        synchronized (ring) {
            ring.counter = Math.max(ring.counter, floor);
        }
    }

    @Override
    public long highestSequence(String tenantId) {
        TenantRing ring = this.rings.get(tenantId);
        if (ring == null) {
            return 0L;
        }
        synchronized (ring) {
            return ring.counter;
        }
    }

    @Override
    public void insert(ActivityEvent event) {
        TenantRing ring = ring(event.tenantId());
        synchronized (ring) {
            ring.counter = Math.max(ring.counter, event.sequenceNo());
            ActivityEvent last = ring.events.peekLast();
            if (last == null || last.sequenceNo() < event.sequenceNo()) {
                ring.events.addLast(event);
            } else {
                List<ActivityEvent> sorted = new ArrayList<>(ring.events);
                sorted.add(event);
                sorted.sort((a, b) -> Long.compare(a.sequenceNo(), b.sequenceNo()));
                ring.events.clear();
                ring.events.addAll(sorted);
            }
            while (ring.events.size() > this.capacity) {
                ring.events.pollFirst();
                this.evicted.incrementAndGet();
            }
        }
    }

    @Override
    public List<ActivityEvent> readAfter(String tenantId, long afterSequence, int limit) {
        TenantRing ring = this.rings.get(tenantId);
        if (ring == null) {
            return List.of();
        }
        List<ActivityEvent> result = new ArrayList<>();
        synchronized (ring) {
            for (ActivityEvent event : ring.events) {
                if (event.sequenceNo() > afterSequence) {
                    result.add(event);
                    if (result.size() >= limit) {
                        break;
                    }
                }
            }
        }
        return result;
    }

    @Override
    public List<ActivityEvent> latest(String tenantId, int limit) {
        TenantRing ring = this.rings.get(tenantId);
        if (ring == null) {
            return List.of();
        }
        synchronized (ring) {
            List<ActivityEvent> all = new ArrayList<>(ring.events);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    @Override
    public long count(String tenantId) {
        TenantRing ring = this.rings.get(tenantId);
        if (ring == null) {
            return 0L;
        }
        synchronized (ring) {
            return ring.events.size();
        }
    }

    @Override
    public long deleteBySubject(String tenantId, String subjectId) {
        TenantRing ring = this.rings.get(tenantId);
        if (ring == null) {
            return 0L;
        }
        long removed = 0;
        synchronized (ring) {
            Iterator<ActivityEvent> it = ring.events.iterator();
            while (it.hasNext()) {
                if (it.next().mentionsSubject(subjectId)) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    @Override
    public boolean isDurable() {
        return false;
    }

    public long evictedCount() {
        return this.evicted.get();
    }

    private TenantRing ring(String tenantId) {
        return this.rings.computeIfAbsent(tenantId, id -> new TenantRing());
    }

    private static final class TenantRing {
        private final Deque<ActivityEvent> events = new ArrayDeque<>();
        private long counter;
    }
}
