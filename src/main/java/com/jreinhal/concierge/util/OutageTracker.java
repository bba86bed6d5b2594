package com.jreinhal.concierge.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Remembers which backing stores are currently down so an outage is logged once when it starts
 * and once when it ends, instead of on every failed call.
 */
public class OutageTracker {
    private static final Logger log = LoggerFactory.getLogger(OutageTracker.class);
    private final Map<String, Instant> downSince = new ConcurrentHashMap<>();
    private final Clock clock;

    public OutageTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return true when this failure opened a new outage window
     */
    public boolean recordFailure(String store, Throwable error) {
        Instant now = this.clock.instant();
        boolean opened = this.downSince.putIfAbsent(store, now) == null;
        if (opened) {
            log.warn("Backing store '{}' unavailable, running degraded: {}", store,
                    error != null ? LogSanitizer.sanitize(error.getMessage()) : "unknown");
        }
        return opened;
    }

    public void recordSuccess(String store) {
        Instant since = this.downSince.remove(store);
        if (since != null) {
            log.info("Backing store '{}' recovered after {}s", store,
                    Duration.between(since, this.clock.instant()).toSeconds());
        }
    }

    public boolean isDown(String store) {
        return this.downSince.containsKey(store);
    }

    public Optional<Instant> downSince(String store) {
        return Optional.ofNullable(this.downSince.get(store));
    }

    public Map<String, Instant> snapshot() {
        return Map.copyOf(this.downSince);
    }
}
