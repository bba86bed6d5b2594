package com.jreinhal.concierge.tenant;

import java.util.Locale;

/**
 * Countable per-tenant resources. {@code key} is the persisted usage field name.
 */
public enum QuotaResource {
    HITL_QUEUE("hitl_queue"),
    GOLDEN_PATHS("golden_paths"),
    PLAYBOOKS("playbooks");

    private final String key;

    QuotaResource(String key) {
        this.key = key;
    }

    public String key() {
        return this.key;
    }

    public static QuotaResource fromKey(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Quota resource is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (QuotaResource resource : values()) {
            if (resource.key.equals(normalized) || resource.name().equalsIgnoreCase(normalized)) {
                return resource;
            }
        }
        throw new IllegalArgumentException("Unknown quota resource: " + value);
    }
}
