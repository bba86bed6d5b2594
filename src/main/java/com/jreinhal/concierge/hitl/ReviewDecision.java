package com.jreinhal.concierge.hitl;

import com.jreinhal.concierge.activity.ActivityEventTypes;
import java.util.Locale;

public enum ReviewDecision {
    APPROVE(ActivityEventTypes.HITL_APPROVED),
    REJECT(ActivityEventTypes.HITL_REJECTED),
    MODIFY(ActivityEventTypes.HITL_MODIFIED);

    private final String eventType;

    ReviewDecision(String eventType) {
        this.eventType = eventType;
    }

    public String eventType() {
        return this.eventType;
    }

    public static ReviewDecision parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Decision is required");
        }
        try {
            return ReviewDecision.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown decision: " + value);
        }
    }
}
