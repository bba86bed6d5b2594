package com.jreinhal.concierge.hitl.escalation;

import com.jreinhal.concierge.hitl.HitlPriority;
import com.jreinhal.concierge.hitl.HitlRequest;
import com.jreinhal.concierge.hitl.HitlStatus;
import java.time.Duration;
import java.time.Instant;

/**
 * {@code {priority, time since created, status} -> action}. A null priority or status matches any.
 */
public record EscalationRule(
    String name,
    HitlPriority priority,
    HitlStatus status,
    Duration minAge,
    EscalationAction action
) {
    public EscalationRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Escalation rule name is required");
        }
        if (action == null) {
            throw new IllegalArgumentException("Escalation rule " + name + " has no action");
        }
        if (status != null && status.isTerminal()) {
            throw new IllegalArgumentException("Escalation rule " + name + " cannot target terminal status " + status);
        }
        minAge = minAge != null && !minAge.isNegative() ? minAge : Duration.ZERO;
    }

    public boolean matches(HitlRequest request, Instant now) {
        if (!request.isOpen() || request.hasEscalation(this.name)) {
            return false;
        }
        if (this.priority != null && this.priority != request.priority()) {
            return false;
        }
        if (this.status != null && this.status != request.status()) {
            return false;
        }
        return Duration.between(request.createdAt(), now).compareTo(this.minAge) >= 0;
    }
}
