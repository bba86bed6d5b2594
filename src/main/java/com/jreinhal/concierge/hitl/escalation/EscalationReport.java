package com.jreinhal.concierge.hitl.escalation;

import com.jreinhal.concierge.hitl.HitlPriority;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one escalation pass. Failures are reported here and retried on the next pass.
 */
public record EscalationReport(
    Instant evaluatedAt,
    int examined,
    List<ActionTaken> actions,
    List<Failure> failures,
    List<SlaBreach> breaches
) {
    public EscalationReport {
        actions = List.copyOf(actions);
        failures = List.copyOf(failures);
        breaches = List.copyOf(breaches);
    }

    public static EscalationReport empty(Instant at) {
        return new EscalationReport(at, 0, List.of(), List.of(), List.of());
    }

    public record ActionTaken(String tenantId, String requestId, String rule, EscalationAction action, String detail) {
    }

    public record Failure(String tenantId, String requestId, String rule, String reason) {
    }

    public record SlaBreach(String tenantId, String requestId, HitlPriority priority, Instant slaDeadline) {
    }
}
