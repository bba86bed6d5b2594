package com.jreinhal.concierge.graph;

import java.time.Instant;
import java.util.List;

/**
 * A resolution as seen by pattern mining: its ordered steps and whether it worked.
 */
public record ResolutionTrace(
    String resolutionId,
    String category,
    List<String> steps,
    boolean success,
    String agentId,
    double confidence,
    Instant observedAt
) {
    public ResolutionTrace {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
