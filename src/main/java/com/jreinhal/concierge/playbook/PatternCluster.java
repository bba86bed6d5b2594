package com.jreinhal.concierge.playbook;

import com.jreinhal.concierge.graph.ResolutionTrace;
import java.util.List;

/**
 * Resolution traces whose step sequences overlap closely enough to share one playbook.
 *
 * @param representativeSteps the most common successful sequence among the members
 */
public record PatternCluster(List<String> representativeSteps, List<ResolutionTrace> members) {
    public PatternCluster {
        representativeSteps = List.copyOf(representativeSteps);
        members = List.copyOf(members);
    }

    public int sampleCount() {
        return members.size();
    }

    public int successCount() {
        return (int) members.stream().filter(ResolutionTrace::success).count();
    }

    public double successRate() {
        return members.isEmpty() ? 0.0 : (double) successCount() / members.size();
    }

    public List<String> resolutionIds() {
        return members.stream().map(ResolutionTrace::resolutionId).toList();
    }
}
