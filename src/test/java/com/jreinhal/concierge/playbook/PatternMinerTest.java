package com.jreinhal.concierge.playbook;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.jreinhal.concierge.graph.ResolutionTrace;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class PatternMinerTest {
    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private static ResolutionTrace trace(String id, int minute, boolean success, String... steps) {
        return new ResolutionTrace(id, "billing", List.of(steps), success, "agent-1", 0.9, T0.plusSeconds(minute * 60L));
    }

    @Test
    void prefixSimilarityIsSharedLeadOverLongerLength() {
        assertEquals(1.0, PatternMiner.prefixSimilarity(List.of("a", "b"), List.of("a", "b")));
        assertEquals(2.0 / 3.0, PatternMiner.prefixSimilarity(List.of("a", "b", "c"), List.of("a", "b", "d")), 1e-9);
        assertEquals(0.5, PatternMiner.prefixSimilarity(List.of("a"), List.of("a", "b")));
        assertEquals(0.0, PatternMiner.prefixSimilarity(List.of("x", "b"), List.of("a", "b")));
        assertEquals(0.0, PatternMiner.prefixSimilarity(List.of(), List.of()));
    }

    @Test
    void nearDuplicateSequencesShareOneCluster() {
        List<PatternCluster> clusters = PatternMiner.cluster(List.of(
                trace("r1", 1, true, "lookup", "verify", "refund"),
                trace("r2", 2, true, "lookup", "verify", "credit"),
                trace("r3", 3, true, "lookup", "verify", "refund"),
                trace("r4", 4, true, "escalate")), 0.6);

        assertEquals(2, clusters.size());
        PatternCluster refunds = clusters.get(0);
        assertEquals(List.of("r1", "r2", "r3"), refunds.resolutionIds());
        assertEquals(List.of("lookup", "verify", "refund"), refunds.representativeSteps());
        assertEquals(List.of("escalate"), clusters.get(1).representativeSteps());
    }

    @Test
    void representativeIgnoresFailedAttempts() {
        List<PatternCluster> clusters = PatternMiner.cluster(List.of(
                trace("r1", 1, false, "lookup", "refund", "close"),
                trace("r2", 2, false, "lookup", "refund", "close"),
                trace("r3", 3, true, "lookup", "refund", "notify")), 0.6);

        assertEquals(1, clusters.size());
        assertEquals(List.of("lookup", "refund", "notify"), clusters.get(0).representativeSteps());
        assertEquals(1, clusters.get(0).successCount());
        assertEquals(1.0 / 3.0, clusters.get(0).successRate(), 1e-9);
    }

    @Test
    void clusteringDoesNotDependOnInputOrder() {
        List<ResolutionTrace> traces = List.of(
                trace("r3", 3, true, "a", "b", "d"),
                trace("r1", 1, true, "a", "b", "c"),
                trace("r2", 2, true, "a", "b", "c"),
                trace("r0", 0, true));

        List<PatternCluster> forward = PatternMiner.cluster(traces, 0.6);
        List<ResolutionTrace> shuffled = new ArrayList<>(traces);
        Collections.reverse(shuffled);
        List<PatternCluster> reversed = PatternMiner.cluster(shuffled, 0.6);

        assertEquals(forward, reversed);
        assertTrue(forward.stream().noneMatch(c -> c.resolutionIds().contains("r0")));
    }
}
