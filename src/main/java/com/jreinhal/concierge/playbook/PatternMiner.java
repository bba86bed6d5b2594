package com.jreinhal.concierge.playbook;

import com.jreinhal.concierge.graph.ResolutionTrace;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups resolution traces by step-prefix similarity. Deterministic for a given input: traces are
 * visited oldest first and each joins the closest existing group, so near-duplicate sequences
 * collapse into one group instead of producing one playbook each.
 */
public final class PatternMiner {

    private PatternMiner() {
    }

    /**
     * Length of the shared leading run over the length of the longer sequence. Two empty sequences
     * score 0.
     */
    public static double prefixSimilarity(List<String> a, List<String> b) {
        int longest = Math.max(a.size(), b.size());
        if (longest == 0) {
            return 0.0;
        }
        int common = 0;
        int shortest = Math.min(a.size(), b.size());
        while (common < shortest && a.get(common).equals(b.get(common))) {
            common++;
        }
        return (double) common / longest;
    }

    public static List<PatternCluster> cluster(List<ResolutionTrace> traces, double mergeSimilarity) {
        List<ResolutionTrace> ordered = traces.stream()
                .filter(t -> !t.steps().isEmpty())
                .sorted(Comparator.comparing(ResolutionTrace::observedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(ResolutionTrace::resolutionId))
                .toList();
        List<List<String>> seeds = new ArrayList<>();
        List<List<ResolutionTrace>> groups = new ArrayList<>();
        for (ResolutionTrace trace : ordered) {
            int best = -1;
            double bestScore = 0.0;
            for (int i = 0; i < seeds.size(); i++) {
                double score = prefixSimilarity(seeds.get(i), trace.steps());
                if (score >= mergeSimilarity && score > bestScore) {
                    best = i;
                    bestScore = score;
                }
            }
            if (best < 0) {
                seeds.add(trace.steps());
                groups.add(new ArrayList<>(List.of(trace)));
            }
            else {
                groups.get(best).add(trace);
            }
        }
        List<PatternCluster> clusters = new ArrayList<>();
        for (List<ResolutionTrace> group : groups) {
            clusters.add(new PatternCluster(representative(group), group));
        }
        return clusters;
    }

    /**
     * Most frequent sequence among successful members, falling back to all members; ties go to
     * the sequence seen first.
     */
    static List<String> representative(List<ResolutionTrace> group) {
        List<ResolutionTrace> pool = group.stream().filter(ResolutionTrace::success).toList();
        if (pool.isEmpty()) {
            pool = group;
        }
        Map<List<String>, Integer> counts = new LinkedHashMap<>();
        for (ResolutionTrace trace : pool) {
            counts.merge(trace.steps(), 1, Integer::sum);
        }
        List<String> best = List.of();
        int bestCount = 0;
        for (Map.Entry<List<String>, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
