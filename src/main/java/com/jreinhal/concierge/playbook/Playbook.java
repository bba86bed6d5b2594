package com.jreinhal.concierge.playbook;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A resolution workflow mined from repeated successful traces. {@code successRate} and
 * {@code sampleCount} describe the mined evidence; the execution counters track how the playbook
 * has done since it was published.
 */
@Document(collection="playbooks")
@CompoundIndexes({
    @CompoundIndex(name="tenant_category_status_idx", def="{'tenantId': 1, 'category': 1, 'status': 1}"),
    @CompoundIndex(name="tenant_sources_idx", def="{'tenantId': 1, 'sourceResolutionIds': 1}")
})
public record Playbook(
    @Id String playbookId,
    String tenantId,
    String category,
    String name,
    String description,
    PlaybookStatus status,
    List<PlaybookStep> steps,
    List<PlaybookEdge> edges,
    String entryStepId,
    double successRate,
    int sampleCount,
    int successCount,
    long executionCount,
    long executionSuccesses,
    List<String> sourceResolutionIds,
    String supersededBy,
    int version,
    Instant createdAt,
    Instant updatedAt
) {
    public Playbook {
        steps = steps == null ? List.of() : List.copyOf(steps);
        edges = edges == null ? List.of() : List.copyOf(edges);
        sourceResolutionIds = sourceResolutionIds == null ? List.of() : List.copyOf(sourceResolutionIds);
    }

    /**
     * Builds a linear playbook: each step leads to the next.
     */
    public static Playbook linear(String playbookId, String tenantId, String category, List<String> stepNames,
                                  int sampleCount, int successCount, List<String> sourceResolutionIds,
                                  int version, Instant now) {
        List<PlaybookStep> steps = stepsOf(stepNames);
        return new Playbook(playbookId, tenantId, category, nameFor(category),
                "Auto-generated playbook for " + category + " issues: " + String.join(" -> ", stepNames),
                PlaybookStatus.ACTIVE, steps, chain(steps), steps.isEmpty() ? null : steps.get(0).stepId(),
                rate(successCount, sampleCount), sampleCount, successCount, 0L, 0L, sourceResolutionIds,
                null, version, now, now);
    }

    public List<String> stepNames() {
        return steps.stream().map(PlaybookStep::name).toList();
    }

    public boolean isActive() {
        return status == PlaybookStatus.ACTIVE;
    }

    /**
     * Success rate over mined samples and live executions together.
     */
    public double liveSuccessRate() {
        long total = sampleCount + executionCount;
        return total == 0 ? 0.0 : (double) (successCount + executionSuccesses) / total;
    }

    public Playbook withEvidence(int newSampleCount, int newSuccessCount, List<String> sources, Instant now) {
        return new Playbook(playbookId, tenantId, category, name, description, status, steps, edges, entryStepId,
                rate(newSuccessCount, newSampleCount), newSampleCount, newSuccessCount, executionCount,
                executionSuccesses, sources, supersededBy, version + 1, createdAt, now);
    }

    public Playbook superseded(String replacementId, Instant now) {
        return new Playbook(playbookId, tenantId, category, name, description, PlaybookStatus.SUPERSEDED, steps, edges,
                entryStepId, successRate, sampleCount, successCount, executionCount, executionSuccesses,
                sourceResolutionIds, replacementId, version + 1, createdAt, now);
    }

    private static List<PlaybookStep> stepsOf(List<String> names) {
        List<PlaybookStep> steps = new ArrayList<>();
        for (int i = 0; i < names.size(); i++) {
            steps.add(PlaybookStep.toolCall(i + 1, names.get(i)));
        }
        return steps;
    }

    private static List<PlaybookEdge> chain(List<PlaybookStep> steps) {
        List<PlaybookEdge> edges = new ArrayList<>();
        for (int i = 1; i < steps.size(); i++) {
            edges.add(new PlaybookEdge(steps.get(i - 1).stepId(), steps.get(i).stepId()));
        }
        return edges;
    }

    private static String nameFor(String category) {
        if (category == null || category.isEmpty()) {
            return "Resolution playbook";
        }
        return category.substring(0, 1).toUpperCase(Locale.ROOT) + category.substring(1) + " resolution";
    }

    private static double rate(int successes, int samples) {
        return samples == 0 ? 0.0 : (double) successes / samples;
    }
}
