package com.jreinhal.concierge.playbook;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Compiles a playbook's steps and edges into a topologically ordered DAG. At run time a step runs
 * only when every predecessor succeeded or was skipped; steps downstream of a failure are skipped.
 */
@Component
@ConditionalOnProperty(prefix = "concierge.playbook.compiler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DagWorkflowCompiler implements WorkflowCompiler {
    public static final String NAME = "dag";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CompiledWorkflow compile(Playbook playbook) {
        Map<String, PlaybookStep> steps = new LinkedHashMap<>();
        for (PlaybookStep step : playbook.steps()) {
            if (steps.put(step.stepId(), step) != null) {
                throw new IllegalStateException("Duplicate step id " + step.stepId());
            }
        }
        if (playbook.entryStepId() != null && !steps.containsKey(playbook.entryStepId())) {
            throw new IllegalStateException("Entry step " + playbook.entryStepId() + " is not part of the playbook");
        }
        Map<String, List<String>> predecessors = new HashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        Map<String, Integer> indegree = new HashMap<>();
        steps.keySet().forEach(id -> indegree.put(id, 0));
        for (PlaybookEdge edge : playbook.edges()) {
            if (!steps.containsKey(edge.fromStepId()) || !steps.containsKey(edge.toStepId())) {
                throw new IllegalStateException("Edge " + edge.fromStepId() + " -> " + edge.toStepId() + " references an unknown step");
            }
            successors.computeIfAbsent(edge.fromStepId(), k -> new ArrayList<>()).add(edge.toStepId());
            predecessors.computeIfAbsent(edge.toStepId(), k -> new ArrayList<>()).add(edge.fromStepId());
            indegree.merge(edge.toStepId(), 1, Integer::sum);
        }
        Deque<String> ready = new ArrayDeque<>();
        for (String id : steps.keySet()) {
            if (indegree.get(id) == 0) {
                ready.add(id);
            }
        }
        List<PlaybookStep> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(steps.get(id));
            for (String next : successors.getOrDefault(id, List.of())) {
                if (indegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        if (order.size() != steps.size()) {
            throw new IllegalStateException("Playbook " + playbook.playbookId() + " has a cycle");
        }
        return (handlers, input) -> execute(order, predecessors, handlers, input);
    }

    private static WorkflowRun execute(List<PlaybookStep> order, Map<String, List<String>> predecessors,
                                       Map<String, StepHandler> handlers, Map<String, Object> input) {
        Map<String, StepResult> results = new LinkedHashMap<>();
        Set<String> blocked = new HashSet<>();
        String firstError = null;
        for (PlaybookStep step : order) {
            boolean upstreamFailed = predecessors.getOrDefault(step.stepId(), List.of()).stream().anyMatch(blocked::contains);
            StepResult result = upstreamFailed
                    ? StepResult.skipped(step, "Upstream step failed")
                    : StepInvoker.invoke(step, handlers, input, results);
            results.put(step.stepId(), result);
            if (upstreamFailed || result.isFailure()) {
                blocked.add(step.stepId());
            }
            if (result.isFailure() && firstError == null) {
                firstError = result.error();
            }
        }
        return new WorkflowRun(firstError == null, results, firstError);
    }
}
