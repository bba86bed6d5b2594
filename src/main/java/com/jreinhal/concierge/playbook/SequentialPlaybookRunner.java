package com.jreinhal.concierge.playbook;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Walks the playbook from its entry step along the first outgoing edge of each step, stopping at
 * the first failure. Used when no {@link WorkflowCompiler} is configured or compilation fails.
 */
final class SequentialPlaybookRunner {

    private SequentialPlaybookRunner() {
    }

    static WorkflowRun run(Playbook playbook, Map<String, StepHandler> handlers, Map<String, Object> input) {
        Map<String, StepResult> results = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        String current = playbook.entryStepId() != null ? playbook.entryStepId()
                : playbook.steps().isEmpty() ? null : playbook.steps().get(0).stepId();
        while (current != null && visited.add(current)) {
            Optional<PlaybookStep> step = stepById(playbook, current);
            if (step.isEmpty()) {
                break;
            }
            StepResult result = StepInvoker.invoke(step.get(), handlers, input, results);
            results.put(current, result);
            if (result.isFailure()) {
                return new WorkflowRun(false, results, result.error());
            }
            current = nextStepId(playbook, current);
        }
        return new WorkflowRun(true, results, null);
    }

    private static Optional<PlaybookStep> stepById(Playbook playbook, String stepId) {
        return playbook.steps().stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }

    private static String nextStepId(Playbook playbook, String stepId) {
        for (PlaybookEdge edge : playbook.edges()) {
            if (edge.fromStepId().equals(stepId)) {
                return edge.toStepId();
            }
        }
        return null;
    }
}
