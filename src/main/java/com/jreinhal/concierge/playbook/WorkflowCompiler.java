package com.jreinhal.concierge.playbook;

import java.util.Map;

/**
 * Compiles a stored playbook into an executable graph form. Optional: without a compiler bean,
 * playbooks run step by step along their edges.
 */
public interface WorkflowCompiler {

    String name();

    /**
     * @throws IllegalStateException when the playbook's step graph cannot be compiled
     */
    CompiledWorkflow compile(Playbook playbook);

    interface CompiledWorkflow {
        WorkflowRun run(Map<String, StepHandler> handlers, Map<String, Object> input);
    }
}
