package com.jreinhal.concierge.playbook;

import java.util.Map;

/**
 * @param stepResults results in execution order
 */
public record WorkflowRun(boolean success, Map<String, StepResult> stepResults, String error) {
}
