package com.jreinhal.concierge.playbook;

import java.util.Map;

/**
 * @param engine {@code dag} when a compiled workflow ran, {@code sequential} otherwise
 * @param superseded true when this run pushed the playbook below the minimum success rate
 */
public record PlaybookExecutionResult(
    String playbookId,
    boolean success,
    Map<String, StepResult> stepResults,
    String error,
    String engine,
    boolean superseded
) {
}
