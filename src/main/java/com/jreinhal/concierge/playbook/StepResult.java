package com.jreinhal.concierge.playbook;

import java.util.Map;

public record StepResult(String stepId, String name, Outcome outcome, Map<String, Object> output, String error) {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        SKIPPED;
    }

    public static StepResult succeeded(PlaybookStep step, Map<String, Object> output) {
        return new StepResult(step.stepId(), step.name(), Outcome.SUCCEEDED, output != null ? output : Map.of(), null);
    }

    public static StepResult failed(PlaybookStep step, String error) {
        return new StepResult(step.stepId(), step.name(), Outcome.FAILED, Map.of(), error);
    }

    public static StepResult skipped(PlaybookStep step, String reason) {
        return new StepResult(step.stepId(), step.name(), Outcome.SKIPPED, Map.of(), reason);
    }

    public boolean isFailure() {
        return outcome == Outcome.FAILED;
    }
}
