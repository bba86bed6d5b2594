package com.jreinhal.concierge.playbook;

/**
 * One step of a playbook. {@code toolName} selects the {@link StepHandler} that runs it.
 */
public record PlaybookStep(String stepId, String name, String toolName, StepType type) {
    public PlaybookStep {
        if (stepId == null || stepId.isBlank()) {
            throw new IllegalArgumentException("Step id is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Step name is required");
        }
        toolName = toolName == null || toolName.isBlank() ? name : toolName;
        type = type == null ? StepType.TOOL_CALL : type;
    }

    public static PlaybookStep toolCall(int index, String name) {
        return new PlaybookStep("step-" + index, name, name, StepType.TOOL_CALL);
    }
}
