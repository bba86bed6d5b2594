package com.jreinhal.concierge.playbook;

public enum StepType {
    TOOL_CALL,
    LLM_CALL,
    DECISION,
    HUMAN_REVIEW;
}
