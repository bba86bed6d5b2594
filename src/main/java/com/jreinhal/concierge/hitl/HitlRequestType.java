package com.jreinhal.concierge.hitl;

public enum HitlRequestType {
    APPROVAL,
    REVIEW,
    FEEDBACK,
    ESCALATION,
    OVERRIDE,
    CLARIFICATION
}
