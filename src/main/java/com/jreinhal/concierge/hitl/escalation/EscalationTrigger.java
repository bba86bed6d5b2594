package com.jreinhal.concierge.hitl.escalation;

/**
 * What an agent-reported signal in a new request's context says about it.
 */
public enum EscalationTrigger {
    LOW_CONFIDENCE,
    NEGATIVE_SENTIMENT,
    HIGH_VALUE_CUSTOMER,
    REPEATED_FAILURE,
    SENSITIVE_TOPIC,
    POLICY_VIOLATION;
}
