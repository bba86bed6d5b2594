package com.jreinhal.concierge.hitl.escalation;

public enum EscalationAction {
    REASSIGN,
    NOTIFY,
    AUTO_ESCALATE_PRIORITY;
}
