package com.jreinhal.concierge.hitl.escalation;

/**
 * Support tier a context-escalated request is routed to, recorded on the request for reviewers.
 */
public enum EscalationLevel {
    /** first-line support */
    L1,
    /** specialized support */
    L2,
    /** expert or engineering */
    L3,
    MANAGER,
    EXECUTIVE;
}
