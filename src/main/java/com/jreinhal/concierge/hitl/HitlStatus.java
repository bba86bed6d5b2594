package com.jreinhal.concierge.hitl;

public enum HitlStatus {
    PENDING,
    ASSIGNED,
    COMPLETED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == EXPIRED;
    }
}
