package com.jreinhal.concierge.hitl.escalation;

public record ReviewerLoad(Reviewer reviewer, int openAssignments, int maxWorkload) {

    public boolean hasCapacity() {
        return this.maxWorkload <= 0 || this.openAssignments < this.maxWorkload;
    }

    public String reviewerId() {
        return this.reviewer.reviewerId();
    }
}
