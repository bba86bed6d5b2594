package com.jreinhal.concierge.hitl;

import com.jreinhal.concierge.exception.ConciergeException;

/**
 * Expected outcome for every losing claimant of a contested request.
 */
public class AlreadyClaimedException extends ConciergeException {
    private final String requestId;

    public AlreadyClaimedException(String requestId, String message) {
        super("already_claimed", message);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return this.requestId;
    }
}
