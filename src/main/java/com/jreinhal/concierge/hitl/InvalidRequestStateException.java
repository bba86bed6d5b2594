package com.jreinhal.concierge.hitl;

import com.jreinhal.concierge.exception.ConciergeException;

/**
 * The request exists but is in a state that does not allow the operation, e.g. responding twice.
 */
public class InvalidRequestStateException extends ConciergeException {
    private final String requestId;

    public InvalidRequestStateException(String requestId, String message) {
        super("invalid_state", message);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return this.requestId;
    }
}
