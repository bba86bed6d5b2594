package com.jreinhal.concierge.hitl;

import com.jreinhal.concierge.exception.ConciergeException;

public class NotAssigneeException extends ConciergeException {
    private final String requestId;

    public NotAssigneeException(String requestId, String message) {
        super("not_assignee", message);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return this.requestId;
    }
}
