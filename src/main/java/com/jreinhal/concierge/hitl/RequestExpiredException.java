package com.jreinhal.concierge.hitl;

import com.jreinhal.concierge.exception.ConciergeException;

public class RequestExpiredException extends ConciergeException {
    private final String requestId;

    public RequestExpiredException(String requestId, String message) {
        super("request_expired", message);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return this.requestId;
    }
}
