package com.jreinhal.concierge.exception;

/**
 * Base for every error this service reports to callers. The {@code reason} is a stable,
 * machine-readable code that UIs can switch on.
 */
public abstract class ConciergeException extends RuntimeException {
    private final String reason;

    protected ConciergeException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected ConciergeException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return this.reason;
    }
}
