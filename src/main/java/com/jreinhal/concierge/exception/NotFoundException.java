package com.jreinhal.concierge.exception;

public class NotFoundException extends ConciergeException {
    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + "_not_found", kind + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public String getKind() {
        return this.kind;
    }

    public String getId() {
        return this.id;
    }
}
