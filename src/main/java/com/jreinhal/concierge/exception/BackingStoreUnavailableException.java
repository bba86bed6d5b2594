package com.jreinhal.concierge.exception;

public class BackingStoreUnavailableException extends ConciergeException {
    private final String store;

    public BackingStoreUnavailableException(String store, String message) {
        super("backing_store_unavailable", "Backing store '" + store + "' unavailable: " + message);
        this.store = store;
    }

    public BackingStoreUnavailableException(String store, String message, Throwable cause) {
        super("backing_store_unavailable", "Backing store '" + store + "' unavailable: " + message, cause);
        this.store = store;
    }

    public String getStore() {
        return this.store;
    }
}
