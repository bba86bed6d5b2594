package com.jreinhal.concierge.activity;

@FunctionalInterface
public interface ActivityAppendListener {

    /**
     * Called on the appending thread after the event is stored. Must not block.
     */
    void onAppended(String tenantId, long sequenceNo);
}
