package com.jreinhal.concierge.activity;

/**
 * @param length events currently retained for the tenant
 * @param highestSequence last sequence number handed out
 * @param bufferedInMemory events held only in the process-local ring buffer
 * @param durable whether a durable store is configured
 * @param degraded whether the durable store is currently unreachable or absent
 */
public record ActivityStreamStats(
    long length,
    long highestSequence,
    long bufferedInMemory,
    boolean durable,
    boolean degraded
) {
}
