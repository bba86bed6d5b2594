package com.jreinhal.concierge.feedback;

/**
 * @param goldenPaths stored records, or -1 when the semantic store could not be counted
 */
public record FeedbackStats(long goldenPaths, int buffered, long evicted, boolean degraded) {
}
