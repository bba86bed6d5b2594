package com.jreinhal.concierge.hitl;

import java.util.Map;

/**
 * @param openByPriority pending plus assigned requests per priority
 * @param slaBreached requests that expired without a decision
 * @param averageResponseSeconds creation to decision, over recently completed requests
 */
public record HitlQueueStats(
    Map<HitlStatus, Long> byStatus,
    Map<HitlPriority, Long> openByPriority,
    long slaBreached,
    double averageResponseSeconds
) {
}
