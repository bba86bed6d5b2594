package com.jreinhal.concierge.playbook;

import java.util.List;
import java.util.Map;

public record PlaybookStats(
    Map<PlaybookStatus, Long> byStatus,
    long totalExecutions,
    long totalSuccesses,
    double overallSuccessRate,
    List<String> activeCategories,
    String compiler,
    boolean degraded
) {
}
