package com.jreinhal.concierge.graph;

import java.util.Map;

public record GraphStats(Map<NodeType, Long> nodesByType, long edgeCount, long checkpoint, boolean durable, boolean degraded) {
}
