package com.jreinhal.concierge.graph;

import java.util.List;

public record JourneyEntry(GraphNode ticket, List<GraphNode> resolutions) {
}
