package com.jreinhal.concierge.graph;

import java.util.List;

/**
 * @param resolutionIds business ids of the deleted resolution nodes
 */
public record GraphPurgeResult(long nodesDeleted, List<String> resolutionIds) {
}
