package com.jreinhal.concierge.graph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Upserts derived from one event. Nodes are applied before edges.
 */
public record GraphMutation(List<GraphNode> nodes, List<GraphEdge> edges) {
    public static final GraphMutation EMPTY = new GraphMutation(List.of(), List.of());

    public GraphMutation {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public boolean isEmpty() {
        return this.nodes.isEmpty() && this.edges.isEmpty();
    }

    static Builder builder(String tenantId, Instant at) {
        return new Builder(tenantId, at);
    }

    static final class Builder {
        private final String tenantId;
        private final Instant at;
        private final List<GraphNode> nodes = new ArrayList<>();
        private final List<GraphEdge> edges = new ArrayList<>();

        private Builder(String tenantId, Instant at) {
            this.tenantId = tenantId;
            this.at = at;
        }

        String node(NodeType type, String businessId, Map<String, Object> attrs) {
            GraphNode node = GraphNode.of(this.tenantId, type, businessId, attrs, this.at);
            this.nodes.add(node);
            return node.nodeId();
        }

        void edge(String fromId, EdgeLabel label, String toId) {
            this.edges.add(GraphEdge.of(this.tenantId, fromId, label, toId, this.at));
        }

        GraphMutation build() {
            return this.nodes.isEmpty() && this.edges.isEmpty() ? EMPTY : new GraphMutation(this.nodes, this.edges);
        }
    }
}
