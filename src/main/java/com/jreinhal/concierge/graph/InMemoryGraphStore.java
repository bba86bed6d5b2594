package com.jreinhal.concierge.graph;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adjacency kept in process. Same query surface as the durable store, nothing survives a restart.
 */
public class InMemoryGraphStore implements GraphStore {
    private final Map<String, GraphNode> nodes = new ConcurrentHashMap<>();
    private final Map<String, GraphEdge> edges = new ConcurrentHashMap<>();
    private final Map<String, Long> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void upsertNode(GraphNode node) {
        this.nodes.merge(node.nodeId(), node, GraphNode::merge);
    }

    @Override
    public void upsertEdge(GraphEdge edge) {
        this.edges.merge(edge.edgeId(), edge, (existing, incoming) ->
                existing.createdAt().isAfter(incoming.createdAt()) ? incoming : existing);
    }

    @Override
    public Optional<GraphNode> findNode(String tenantId, String nodeId) {
        GraphNode node = this.nodes.get(nodeId);
        return node != null && node.tenantId().equals(tenantId) ? Optional.of(node) : Optional.empty();
    }

    @Override
    public List<GraphNode> findNodes(String tenantId, NodeType type, String attrKey, Object attrValue) {
        return this.nodes.values().stream()
                .filter(n -> n.tenantId().equals(tenantId) && n.type() == type)
                .filter(n -> attrKey == null || Objects.equals(String.valueOf(attrValue), n.attrString(attrKey)))
                .sorted(Comparator.comparing(GraphNode::createdAt).thenComparing(GraphNode::nodeId))
                .toList();
    }

    @Override
    public List<GraphEdge> outgoing(String tenantId, String fromId, EdgeLabel label) {
        return this.edges.values().stream()
                .filter(e -> e.tenantId().equals(tenantId) && e.fromId().equals(fromId) && (label == null || e.label() == label))
                .sorted(Comparator.comparing(GraphEdge::edgeId))
                .toList();
    }

    @Override
    public List<GraphEdge> incoming(String tenantId, String toId, EdgeLabel label) {
        return this.edges.values().stream()
                .filter(e -> e.tenantId().equals(tenantId) && e.toId().equals(toId) && (label == null || e.label() == label))
                .sorted(Comparator.comparing(GraphEdge::edgeId))
                .toList();
    }

    @Override
    public Map<NodeType, Long> countNodes(String tenantId) {
        Map<NodeType, Long> counts = new EnumMap<>(NodeType.class);
        for (NodeType type : NodeType.values()) {
            counts.put(type, 0L);
        }
        for (GraphNode node : this.nodes.values()) {
            if (node.tenantId().equals(tenantId)) {
                counts.merge(node.type(), 1L, Long::sum);
            }
        }
        return counts;
    }

    @Override
    public long countEdges(String tenantId) {
        return this.edges.values().stream().filter(e -> e.tenantId().equals(tenantId)).count();
    }

    @Override
    public long deleteNodes(String tenantId, Collection<String> nodeIds) {
        Set<String> doomed = new HashSet<>(nodeIds);
        long removed = 0;
        for (String nodeId : doomed) {
            GraphNode node = this.nodes.get(nodeId);
            if (node != null && node.tenantId().equals(tenantId) && this.nodes.remove(nodeId, node)) {
                removed++;
            }
        }
        this.edges.values().removeIf(e -> e.tenantId().equals(tenantId) && (doomed.contains(e.fromId()) || doomed.contains(e.toId())));
        return removed;
    }

    @Override
    public long checkpoint(String tenantId) {
        return this.checkpoints.getOrDefault(tenantId, 0L);
    }

    @Override
    public void advanceCheckpoint(String tenantId, long sequenceNo) {
        this.checkpoints.merge(tenantId, sequenceNo, Math::max);
    }

    @Override
    public void clear(String tenantId) {
        this.nodes.values().removeIf(n -> n.tenantId().equals(tenantId));
        this.edges.values().removeIf(e -> e.tenantId().equals(tenantId));
        this.checkpoints.remove(tenantId);
    }

    @Override
    public boolean isDurable() {
        return false;
    }
}
