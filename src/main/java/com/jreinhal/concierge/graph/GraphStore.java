package com.jreinhal.concierge.graph;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Node and edge persistence. Upserts are keyed by natural id and commutative with themselves,
 * so applying the same mutation twice leaves the store unchanged.
 */
public interface GraphStore {

    void upsertNode(GraphNode node);

    void upsertEdge(GraphEdge edge);

    Optional<GraphNode> findNode(String tenantId, String nodeId);

    /**
     * @param attrKey optional attribute filter, matched together with {@code attrValue}
     */
    List<GraphNode> findNodes(String tenantId, NodeType type, String attrKey, Object attrValue);

    List<GraphEdge> outgoing(String tenantId, String fromId, EdgeLabel label);

    List<GraphEdge> incoming(String tenantId, String toId, EdgeLabel label);

    Map<NodeType, Long> countNodes(String tenantId);

    long countEdges(String tenantId);

    /**
     * Deletes the nodes and every edge touching them.
     *
     * @return nodes deleted
     */
    long deleteNodes(String tenantId, Collection<String> nodeIds);

    /** Highest stream sequence number applied for the tenant, 0 when none. */
    long checkpoint(String tenantId);

    /** Moves the checkpoint forward; never backwards. */
    void advanceCheckpoint(String tenantId, long sequenceNo);

    /** Drops every node, edge and the checkpoint of the tenant. */
    void clear(String tenantId);

    boolean isDurable();
}
