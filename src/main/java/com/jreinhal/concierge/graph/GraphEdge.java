package com.jreinhal.concierge.graph;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "graph_edges")
@CompoundIndexes({
    @CompoundIndex(name = "tenant_from_idx", def = "{'tenantId': 1, 'fromId': 1, 'label': 1}"),
    @CompoundIndex(name = "tenant_to_idx", def = "{'tenantId': 1, 'toId': 1, 'label': 1}")
})
public record GraphEdge(
    @Id String edgeId,
    String tenantId,
    String fromId,
    EdgeLabel label,
    String toId,
    Instant createdAt
) {
    public static String edgeId(String fromId, EdgeLabel label, String toId) {
        return fromId + ">" + label.name() + ">" + toId;
    }

    public static GraphEdge of(String tenantId, String fromId, EdgeLabel label, String toId, Instant at) {
        return new GraphEdge(edgeId(fromId, label, toId), tenantId, fromId, label, toId, at);
    }
}
