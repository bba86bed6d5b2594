package com.jreinhal.concierge.graph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Identified by its natural key (tenant, type, business id), never by the event that produced it,
 * so replays converge on the same node. Timestamps come from event timestamps, not wall time.
 * Attributes are read-only; change them through {@link #merge(GraphNode)}.
 */
@Document(collection = "graph_nodes")
@CompoundIndexes({
    @CompoundIndex(name = "tenant_type_idx", def = "{'tenantId': 1, 'type': 1}"),
    @CompoundIndex(name = "tenant_type_category_idx", def = "{'tenantId': 1, 'type': 1, 'attrs.category': 1}")
})
public record GraphNode(
    @Id String nodeId,
    String tenantId,
    NodeType type,
    String businessId,
    Map<String, Object> attrs,
    Instant createdAt,
    Instant updatedAt
) {
    public GraphNode {
        attrs = frozen(attrs);
    }

    public static String nodeId(String tenantId, NodeType type, String businessId) {
        return tenantId + "|" + type.key() + "|" + businessId;
    }

    public static GraphNode of(String tenantId, NodeType type, String businessId, Map<String, Object> attrs, Instant at) {
        return new GraphNode(nodeId(tenantId, type, businessId), tenantId, type, businessId, attrs, at, at);
    }

    public String attrString(String key) {
        Object value = this.attrs.get(key);
        return value != null ? String.valueOf(value) : null;
    }

    public boolean attrBoolean(String key) {
        Object value = this.attrs.get(key);
        return value instanceof Boolean flag ? flag : Boolean.parseBoolean(String.valueOf(value));
    }

    public double attrDouble(String key, double fallback) {
        Object value = this.attrs.get(key);
        return value instanceof Number number ? number.doubleValue() : fallback;
    }

    public List<String> attrList(String key) {
        Object value = this.attrs.get(key);
        if (value instanceof List<?> items) {
            return items.stream().filter(Objects::nonNull).map(String::valueOf).toList();
        }
        return List.of();
    }

    private static Map<String, Object> frozen(Map<String, Object> attrs) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (attrs != null) {
            attrs.forEach((key, value) -> copy.put(key, value instanceof List<?> items
                    ? Collections.unmodifiableList(new ArrayList<>(items)) : value));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Merges another observation of the same node: attributes are overwritten key by key,
     * {@code createdAt} keeps the earliest and {@code updatedAt} the latest timestamp.
     */
    public GraphNode merge(GraphNode other) {
        Map<String, Object> merged = new LinkedHashMap<>(this.attrs);
        merged.putAll(other.attrs());
        Instant created = this.createdAt.isBefore(other.createdAt()) ? this.createdAt : other.createdAt();
        Instant updated = this.updatedAt.isAfter(other.updatedAt()) ? this.updatedAt : other.updatedAt();
        return new GraphNode(this.nodeId, this.tenantId, this.type, this.businessId, merged, created, updated);
    }
}
