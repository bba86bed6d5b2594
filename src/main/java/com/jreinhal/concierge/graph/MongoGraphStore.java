package com.jreinhal.concierge.graph;

import com.mongodb.client.result.DeleteResult;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/**
 * Graph in {@code graph_nodes} / {@code graph_edges}; per-tenant projection checkpoints in
 * {@code graph_checkpoints}. Every write is an upsert on the natural id, attributes are set key by
 * key, and timestamps use {@code $min}/{@code $max}, so concurrent or repeated application of the
 * same event converges.
 */
public class MongoGraphStore implements GraphStore {
    static final String NODES = "graph_nodes";
    static final String EDGES = "graph_edges";
    static final String CHECKPOINTS = "graph_checkpoints";
    private final MongoTemplate mongoTemplate;

    public MongoGraphStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void upsertNode(GraphNode node) {
        Update update = new Update()
                .setOnInsert("tenantId", node.tenantId())
                .setOnInsert("type", node.type().name())
                .setOnInsert("businessId", node.businessId())
                .min("createdAt", node.createdAt())
                .max("updatedAt", node.updatedAt());
        for (Map.Entry<String, Object> attr : node.attrs().entrySet()) {
            update.set("attrs." + attr.getKey(), attr.getValue());
        }
        this.mongoTemplate.upsert(Query.query(Criteria.where("_id").is(node.nodeId())), update, NODES);
    }

    @Override
    public void upsertEdge(GraphEdge edge) {
        Update update = new Update()
                .setOnInsert("tenantId", edge.tenantId())
                .setOnInsert("fromId", edge.fromId())
                .setOnInsert("label", edge.label().name())
                .setOnInsert("toId", edge.toId())
                .min("createdAt", edge.createdAt());
        this.mongoTemplate.upsert(Query.query(Criteria.where("_id").is(edge.edgeId())), update, EDGES);
    }

    @Override
    public Optional<GraphNode> findNode(String tenantId, String nodeId) {
        Query query = Query.query(Criteria.where("_id").is(nodeId).and("tenantId").is(tenantId));
        return Optional.ofNullable(this.mongoTemplate.findOne(query, GraphNode.class, NODES));
    }

    @Override
    public List<GraphNode> findNodes(String tenantId, NodeType type, String attrKey, Object attrValue) {
        Criteria criteria = Criteria.where("tenantId").is(tenantId).and("type").is(type.name());
        if (attrKey != null) {
            criteria = criteria.and("attrs." + attrKey).is(attrValue);
        }
        Query query = Query.query(criteria).with(Sort.by("createdAt", "_id"));
        return this.mongoTemplate.find(query, GraphNode.class, NODES);
    }

    @Override
    public List<GraphEdge> outgoing(String tenantId, String fromId, EdgeLabel label) {
        return edges(Criteria.where("tenantId").is(tenantId).and("fromId").is(fromId), label);
    }

    @Override
    public List<GraphEdge> incoming(String tenantId, String toId, EdgeLabel label) {
        return edges(Criteria.where("tenantId").is(tenantId).and("toId").is(toId), label);
    }

    @Override
    public Map<NodeType, Long> countNodes(String tenantId) {
        Map<NodeType, Long> counts = new EnumMap<>(NodeType.class);
        for (NodeType type : NodeType.values()) {
            counts.put(type, this.mongoTemplate.count(
                    Query.query(Criteria.where("tenantId").is(tenantId).and("type").is(type.name())), NODES));
        }
        return counts;
    }

    @Override
    public long countEdges(String tenantId) {
        return this.mongoTemplate.count(Query.query(Criteria.where("tenantId").is(tenantId)), EDGES);
    }

    @Override
    public long deleteNodes(String tenantId, Collection<String> nodeIds) {
        if (nodeIds.isEmpty()) {
            return 0L;
        }
        this.mongoTemplate.remove(Query.query(Criteria.where("tenantId").is(tenantId)
                .orOperator(Criteria.where("fromId").in(nodeIds), Criteria.where("toId").in(nodeIds))), EDGES);
        DeleteResult result = this.mongoTemplate.remove(
                Query.query(Criteria.where("tenantId").is(tenantId).and("_id").in(nodeIds)), NODES);
        return result.getDeletedCount();
    }

    @Override
    public long checkpoint(String tenantId) {
        Document doc = this.mongoTemplate.findById(tenantId, Document.class, CHECKPOINTS);
        Object value = doc != null ? doc.get("sequenceNo") : null;
        return value instanceof Number n ? n.longValue() : 0L;
    }

    @Override
    public void advanceCheckpoint(String tenantId, long sequenceNo) {
        this.mongoTemplate.upsert(Query.query(Criteria.where("_id").is(tenantId)),
                new Update().max("sequenceNo", sequenceNo), CHECKPOINTS);
    }

    @Override
    public void clear(String tenantId) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId));
        this.mongoTemplate.remove(query, EDGES);
        this.mongoTemplate.remove(query, NODES);
        this.mongoTemplate.remove(Query.query(Criteria.where("_id").is(tenantId)), CHECKPOINTS);
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    private List<GraphEdge> edges(Criteria criteria, EdgeLabel label) {
        if (label != null) {
            criteria = criteria.and("label").is(label.name());
        }
        return this.mongoTemplate.find(Query.query(criteria).with(Sort.by("_id")), GraphEdge.class, EDGES);
    }
}
