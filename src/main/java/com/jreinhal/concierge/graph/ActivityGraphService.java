package com.jreinhal.concierge.graph;

import com.jreinhal.concierge.exception.BackingStoreUnavailableException;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.util.GuardedCall;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Read-only traversals over the activity graph. Dashboard queries degrade to empty results when the
 * graph store is unavailable; {@link #resolutionTraces} does not, because pattern mining must not
 * mistake an outage for an absence of evidence.
 */
@Service
public class ActivityGraphService {
    private static final Logger log = LoggerFactory.getLogger(ActivityGraphService.class);
    private static final int MAX_LIMIT = 200;
    private final GraphStore graphStore;
    private final GuardedCall guard;

    public ActivityGraphService(GraphStore graphStore, @Qualifier("graphStoreGuard") GuardedCall guard) {
        this.graphStore = graphStore;
        this.guard = guard;
    }

    /**
     * Tickets the customer filed, newest first, each with its resolutions.
     */
    public List<JourneyEntry> customerJourney(TenantContext ctx, String customerId) {
        requireText(customerId, "Customer id");
        try {
            return this.guard.call(() -> {
                String customerNode = GraphNode.nodeId(ctx.tenantId(), NodeType.CUSTOMER, customerId);
                List<JourneyEntry> journey = new ArrayList<>();
                for (GraphEdge filed : this.graphStore.outgoing(ctx.tenantId(), customerNode, EdgeLabel.FILED)) {
                    Optional<GraphNode> ticket = this.graphStore.findNode(ctx.tenantId(), filed.toId());
                    if (ticket.isEmpty()) {
                        continue;
                    }
                    List<GraphNode> resolutions = new ArrayList<>();
                    for (GraphEdge resolved : this.graphStore.outgoing(ctx.tenantId(), filed.toId(), EdgeLabel.RESOLVED_BY)) {
                        this.graphStore.findNode(ctx.tenantId(), resolved.toId()).ifPresent(resolutions::add);
                    }
                    resolutions.sort(Comparator.comparing(GraphNode::createdAt));
                    journey.add(new JourneyEntry(ticket.get(), resolutions));
                }
                journey.sort(Comparator.comparing((JourneyEntry e) -> e.ticket().createdAt()).reversed()
                        .thenComparing(e -> e.ticket().nodeId()));
                return journey;
            });
        }
        catch (BackingStoreUnavailableException e) {
            log.debug("Customer journey unavailable for tenant {}: {}", ctx.tenantId(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Successful resolutions in the category, most confident first.
     */
    public List<GraphNode> similarResolutions(TenantContext ctx, String category, int limit) {
        requireText(category, "Category");
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        try {
            return this.guard.call(() -> this.graphStore.findNodes(ctx.tenantId(), NodeType.RESOLUTION, GraphRecipes.ATTR_CATEGORY, category))
                    .stream()
                    .filter(node -> node.attrBoolean(GraphRecipes.ATTR_SUCCESS))
                    .sorted(Comparator.comparingDouble((GraphNode n) -> n.attrDouble(GraphRecipes.ATTR_CONFIDENCE, 0.0)).reversed()
                            .thenComparing(GraphNode::updatedAt, Comparator.reverseOrder())
                            .thenComparing(GraphNode::nodeId))
                    .limit(bounded)
                    .toList();
        }
        catch (BackingStoreUnavailableException e) {
            log.debug("Similar resolutions unavailable for tenant {}: {}", ctx.tenantId(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Every resolution in the category, successful or not, oldest first.
     *
     * @throws BackingStoreUnavailableException when the graph store cannot be read
     */
    public List<ResolutionTrace> resolutionTraces(TenantContext ctx, String category) {
        requireText(category, "Category");
        return this.guard.call(() -> this.graphStore.findNodes(ctx.tenantId(), NodeType.RESOLUTION, GraphRecipes.ATTR_CATEGORY, category))
                .stream()
                .map(node -> new ResolutionTrace(node.businessId(), node.attrString(GraphRecipes.ATTR_CATEGORY),
                        node.attrList(GraphRecipes.ATTR_STEPS), node.attrBoolean(GraphRecipes.ATTR_SUCCESS),
                        node.attrString(GraphRecipes.ATTR_AGENT_ID), node.attrDouble(GraphRecipes.ATTR_CONFIDENCE, 0.0),
                        node.createdAt()))
                .toList();
    }

    /**
     * Categories that have at least one resolution.
     */
    public Set<String> categories(TenantContext ctx) {
        Set<String> categories = new TreeSet<>();
        for (GraphNode node : this.guard.call(() -> this.graphStore.findNodes(ctx.tenantId(), NodeType.RESOLUTION, null, null))) {
            String category = node.attrString(GraphRecipes.ATTR_CATEGORY);
            if (category != null && !category.isBlank()) {
                categories.add(category);
            }
        }
        return categories;
    }

    public GraphStats stats(TenantContext ctx) {
        try {
            return this.guard.call(() -> new GraphStats(this.graphStore.countNodes(ctx.tenantId()),
                    this.graphStore.countEdges(ctx.tenantId()), this.graphStore.checkpoint(ctx.tenantId()),
                    this.graphStore.isDurable(), false));
        }
        catch (BackingStoreUnavailableException e) {
            Map<NodeType, Long> unknown = new EnumMap<>(NodeType.class);
            return new GraphStats(unknown, -1L, -1L, this.graphStore.isDurable(), true);
        }
    }

    /**
     * Deletes the customer node, the tickets it filed and their resolutions, with every edge touching
     * them.
     */
    public GraphPurgeResult purgeSubject(TenantContext ctx, String customerId) {
        requireText(customerId, "Subject id");
        return this.guard.call(() -> {
            String tenantId = ctx.tenantId();
            String customerNode = GraphNode.nodeId(tenantId, NodeType.CUSTOMER, customerId);
            Set<String> doomed = new LinkedHashSet<>();
            List<String> resolutionIds = new ArrayList<>();
            doomed.add(customerNode);
            for (GraphEdge filed : this.graphStore.outgoing(tenantId, customerNode, EdgeLabel.FILED)) {
                doomed.add(filed.toId());
                for (GraphEdge resolved : this.graphStore.outgoing(tenantId, filed.toId(), EdgeLabel.RESOLVED_BY)) {
                    doomed.add(resolved.toId());
                }
            }
            for (GraphNode resolution : this.graphStore.findNodes(tenantId, NodeType.RESOLUTION, GraphRecipes.ATTR_CUSTOMER_ID, customerId)) {
                doomed.add(resolution.nodeId());
            }
            for (String nodeId : doomed) {
                this.graphStore.findNode(tenantId, nodeId)
                        .filter(node -> node.type() == NodeType.RESOLUTION)
                        .ifPresent(node -> resolutionIds.add(node.businessId()));
            }
            long deleted = this.graphStore.deleteNodes(tenantId, doomed);
            return new GraphPurgeResult(deleted, List.copyOf(resolutionIds));
        });
    }

    public boolean isDegraded() {
        return this.guard.isDegraded();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }
}
