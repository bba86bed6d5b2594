package com.jreinhal.concierge.graph;

import com.jreinhal.concierge.activity.ActivityEvent;
import com.jreinhal.concierge.activity.ActivityEventTypes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event type to graph upserts. Pure: the same event always yields the same mutation, and unknown
 * event types yield {@link GraphMutation#EMPTY}.
 */
public final class GraphRecipes {
    static final String ATTR_CATEGORY = "category";
    static final String ATTR_SUCCESS = "success";
    static final String ATTR_STEPS = "steps";
    static final String ATTR_CONFIDENCE = "confidence";
    static final String ATTR_AGENT_ID = "agentId";
    static final String ATTR_TICKET_ID = "ticketId";
    static final String ATTR_CUSTOMER_ID = "customerId";

    private GraphRecipes() {
    }

    public static GraphMutation plan(ActivityEvent event) {
        Instant at = event.timestamp() != null ? event.timestamp() : Instant.EPOCH;
        GraphMutation.Builder builder = GraphMutation.builder(event.tenantId(), at);
        switch (event.eventType()) {
            case ActivityEventTypes.TICKET_CREATED, ActivityEventTypes.TICKET_UPDATED ->
                    ticket(event, builder, attrsOf(event, ATTR_CATEGORY, "subject", "priority", "status", "channel"));
            case ActivityEventTypes.TICKET_RESOLVED -> ticketResolved(event, builder);
            case ActivityEventTypes.HITL_CREATED -> ticket(event, builder, attrsOf(event, ATTR_CATEGORY));
            case ActivityEventTypes.HITL_APPROVED, ActivityEventTypes.HITL_MODIFIED -> decision(event, builder, true);
            case ActivityEventTypes.HITL_REJECTED -> decision(event, builder, false);
            case ActivityEventTypes.ARTICLE_PUBLISHED -> article(event, builder);
            case ActivityEventTypes.PLAYBOOK_CREATED, ActivityEventTypes.PLAYBOOK_UPDATED,
                 ActivityEventTypes.PLAYBOOK_SUPERSEDED -> playbook(event, builder);
            default -> {
                return GraphMutation.EMPTY;
            }
        }
        return builder.build();
    }

    /**
     * Ticket node plus its customer (FILED) and handling agent (HANDLED_BY) when the event names them.
     *
     * @return the ticket node id, or null when the event carries no ticket id
     */
    private static String ticket(ActivityEvent event, GraphMutation.Builder builder, Map<String, Object> attrs) {
        String ticketId = event.payloadString(ATTR_TICKET_ID);
        if (ticketId == null) {
            return null;
        }
        String ticketNode = builder.node(NodeType.TICKET, ticketId, attrs);
        String customerId = event.payloadString(ATTR_CUSTOMER_ID);
        if (customerId != null) {
            String customerNode = builder.node(NodeType.CUSTOMER, customerId, attrsOf(event, "customerName", "customerTier"));
            builder.edge(customerNode, EdgeLabel.FILED, ticketNode);
        }
        String agentId = event.payloadString(ATTR_AGENT_ID);
        if (agentId != null) {
            String agentNode = builder.node(NodeType.AGENT, agentId, attrsOf(event, "blueprint"));
            builder.edge(ticketNode, EdgeLabel.HANDLED_BY, agentNode);
        }
        return ticketNode;
    }

    private static void decision(ActivityEvent event, GraphMutation.Builder builder, boolean success) {
        String requestId = event.payloadString("requestId");
        if (requestId == null) {
            return;
        }
        String ticketNode = ticket(event, builder, attrsOf(event, ATTR_CATEGORY));
        Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put(ATTR_SUCCESS, success);
        attrs.put("approved", success);
        copy(event, attrs, ATTR_CATEGORY, "decision", "reviewerId", ATTR_AGENT_ID, ATTR_TICKET_ID, ATTR_CUSTOMER_ID, ATTR_CONFIDENCE);
        attrs.put(ATTR_STEPS, listOf(event, ATTR_STEPS));
        resolution(event, builder, requestId, attrs, ticketNode);
    }

    private static void ticketResolved(ActivityEvent event, GraphMutation.Builder builder) {
        Map<String, Object> ticketAttrs = attrsOf(event, ATTR_CATEGORY, "subject");
        ticketAttrs.put("status", "resolved");
        String ticketNode = ticket(event, builder, ticketAttrs);
        if (ticketNode == null) {
            return;
        }
        List<String> steps = listOf(event, ATTR_STEPS);
        String resolutionId = event.payloadString("resolutionId");
        if (resolutionId == null && steps.isEmpty()) {
            return;
        }
        Map<String, Object> attrs = new LinkedHashMap<>();
        Object success = event.payload() != null ? event.payload().get(ATTR_SUCCESS) : null;
        attrs.put(ATTR_SUCCESS, success == null || Boolean.parseBoolean(String.valueOf(success)));
        copy(event, attrs, ATTR_CATEGORY, ATTR_AGENT_ID, ATTR_TICKET_ID, ATTR_CUSTOMER_ID, ATTR_CONFIDENCE);
        attrs.put(ATTR_STEPS, steps);
        resolution(event, builder, resolutionId != null ? resolutionId : "ticket-" + event.payloadString(ATTR_TICKET_ID), attrs, ticketNode);
    }

    private static void resolution(ActivityEvent event, GraphMutation.Builder builder, String resolutionId,
                                   Map<String, Object> attrs, String ticketNode) {
        String resolutionNode = builder.node(NodeType.RESOLUTION, resolutionId, attrs);
        if (ticketNode != null) {
            builder.edge(ticketNode, EdgeLabel.RESOLVED_BY, resolutionNode);
        }
        String agentId = event.payloadString(ATTR_AGENT_ID);
        if (agentId != null) {
            String agentNode = builder.node(NodeType.AGENT, agentId, Map.of());
            builder.edge(resolutionNode, EdgeLabel.EXECUTED_BY, agentNode);
        }
        for (String articleId : listOf(event, "articles")) {
            String articleNode = builder.node(NodeType.ARTICLE, articleId, Map.of());
            builder.edge(resolutionNode, EdgeLabel.USED_ARTICLE, articleNode);
        }
    }

    private static void article(ActivityEvent event, GraphMutation.Builder builder) {
        String articleId = event.payloadString("articleId");
        if (articleId != null) {
            builder.node(NodeType.ARTICLE, articleId, attrsOf(event, "title", "topic", "url"));
        }
    }

    private static void playbook(ActivityEvent event, GraphMutation.Builder builder) {
        String playbookId = event.payloadString("playbookId");
        if (playbookId == null) {
            return;
        }
        Map<String, Object> attrs = new LinkedHashMap<>();
        copy(event, attrs, ATTR_CATEGORY, "name", "status", "successRate", "sampleCount", "version");
        attrs.put(ATTR_STEPS, listOf(event, ATTR_STEPS));
        String playbookNode = builder.node(NodeType.PLAYBOOK, playbookId, attrs);
        for (String resolutionId : listOf(event, "sourceResolutionIds")) {
            builder.edge(playbookNode, EdgeLabel.DERIVED_FROM, GraphNode.nodeId(event.tenantId(), NodeType.RESOLUTION, resolutionId));
        }
    }

    private static Map<String, Object> attrsOf(ActivityEvent event, String... keys) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        copy(event, attrs, keys);
        return attrs;
    }

    private static void copy(ActivityEvent event, Map<String, Object> attrs, String... keys) {
        if (event.payload() == null) {
            return;
        }
        for (String key : keys) {
            Object value = event.payload().get(key);
            if (value != null) {
                attrs.put(key, value);
            }
        }
    }

    private static List<String> listOf(ActivityEvent event, String key) {
        Object value = event.payload() != null ? event.payload().get(key) : null;
        List<String> result = new ArrayList<>();
        if (value instanceof Iterable<?> items) {
            for (Object item : items) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
        }
        else if (value != null) {
            result.add(String.valueOf(value));
        }
        return result;
    }
}
