package com.jreinhal.concierge.activity;

import java.util.List;

public final class ActivityEventTypes {
    public static final String TICKET_CREATED = "ticket.created";
    public static final String TICKET_UPDATED = "ticket.updated";
    public static final String TICKET_RESOLVED = "ticket.resolved";
    public static final String ARTICLE_PUBLISHED = "article.published";

    public static final String HITL_CREATED = "hitl.created";
    public static final String HITL_CLAIMED = "hitl.claimed";
    public static final String HITL_RELEASED = "hitl.released";
    public static final String HITL_APPROVED = "hitl.approved";
    public static final String HITL_REJECTED = "hitl.rejected";
    public static final String HITL_MODIFIED = "hitl.modified";
    public static final String HITL_REASSIGNED = "hitl.reassigned";
    public static final String HITL_ESCALATION_NOTIFIED = "hitl.escalation_notified";
    public static final String HITL_PRIORITY_ESCALATED = "hitl.priority_escalated";
    public static final String SLA_BREACHED = "sla.breached";

    public static final String FEEDBACK_RECORDED = "feedback.recorded";
    public static final String GOLDEN_PATH_RECORDED = "golden_path.recorded";

    public static final String PLAYBOOK_CREATED = "playbook.created";
    public static final String PLAYBOOK_UPDATED = "playbook.updated";
    public static final String PLAYBOOK_SUPERSEDED = "playbook.superseded";
    public static final String PLAYBOOK_EXECUTED = "playbook.executed";

    public static final String COMPLIANCE_PURGED = "compliance.purged";

    /** Payload keys that identify the person an event is about. */
    public static final List<String> SUBJECT_KEYS = List.of("customerId", "subjectId");

    private ActivityEventTypes() {
    }
}
