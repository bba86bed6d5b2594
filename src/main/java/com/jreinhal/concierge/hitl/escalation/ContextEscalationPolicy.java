package com.jreinhal.concierge.hitl.escalation;

import com.jreinhal.concierge.hitl.HitlIntakePolicy;
import com.jreinhal.concierge.hitl.HitlPriority;
import com.jreinhal.concierge.hitl.HitlRequest;
import com.jreinhal.concierge.tenant.TenantContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Escalates new requests on what the agent reported (confidence, sentiment, customer value,
 * failed attempts, topic) and optionally auto-assigns urgent ones. Complements the age-based rules
 * of {@link EscalationPolicyEngine}, which only look at requests already in the queue.
 */
@Component
public class ContextEscalationPolicy implements HitlIntakePolicy {
    private static final Logger log = LoggerFactory.getLogger(ContextEscalationPolicy.class);
    public static final String CTX_ESCALATION_RULE = "escalationRule";
    public static final String CTX_ESCALATION_TRIGGER = "escalationTrigger";
    public static final String CTX_ESCALATION_LEVEL = "escalationLevel";

    private final EscalationProperties properties;
    private final ReviewerSelector reviewerSelector;
    private volatile List<ContextEscalationRule> rules;

    public ContextEscalationPolicy(EscalationProperties properties, ReviewerSelector reviewerSelector) {
        this.properties = properties;
        this.reviewerSelector = reviewerSelector;
        this.rules = properties.toContextRules();
    }

    /**
     * First matching rule wins, in configured order.
     */
    @Override
    public Optional<Escalation> classify(TenantContext ctx, HitlPriority requested, Map<String, Object> context) {
        if (!this.properties.isEnabled()) {
            return Optional.empty();
        }
        for (ContextEscalationRule rule : this.rules) {
            if (!rule.matches(context)) {
                continue;
            }
            HitlPriority priority = rule.priority().rank() < requested.rank() ? rule.priority() : requested;
            Map<String, Object> annotations = new LinkedHashMap<>();
            annotations.put(CTX_ESCALATION_RULE, rule.name());
            annotations.put(CTX_ESCALATION_TRIGGER, rule.trigger().name());
            annotations.put(CTX_ESCALATION_LEVEL, rule.level().name());
            log.debug("Context rule {} matched for tenant {}: {} -> {}", rule.name(), ctx.tenantId(), requested, priority);
            return Optional.of(new Escalation(rule.name(), priority, annotations));
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> autoAssignee(TenantContext ctx, HitlRequest request) {
        if (!this.properties.isAutoAssign() || !this.properties.getAutoAssignPriorities().contains(request.priority())) {
            return Optional.empty();
        }
        Optional<String> reviewer = this.reviewerSelector.select(ctx.tenantId(), null);
        if (reviewer.isEmpty()) {
            log.debug("No reviewer free to auto-assign HITL request {}", request.requestId());
        }
        return reviewer;
    }

    public List<ContextEscalationRule> rules() {
        return this.rules;
    }

    public void setRules(List<ContextEscalationRule> rules) {
        this.rules = List.copyOf(rules);
    }
}
