package com.jreinhal.concierge.hitl;

import com.jreinhal.concierge.tenant.TenantContext;
import java.util.Map;
import java.util.Optional;

/**
 * Consulted for every newly admitted request: once before it is stored, to raise its priority
 * from what the agent reported in the context, and once after, to pick a reviewer to hand it to.
 * Dedup hits are not seen again.
 */
public interface HitlIntakePolicy {

    HitlIntakePolicy NONE = new HitlIntakePolicy() {
        @Override
        public Optional<Escalation> classify(TenantContext ctx, HitlPriority requested, Map<String, Object> context) {
            return Optional.empty();
        }

        @Override
        public Optional<String> autoAssignee(TenantContext ctx, HitlRequest request) {
            return Optional.empty();
        }
    };

    Optional<Escalation> classify(TenantContext ctx, HitlPriority requested, Map<String, Object> context);

    Optional<String> autoAssignee(TenantContext ctx, HitlRequest request);

    /**
     * @param priority never lower than the priority the agent asked for
     * @param annotations added to the request context so reviewers see why it was escalated
     */
    record Escalation(String ruleName, HitlPriority priority, Map<String, Object> annotations) {
        public Escalation {
            annotations = Map.copyOf(annotations);
        }
    }
}
