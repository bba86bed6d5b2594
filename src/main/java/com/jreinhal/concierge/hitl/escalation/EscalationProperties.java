package com.jreinhal.concierge.hitl.escalation;

import com.jreinhal.concierge.hitl.HitlPriority;
import com.jreinhal.concierge.hitl.HitlStatus;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "concierge.escalation")
public class EscalationProperties {
    /**
     * Master toggle for the escalation pass that follows each SLA sweep.
     */
    private boolean enabled = true;

    /**
     * Reviewer selection for reassignment: {@code least-loaded} or {@code round-robin}.
     */
    private String reassignStrategy = LeastLoadedReviewerStrategy.NAME;

    /**
     * Workload cap for reviewers registered without one.
     */
    private int maxWorkload = 10;

    /**
     * Open requests examined per pass.
     */
    private int scanLimit = 1000;

    /**
     * Default rules, applied to every tenant without an override. Evaluated in order.
     */
    private List<Rule> rules = defaultRules();

    /**
     * Rules checked against a new request's context when it is submitted. The first match raises
     * the request's priority before its SLA deadline is computed.
     */
    private List<ContextRule> contextRules = defaultContextRules();

    /**
     * Hand new requests straight to the least-loaded available reviewer instead of waiting for a claim.
     */
    private boolean autoAssign = false;

    /**
     * Priorities, after context escalation, that are auto-assigned when {@code auto-assign} is on.
     */
    private List<HitlPriority> autoAssignPriorities = new ArrayList<>(List.of(HitlPriority.CRITICAL, HitlPriority.HIGH));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getReassignStrategy() {
        return reassignStrategy;
    }

    public void setReassignStrategy(String reassignStrategy) {
        this.reassignStrategy = reassignStrategy;
    }

    public int getMaxWorkload() {
        return maxWorkload;
    }

    public void setMaxWorkload(int maxWorkload) {
        this.maxWorkload = maxWorkload;
    }

    public int getScanLimit() {
        return scanLimit;
    }

    public void setScanLimit(int scanLimit) {
        this.scanLimit = scanLimit;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public void setRules(List<Rule> rules) {
        this.rules = rules;
    }

    public List<ContextRule> getContextRules() {
        return contextRules;
    }

    public void setContextRules(List<ContextRule> contextRules) {
        this.contextRules = contextRules;
    }

    public boolean isAutoAssign() {
        return autoAssign;
    }

    public void setAutoAssign(boolean autoAssign) {
        this.autoAssign = autoAssign;
    }

    public List<HitlPriority> getAutoAssignPriorities() {
        return autoAssignPriorities;
    }

    public void setAutoAssignPriorities(List<HitlPriority> autoAssignPriorities) {
        this.autoAssignPriorities = autoAssignPriorities;
    }

    public List<ContextEscalationRule> toContextRules() {
        List<ContextEscalationRule> result = new ArrayList<>();
        for (ContextRule rule : this.contextRules) {
            result.add(rule.toRule());
        }
        return List.copyOf(result);
    }

    public List<EscalationRule> toRules() {
        List<EscalationRule> result = new ArrayList<>();
        for (Rule rule : this.rules) {
            result.add(rule.toRule());
        }
        return List.copyOf(result);
    }

    static List<Rule> defaultRules() {
        List<Rule> defaults = new ArrayList<>();
        defaults.add(new Rule("critical-pending-notify", HitlPriority.CRITICAL, HitlStatus.PENDING, Duration.ofMinutes(5), EscalationAction.NOTIFY));
        defaults.add(new Rule("critical-assigned-reassign", HitlPriority.CRITICAL, HitlStatus.ASSIGNED, Duration.ofMinutes(8), EscalationAction.REASSIGN));
        defaults.add(new Rule("high-pending-raise", HitlPriority.HIGH, HitlStatus.PENDING, Duration.ofMinutes(20), EscalationAction.AUTO_ESCALATE_PRIORITY));
        defaults.add(new Rule("medium-pending-raise", HitlPriority.MEDIUM, HitlStatus.PENDING, Duration.ofHours(1), EscalationAction.AUTO_ESCALATE_PRIORITY));
        return defaults;
    }

    static List<ContextRule> defaultContextRules() {
        List<ContextRule> defaults = new ArrayList<>();
        defaults.add(ContextRule.range("low-confidence", EscalationTrigger.LOW_CONFIDENCE, EscalationLevel.L2,
                HitlPriority.MEDIUM, "confidence", null, 0.75));
        defaults.add(ContextRule.oneOf("negative-sentiment", EscalationTrigger.NEGATIVE_SENTIMENT, EscalationLevel.L2,
                HitlPriority.HIGH, "sentiment", List.of("angry", "frustrated", "negative")));
        defaults.add(ContextRule.oneOf("vip-customer", EscalationTrigger.HIGH_VALUE_CUSTOMER, EscalationLevel.L2,
                HitlPriority.HIGH, "vip", List.of("true")));
        defaults.add(ContextRule.range("repeated-failures", EscalationTrigger.REPEATED_FAILURE, EscalationLevel.L3,
                HitlPriority.HIGH, "failureCount", 3.0, null));
        defaults.add(ContextRule.oneOf("sensitive-topic", EscalationTrigger.SENSITIVE_TOPIC, EscalationLevel.MANAGER,
                HitlPriority.CRITICAL, "topic", List.of("legal", "security", "privacy", "complaint")));
        return defaults;
    }

    public static class ContextRule {
        private String name;
        private EscalationTrigger trigger;
        private EscalationLevel level = EscalationLevel.L2;
        private HitlPriority priority;
        private String key;
        private Double min;
        private Double max;
        private List<String> anyOf = new ArrayList<>();
        private String equalTo;

        static ContextRule range(String name, EscalationTrigger trigger, EscalationLevel level, HitlPriority priority,
                                 String key, Double min, Double max) {
            ContextRule rule = base(name, trigger, level, priority, key);
            rule.setMin(min);
            rule.setMax(max);
            return rule;
        }

        static ContextRule oneOf(String name, EscalationTrigger trigger, EscalationLevel level, HitlPriority priority,
                                 String key, List<String> values) {
            ContextRule rule = base(name, trigger, level, priority, key);
            rule.setAnyOf(new ArrayList<>(values));
            return rule;
        }

        private static ContextRule base(String name, EscalationTrigger trigger, EscalationLevel level, HitlPriority priority,
                                        String key) {
            ContextRule rule = new ContextRule();
            rule.setName(name);
            rule.setTrigger(trigger);
            rule.setLevel(level);
            rule.setPriority(priority);
            rule.setKey(key);
            return rule;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public EscalationTrigger getTrigger() {
            return trigger;
        }

        public void setTrigger(EscalationTrigger trigger) {
            this.trigger = trigger;
        }

        public EscalationLevel getLevel() {
            return level;
        }

        public void setLevel(EscalationLevel level) {
            this.level = level;
        }

        public HitlPriority getPriority() {
            return priority;
        }

        public void setPriority(HitlPriority priority) {
            this.priority = priority;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public Double getMin() {
            return min;
        }

        public void setMin(Double min) {
            this.min = min;
        }

        public Double getMax() {
            return max;
        }

        public void setMax(Double max) {
            this.max = max;
        }

        public List<String> getAnyOf() {
            return anyOf;
        }

        public void setAnyOf(List<String> anyOf) {
            this.anyOf = anyOf;
        }

        public String getEqualTo() {
            return equalTo;
        }

        public void setEqualTo(String equalTo) {
            this.equalTo = equalTo;
        }

        ContextEscalationRule toRule() {
            return new ContextEscalationRule(this.name, this.trigger, this.level, this.priority, this.key, this.min,
                    this.max, this.anyOf, this.equalTo);
        }
    }

    public static class Rule {
        private String name;
        private HitlPriority priority;
        private HitlStatus status;
        private Duration minAge = Duration.ZERO;
        private EscalationAction action;

        public Rule() {
        }

        public Rule(String name, HitlPriority priority, HitlStatus status, Duration minAge, EscalationAction action) {
            this.name = name;
            this.priority = priority;
            this.status = status;
            this.minAge = minAge;
            this.action = action;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public HitlPriority getPriority() {
            return priority;
        }

        public void setPriority(HitlPriority priority) {
            this.priority = priority;
        }

        public HitlStatus getStatus() {
            return status;
        }

        public void setStatus(HitlStatus status) {
            this.status = status;
        }

        public Duration getMinAge() {
            return minAge;
        }

        public void setMinAge(Duration minAge) {
            this.minAge = minAge;
        }

        public EscalationAction getAction() {
            return action;
        }

        public void setAction(EscalationAction action) {
            this.action = action;
        }

        EscalationRule toRule() {
            return new EscalationRule(this.name, this.priority, this.status, this.minAge, this.action);
        }
    }
}
