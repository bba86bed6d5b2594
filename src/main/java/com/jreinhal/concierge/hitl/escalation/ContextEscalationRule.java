package com.jreinhal.concierge.hitl.escalation;

import com.jreinhal.concierge.hitl.HitlPriority;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Matches one key of a new request's context: numerically against {@code min}/{@code max}, or by
 * string against {@code anyOf} or {@code equalTo} (case-insensitive). Every bound that is set must
 * hold; a missing or unparseable value never matches.
 */
public record ContextEscalationRule(
    String name,
    EscalationTrigger trigger,
    EscalationLevel level,
    HitlPriority priority,
    String key,
    Double min,
    Double max,
    List<String> anyOf,
    String equalTo
) {
    public ContextEscalationRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Context escalation rule name is required");
        }
        if (trigger == null || priority == null) {
            throw new IllegalArgumentException("Context escalation rule " + name + " needs a trigger and a priority");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Context escalation rule " + name + " has no context key");
        }
        level = level != null ? level : EscalationLevel.L2;
        anyOf = anyOf == null ? List.of() : anyOf.stream().map(v -> v.trim().toLowerCase(Locale.ROOT)).toList();
        if (min == null && max == null && anyOf.isEmpty() && equalTo == null) {
            throw new IllegalArgumentException("Context escalation rule " + name + " has no condition");
        }
    }

    public boolean matches(Map<String, Object> context) {
        Object value = context != null ? context.get(this.key) : null;
        if (value == null) {
            return false;
        }
        if (this.min != null || this.max != null) {
            Double number = toNumber(value);
            if (number == null || (this.min != null && number < this.min) || (this.max != null && number > this.max)) {
                return false;
            }
        }
        String text = String.valueOf(value).trim();
        if (!this.anyOf.isEmpty() && !this.anyOf.contains(text.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return this.equalTo == null || this.equalTo.equalsIgnoreCase(text);
    }

    private static Double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.valueOf(String.valueOf(value).trim());
        }
        catch (NumberFormatException e) {
            return null;
        }
    }
}
