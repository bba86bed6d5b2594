package com.jreinhal.concierge.hitl.escalation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.jreinhal.concierge.activity.ActivityEvent;
import com.jreinhal.concierge.activity.ActivityEventTypes;
import com.jreinhal.concierge.hitl.HitlPriority;
import com.jreinhal.concierge.hitl.HitlQueueService;
import com.jreinhal.concierge.hitl.HitlRequest;
import com.jreinhal.concierge.hitl.HitlRequestType;
import com.jreinhal.concierge.hitl.HitlStatus;
import com.jreinhal.concierge.support.ConciergeHarness;
import com.jreinhal.concierge.tenant.TenantContext;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ContextEscalationPolicyTest {

    private ConciergeHarness harness;
    private TenantContext acme;
    private Instant start;

    @BeforeEach
    void setUp() {
        harness = new ConciergeHarness();
        acme = harness.tenant("acme");
        start = harness.clock.instant();
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private HitlRequest submit(HitlPriority priority, Map<String, Object> context) {
        return harness.queue.submit(acme, new HitlQueueService.SubmitCommand("agent-1", HitlRequestType.APPROVAL,
                priority, "Refund order 1142?", context, null, null));
    }

    private ActivityEvent lastEventOfType(String type) {
        List<ActivityEvent> events = harness.activityStream.read(acme, 0L, 1000).stream()
                .filter(e -> type.equals(e.eventType()))
                .toList();
        assertThat(events).isNotEmpty();
        return events.get(events.size() - 1);
    }

    @Nested
    @DisplayName("context rules at submit")
    class Classification {

        @Test
        void lowConfidenceRaisesPriorityAndTheDeadlineFollows() {
            HitlRequest request = submit(HitlPriority.LOW, Map.of("confidence", 0.6));

            assertThat(request.priority()).isEqualTo(HitlPriority.MEDIUM);
            assertThat(request.slaDeadline()).isEqualTo(start.plus(Duration.ofHours(2)));
            assertThat(request.appliedEscalations()).containsExactly("low-confidence");
            assertThat(request.contextString(ContextEscalationPolicy.CTX_ESCALATION_TRIGGER)).isEqualTo("LOW_CONFIDENCE");
            assertThat(request.contextString(ContextEscalationPolicy.CTX_ESCALATION_LEVEL)).isEqualTo("L2");
        }

        @Test
        void sensitiveTopicGoesStraightToCritical() {
            HitlRequest request = submit(HitlPriority.MEDIUM, Map.of("topic", "Legal"));

            assertThat(request.priority()).isEqualTo(HitlPriority.CRITICAL);
            assertThat(request.slaDeadline()).isEqualTo(start.plus(Duration.ofMinutes(10)));
            assertThat(request.contextString(ContextEscalationPolicy.CTX_ESCALATION_LEVEL)).isEqualTo("MANAGER");
            assertThat(lastEventOfType(ActivityEventTypes.HITL_CREATED).payload())
                    .containsEntry(ContextEscalationPolicy.CTX_ESCALATION_RULE, "sensitive-topic")
                    .containsEntry("priority", "CRITICAL");
        }

        @Test
        void repeatedFailuresReportedAsTextStillCount() {
            HitlRequest request = submit(HitlPriority.LOW, Map.of("failureCount", "3"));

            assertThat(request.priority()).isEqualTo(HitlPriority.HIGH);
            assertThat(request.contextString(ContextEscalationPolicy.CTX_ESCALATION_LEVEL)).isEqualTo("L3");
        }

        @Test
        void neverLowersTheRequestedPriority() {
            HitlRequest request = submit(HitlPriority.CRITICAL, Map.of("sentiment", "angry"));

            assertThat(request.priority()).isEqualTo(HitlPriority.CRITICAL);
            assertThat(request.appliedEscalations()).containsExactly("negative-sentiment");
        }

        @Test
        void firstMatchingRuleWins() {
            HitlRequest request = submit(HitlPriority.LOW, Map.of("confidence", 0.5, "topic", "security"));

            assertThat(request.priority()).isEqualTo(HitlPriority.MEDIUM);
            assertThat(request.appliedEscalations()).containsExactly("low-confidence");
        }

        @Test
        void missingOrUnreadableSignalsLeaveTheRequestAlone() {
            HitlRequest request = submit(HitlPriority.LOW, Map.of("confidence", "n/a", "sentiment", "neutral", "vip", false));

            assertThat(request.priority()).isEqualTo(HitlPriority.LOW);
            assertThat(request.appliedEscalations()).isEmpty();
            assertThat(request.context()).doesNotContainKey(ContextEscalationPolicy.CTX_ESCALATION_RULE);
        }

        @Test
        void disabledEscalationSkipsContextRules() {
            harness.escalationProperties.setEnabled(false);

            assertThat(submit(HitlPriority.LOW, Map.of("vip", true)).priority()).isEqualTo(HitlPriority.LOW);
        }

        @Test
        void contextEscalatedRequestStillGetsTimeBasedRules() {
            HitlRequest request = submit(HitlPriority.LOW, Map.of("vip", "TRUE"));
            harness.clock.advance(Duration.ofMinutes(21));

            harness.escalationEngine.evaluate();

            HitlRequest updated = harness.queue.get(acme, request.requestId());
            assertThat(updated.priority()).isEqualTo(HitlPriority.CRITICAL);
            assertThat(updated.appliedEscalations()).containsExactly("vip-customer", "high-pending-raise");
        }

        @Test
        void ruleWithoutConditionIsRejected() {
            assertThatThrownBy(() -> new ContextEscalationRule("empty", EscalationTrigger.POLICY_VIOLATION,
                    EscalationLevel.L1, HitlPriority.HIGH, "policy", null, null, null, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void customRulesReplaceTheDefaults() {
            harness.contextEscalation.setRules(List.of(new ContextEscalationRule("policy-flag", EscalationTrigger.POLICY_VIOLATION,
                    EscalationLevel.EXECUTIVE, HitlPriority.CRITICAL, "policyFlag", null, null, null, "refund-limit")));

            assertThat(submit(HitlPriority.LOW, Map.of("confidence", 0.1)).priority()).isEqualTo(HitlPriority.LOW);
            HitlRequest flagged = submit(HitlPriority.LOW, Map.of("policyFlag", "Refund-Limit"));
            assertThat(flagged.priority()).isEqualTo(HitlPriority.CRITICAL);
            assertThat(flagged.contextString(ContextEscalationPolicy.CTX_ESCALATION_LEVEL)).isEqualTo("EXECUTIVE");
        }
    }

    @Nested
    @DisplayName("auto-assignment")
    class AutoAssign {

        @BeforeEach
        void reviewers() {
            harness.reviewerService.registerReviewer(acme, "rev-a", "Ana", List.of(), 5);
            harness.reviewerService.registerReviewer(acme, "rev-b", "Ben", List.of(), 5);
            HitlRequest busy = submit(HitlPriority.LOW, Map.of());
            harness.queue.claim(acme, busy.requestId(), "rev-a");
        }

        @Test
        void offByDefault() {
            assertThat(submit(HitlPriority.CRITICAL, Map.of()).status()).isEqualTo(HitlStatus.PENDING);
        }

        @Test
        void urgentRequestGoesToLeastLoadedReviewer() {
            harness.escalationProperties.setAutoAssign(true);

            HitlRequest request = submit(HitlPriority.HIGH, Map.of());

            assertThat(request.status()).isEqualTo(HitlStatus.ASSIGNED);
            assertThat(request.assignedTo()).isEqualTo("rev-b");
            assertThat(lastEventOfType(ActivityEventTypes.HITL_CLAIMED).payload())
                    .containsEntry("reviewerId", "rev-b")
                    .containsEntry("autoAssigned", true);
        }

        @Test
        void lowPriorityWaitsForAClaim() {
            harness.escalationProperties.setAutoAssign(true);

            assertThat(submit(HitlPriority.LOW, Map.of()).status()).isEqualTo(HitlStatus.PENDING);
        }

        @Test
        void contextEscalationCanMakeARequestEligible() {
            harness.escalationProperties.setAutoAssign(true);

            HitlRequest request = submit(HitlPriority.LOW, Map.of("topic", "privacy"));

            assertThat(request.priority()).isEqualTo(HitlPriority.CRITICAL);
            assertThat(request.status()).isEqualTo(HitlStatus.ASSIGNED);
        }

        @Test
        void noFreeReviewerLeavesTheRequestPending() {
            harness.escalationProperties.setAutoAssign(true);
            harness.reviewerService.setAvailability(acme, "rev-a", false);
            harness.reviewerService.setAvailability(acme, "rev-b", false);

            HitlRequest request = submit(HitlPriority.CRITICAL, Map.of());

            assertThat(request.status()).isEqualTo(HitlStatus.PENDING);
            assertThat(harness.queue.claim(acme, request.requestId(), "rev-a").assignedTo()).isEqualTo("rev-a");
        }
    }
}
