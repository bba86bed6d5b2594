package com.jreinhal.concierge.hitl;

import com.jreinhal.concierge.hitl.escalation.EscalationPolicyEngine;
import com.jreinhal.concierge.hitl.escalation.EscalationReport;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * SLA sweep followed by an escalation pass. All state lives in the request store, so stopping
 * mid-sweep loses nothing: the next run picks up what is left.
 */
@Component
public class HitlMaintenanceScheduler {
    private static final Logger log = LoggerFactory.getLogger(HitlMaintenanceScheduler.class);
    private final HitlQueueService queueService;
    private final EscalationPolicyEngine escalationEngine;
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    public HitlMaintenanceScheduler(HitlQueueService queueService, EscalationPolicyEngine escalationEngine) {
        this.queueService = queueService;
        this.escalationEngine = escalationEngine;
    }

    @Scheduled(fixedDelayString = "${concierge.hitl.sweep-interval-ms:30000}")
    public void runMaintenance() {
        if (this.stopping.get()) {
            return;
        }
        try {
            int expired = this.queueService.sweepExpired(this.stopping::get);
            if (expired > 0) {
                log.info("SLA sweep expired {} HITL requests", expired);
            }
        }
        catch (RuntimeException e) {
            log.warn("SLA sweep failed: {}", e.getMessage());
        }
        if (this.stopping.get()) {
            return;
        }
        try {
            EscalationReport report = this.escalationEngine.evaluate();
            if (!report.failures().isEmpty()) {
                log.debug("Escalation failures this pass: {}", report.failures());
            }
        }
        catch (RuntimeException e) {
            log.warn("Escalation pass failed: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void stop() {
        this.stopping.set(true);
    }

    boolean isStopping() {
        return this.stopping.get();
    }
}
