package com.jreinhal.concierge.hitl;

import com.jreinhal.concierge.hitl.HitlQueueService.RespondCommand;
import com.jreinhal.concierge.hitl.HitlQueueService.SubmitCommand;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantContextHolder;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/hitl"})
public class HitlQueueController {
    private final HitlQueueService queueService;

    public HitlQueueController(HitlQueueService queueService) {
        this.queueService = queueService;
    }

    @PostMapping("/requests")
    public ResponseEntity<HitlRequest> submit(@RequestBody SubmitRequestBody body) {
        TenantContext ctx = TenantContextHolder.require();
        SubmitCommand command = new SubmitCommand(body.agentId(),
                body.requestType() != null ? HitlRequestType.valueOf(body.requestType().trim().toUpperCase(Locale.ROOT)) : null,
                HitlPriority.parse(body.priority()), body.question(), body.context(), body.options(), body.dedupKey());
        return ResponseEntity.status(HttpStatus.CREATED).body(this.queueService.submit(ctx, command));
    }

    @GetMapping("/requests")
    public ResponseEntity<List<HitlRequest>> list(@RequestParam(required = false) HitlStatus status,
                                                  @RequestParam(required = false) HitlPriority priority,
                                                  @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(this.queueService.list(TenantContextHolder.require(), status, priority, limit));
    }

    @GetMapping("/requests/{requestId}")
    public ResponseEntity<HitlRequest> get(@PathVariable String requestId) {
        return ResponseEntity.ok(this.queueService.get(TenantContextHolder.require(), requestId));
    }

    @PostMapping("/requests/{requestId}/claim")
    public ResponseEntity<HitlRequest> claim(@PathVariable String requestId, @RequestBody ReviewerBody body) {
        return ResponseEntity.ok(this.queueService.claim(TenantContextHolder.require(), requestId, body.reviewerId()));
    }

    @PostMapping("/requests/{requestId}/respond")
    public ResponseEntity<HitlRequest> respond(@PathVariable String requestId, @RequestBody RespondBody body) {
        RespondCommand command = new RespondCommand(ReviewDecision.parse(body.decision()), body.notes(), body.modifiedOutput());
        return ResponseEntity.ok(this.queueService.respond(TenantContextHolder.require(), requestId, body.reviewerId(), command));
    }

    @PostMapping("/requests/{requestId}/release")
    public ResponseEntity<HitlRequest> release(@PathVariable String requestId, @RequestBody ReviewerBody body) {
        return ResponseEntity.ok(this.queueService.release(TenantContextHolder.require(), requestId, body.reviewerId()));
    }

    @PostMapping("/requests/{requestId}/escalate")
    public ResponseEntity<HitlRequest> escalate(@PathVariable String requestId, @RequestBody(required = false) EscalateBody body) {
        return ResponseEntity.ok(this.queueService.manualEscalate(TenantContextHolder.require(), requestId,
                body != null ? body.reason() : null));
    }

    @GetMapping("/reviewers/{reviewerId}/assignments")
    public ResponseEntity<List<HitlRequest>> assignments(@PathVariable String reviewerId) {
        return ResponseEntity.ok(this.queueService.assignmentsFor(TenantContextHolder.require(), reviewerId));
    }

    @GetMapping("/stats")
    public ResponseEntity<HitlQueueStats> stats() {
        return ResponseEntity.ok(this.queueService.stats(TenantContextHolder.require()));
    }

    public record SubmitRequestBody(String agentId, String requestType, String priority, String question,
                                    Map<String, Object> context, List<String> options, String dedupKey) {
    }

    public record ReviewerBody(String reviewerId) {
    }

    public record RespondBody(String reviewerId, String decision, String notes, Map<String, Object> modifiedOutput) {
    }

    public record EscalateBody(String reason) {
    }
}
