package com.jreinhal.concierge.activity;

import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.tenant.TenantContextHolder;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/activity"})
public class ActivityController {
    private final ActivityStreamService activityStreamService;

    public ActivityController(ActivityStreamService activityStreamService) {
        this.activityStreamService = activityStreamService;
    }

    /**
     * Entry point for webhook collaborators. Payloads arrive already normalized.
     */
    @PostMapping("/events")
    public ResponseEntity<ActivityEvent> ingest(@RequestBody IngestEventRequest request) {
        TenantContext ctx = TenantContextHolder.require();
        ActivityEvent event = this.activityStreamService.append(ctx, new ActivityEventDraft(
                request.eventId(), request.eventType(), request.source() != null ? request.source() : "webhook",
                request.payload(), request.timestamp()));
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    @GetMapping("/events")
    public ResponseEntity<List<ActivityEvent>> read(@RequestParam(defaultValue = "0") long after,
                                                    @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(this.activityStreamService.read(TenantContextHolder.require(), after, limit));
    }

    @GetMapping("/latest")
    public ResponseEntity<List<ActivityEvent>> latest(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(this.activityStreamService.latest(TenantContextHolder.require(), limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<ActivityStreamStats> stats() {
        return ResponseEntity.ok(this.activityStreamService.stats(TenantContextHolder.require()));
    }

    public record IngestEventRequest(String eventId, String eventType, String source, Map<String, Object> payload, Instant timestamp) {
    }
}
