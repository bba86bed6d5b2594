package com.jreinhal.concierge.feedback;

import com.jreinhal.concierge.tenant.TenantContextHolder;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/feedback"})
public class FeedbackController {
    private final FeedbackLoopService feedbackLoopService;

    public FeedbackController(FeedbackLoopService feedbackLoopService) {
        this.feedbackLoopService = feedbackLoopService;
    }

    @PostMapping("/scores")
    public ResponseEntity<FeedbackReceipt> recordScore(@RequestBody ScoreRequest body) {
        return ResponseEntity.ok(this.feedbackLoopService.recordFeedback(TenantContextHolder.require(), body.requestId(), body.score()));
    }

    @GetMapping("/golden-paths/search")
    public ResponseEntity<List<GoldenPathMatch>> search(@RequestParam String query,
                                                        @RequestParam(required = false) Integer topK,
                                                        @RequestParam(required = false) String category) {
        return ResponseEntity.ok(this.feedbackLoopService.search(TenantContextHolder.require(), query, topK, category));
    }

    @GetMapping("/golden-paths")
    public ResponseEntity<List<GoldenPathRecord>> recent(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(this.feedbackLoopService.recent(TenantContextHolder.require(), limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<FeedbackStats> stats() {
        return ResponseEntity.ok(this.feedbackLoopService.stats(TenantContextHolder.require()));
    }

    public record ScoreRequest(String requestId, int score) {
    }
}
