package com.jreinhal.concierge.hitl.escalation;

import com.jreinhal.concierge.tenant.TenantContextHolder;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/hitl/reviewers"})
public class ReviewerController {
    private final ReviewerService reviewerService;

    public ReviewerController(ReviewerService reviewerService) {
        this.reviewerService = reviewerService;
    }

    @GetMapping
    public ResponseEntity<List<Reviewer>> list() {
        return ResponseEntity.ok(this.reviewerService.list(TenantContextHolder.require()));
    }

    @PostMapping
    public ResponseEntity<Reviewer> register(@RequestBody RegisterReviewerRequest body) {
        Reviewer reviewer = this.reviewerService.registerReviewer(TenantContextHolder.require(), body.reviewerId(),
                body.name(), body.skills(), body.maxWorkload() != null ? body.maxWorkload() : 0);
        return ResponseEntity.status(HttpStatus.CREATED).body(reviewer);
    }

    @PutMapping("/{reviewerId}/availability")
    public ResponseEntity<Reviewer> setAvailability(@PathVariable String reviewerId, @RequestBody AvailabilityRequest body) {
        return ResponseEntity.ok(this.reviewerService.setAvailability(TenantContextHolder.require(), reviewerId, body.available()));
    }

    public record RegisterReviewerRequest(String reviewerId, String name, List<String> skills, Integer maxWorkload) {
    }

    public record AvailabilityRequest(boolean available) {
    }
}
