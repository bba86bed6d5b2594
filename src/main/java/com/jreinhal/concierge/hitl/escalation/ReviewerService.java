package com.jreinhal.concierge.hitl.escalation;

import com.jreinhal.concierge.exception.NotFoundException;
import com.jreinhal.concierge.tenant.TenantContext;
import com.jreinhal.concierge.util.LogSanitizer;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ReviewerService {
    private static final Logger log = LoggerFactory.getLogger(ReviewerService.class);
    private static final Pattern REVIEWER_ID = Pattern.compile("^[A-Za-z0-9._@-]{1,128}$");
    private final ReviewerDirectory directory;
    private final Clock clock;

    public ReviewerService(ReviewerDirectory directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
    }

    public Reviewer registerReviewer(TenantContext ctx, String reviewerId, String name, List<String> skills, int maxWorkload) {
        if (reviewerId == null || !REVIEWER_ID.matcher(reviewerId).matches()) {
            throw new IllegalArgumentException("Invalid reviewer id");
        }
        if (maxWorkload < 0) {
            throw new IllegalArgumentException("Max workload must not be negative");
        }
        Instant now = this.clock.instant();
        Reviewer reviewer = new Reviewer(Reviewer.storageId(ctx.tenantId(), reviewerId), ctx.tenantId(), reviewerId,
                name != null && !name.isBlank() ? name.trim() : reviewerId, skills, maxWorkload, true, now, now);
        Reviewer saved = this.directory.register(reviewer);
        log.info("Reviewer {} registered for tenant {}", LogSanitizer.sanitize(reviewerId), ctx.tenantId());
        return saved;
    }

    public Reviewer setAvailability(TenantContext ctx, String reviewerId, boolean available) {
        return this.directory.setAvailability(ctx.tenantId(), reviewerId, available, this.clock.instant())
                .orElseThrow(() -> new NotFoundException("reviewer", reviewerId));
    }

    public List<Reviewer> list(TenantContext ctx) {
        return this.directory.list(ctx.tenantId());
    }
}
