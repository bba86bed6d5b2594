package com.jreinhal.concierge.compliance;

import com.jreinhal.concierge.tenant.TenantContextHolder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/compliance"})
public class ComplianceController {
    private final CompliancePurgeService purgeService;

    public ComplianceController(CompliancePurgeService purgeService) {
        this.purgeService = purgeService;
    }

    @PostMapping("/purge")
    public ResponseEntity<PurgeResult> purge(@RequestBody PurgeRequest body) {
        return ResponseEntity.ok(this.purgeService.purgeSubject(TenantContextHolder.require(), body.subjectId(), body.requestedBy()));
    }

    public record PurgeRequest(String subjectId, String requestedBy) {
    }
}
