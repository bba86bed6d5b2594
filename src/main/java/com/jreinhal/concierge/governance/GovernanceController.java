package com.jreinhal.concierge.governance;

import com.jreinhal.concierge.tenant.TenantContextHolder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/governance"})
public class GovernanceController {
    private final GovernanceViewService governanceViewService;

    public GovernanceController(GovernanceViewService governanceViewService) {
        this.governanceViewService = governanceViewService;
    }

    @GetMapping("/dashboard")
    public ResponseEntity<GovernanceSnapshot> dashboard() {
        return ResponseEntity.ok(this.governanceViewService.snapshot(TenantContextHolder.require()));
    }
}
