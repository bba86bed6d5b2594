package com.jreinhal.concierge.tenant;

import com.jreinhal.concierge.tenant.TenantService.TenantProvisionRequest;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin surface for provisioning. Authentication sits in front of this service.
 */
@RestController
@RequestMapping(value={"/api/tenants"})
public class TenantController {
    private final TenantService tenantService;
    private final TenantQuotaService tenantQuotaService;

    public TenantController(TenantService tenantService, TenantQuotaService tenantQuotaService) {
        this.tenantService = tenantService;
        this.tenantQuotaService = tenantQuotaService;
    }

    @GetMapping
    public ResponseEntity<List<Tenant>> listTenants() {
        return ResponseEntity.ok(this.tenantService.listTenants());
    }

    @PostMapping
    public ResponseEntity<Tenant> provision(@RequestBody TenantProvisionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(this.tenantService.provision(request));
    }

    @GetMapping("/{tenantId}")
    public ResponseEntity<Tenant> getTenant(@PathVariable String tenantId) {
        return ResponseEntity.ok(this.tenantService.requireTenant(tenantId));
    }

    @PutMapping("/{tenantId}/quota")
    public ResponseEntity<Tenant> updateQuota(@PathVariable String tenantId, @RequestBody TenantQuota quota) {
        return ResponseEntity.ok(this.tenantService.updateQuota(tenantId, quota));
    }

    @PostMapping("/{tenantId}/suspend")
    public ResponseEntity<Tenant> suspend(@PathVariable String tenantId) {
        return ResponseEntity.ok(this.tenantService.suspend(tenantId));
    }

    @PostMapping("/{tenantId}/activate")
    public ResponseEntity<Tenant> activate(@PathVariable String tenantId) {
        return ResponseEntity.ok(this.tenantService.activate(tenantId));
    }

    @GetMapping("/{tenantId}/usage")
    public ResponseEntity<Map<QuotaResource, Long>> usage(@PathVariable String tenantId) {
        TenantContext ctx = this.tenantService.resolveContext(tenantId);
        return ResponseEntity.ok(this.tenantQuotaService.usage(ctx));
    }
}
