package com.jreinhal.concierge.tenant;

import com.jreinhal.concierge.exception.NotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class TenantService {
    private static final Logger log = LoggerFactory.getLogger(TenantService.class);
    private static final int MAX_ID_LENGTH = 64;

    private final TenantStore tenantStore;
    private final Clock clock;
    private final TenantTier defaultTier;

    public TenantService(TenantStore tenantStore, Clock clock,
                         @Value("${concierge.tenant.default-tier:STARTER}") String defaultTier) {
        this.tenantStore = tenantStore;
        this.clock = clock;
        this.defaultTier = TenantTier.parse(defaultTier, TenantTier.STARTER);
    }

    public Tenant provision(TenantProvisionRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("Tenant name is required");
        }
        String id = normalizeTenantId(request.id(), request.name());
        if (this.tenantStore.findById(id).isPresent()) {
            throw new IllegalArgumentException("Tenant already exists: " + id);
        }
        TenantTier tier = TenantTier.parse(request.tier(), this.defaultTier);
        TenantQuota quota = request.quota() != null ? sanitizeQuota(request.quota()) : tier.defaultQuota();
        Instant now = this.clock.instant();
        Tenant tenant = new Tenant(id, request.name().trim(), tier, quota, "t_" + id, TenantStatus.ACTIVE, now, now);
        Tenant saved = this.tenantStore.save(tenant);
        log.info("Tenant provisioned: {} (tier {})", id, tier);
        return saved;
    }

    /**
     * Provisions the tenant unless it already exists. Used for startup seeding.
     */
    public Tenant ensureTenant(String tenantId, String tier) {
        return this.tenantStore.findById(tenantId)
                .orElseGet(() -> provision(new TenantProvisionRequest(tenantId, tenantId, tier, null)));
    }

    public Tenant updateQuota(String tenantId, TenantQuota quota) {
        Tenant tenant = requireTenant(tenantId);
        Tenant saved = this.tenantStore.save(tenant.withQuota(sanitizeQuota(quota), this.clock.instant()));
        log.info("Tenant quota updated: {}", tenant.id());
        return saved;
    }

    public Tenant suspend(String tenantId) {
        Tenant tenant = requireTenant(tenantId);
        log.info("Tenant suspended: {}", tenant.id());
        return this.tenantStore.save(tenant.withStatus(TenantStatus.SUSPENDED, this.clock.instant()));
    }

    public Tenant activate(String tenantId) {
        Tenant tenant = requireTenant(tenantId);
        log.info("Tenant activated: {}", tenant.id());
        return this.tenantStore.save(tenant.withStatus(TenantStatus.ACTIVE, this.clock.instant()));
    }

    public Tenant requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant id is required");
        }
        return this.tenantStore.findById(tenantId.trim()).orElseThrow(() -> new NotFoundException("tenant", tenantId));
    }

    public TenantContext resolveContext(String tenantId) {
        return requireTenant(tenantId).toContext();
    }

    /**
     * Context for background work (sweeps, projections) that runs outside a request. Falls back to
     * a context with default limits when the tenant record cannot be read, since the work concerns
     * entities that already exist.
     */
    public TenantContext systemContext(String tenantId) {
        try {
            return resolveContext(tenantId);
        }
        catch (RuntimeException e) {
            log.debug("Tenant {} not resolvable for background work, using default context: {}", tenantId, e.getMessage());
            return new TenantContext(tenantId, null, null, null);
        }
    }

    public List<Tenant> listTenants() {
        return this.tenantStore.findAll();
    }

    private String normalizeTenantId(String providedId, String name) {
        String idSource = (providedId == null || providedId.isBlank()) ? name : providedId;
        String normalized = idSource.trim().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_-]+", "-")
                .replaceAll("(^-|-$)", "");
        if (normalized.isBlank()) {
            normalized = "tenant";
        }
        if (normalized.length() > MAX_ID_LENGTH) {
            normalized = normalized.substring(0, MAX_ID_LENGTH);
        }
        return normalized;
    }

    private TenantQuota sanitizeQuota(TenantQuota quota) {
        if (quota == null) {
            return TenantQuota.unlimited();
        }
        return new TenantQuota(Math.max(0, quota.maxOpenHitlRequests()), Math.max(0, quota.maxGoldenPaths()),
                Math.max(0, quota.maxPlaybooks()));
    }

    public record TenantProvisionRequest(String id, String name, String tier, TenantQuota quota) {
    }
}
