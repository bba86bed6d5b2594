package com.jreinhal.concierge.tenant;

import java.time.Instant;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection="tenants")
public record Tenant(
    @Id String id,
    String name,
    TenantTier tier,
    TenantQuota quota,
    String namespacePrefix,
    TenantStatus status,
    Instant createdAt,
    Instant updatedAt
) {
    public boolean isActive() {
        return status == null || status == TenantStatus.ACTIVE;
    }

    public Tenant withQuota(TenantQuota newQuota, Instant now) {
        return new Tenant(id, name, tier, newQuota, namespacePrefix, status, createdAt, now);
    }

    public Tenant withStatus(TenantStatus newStatus, Instant now) {
        return new Tenant(id, name, tier, quota, namespacePrefix, newStatus, createdAt, now);
    }

    public TenantContext toContext() {
        return new TenantContext(id, tier, quota != null ? quota : tier.defaultQuota(), namespacePrefix);
    }
}
