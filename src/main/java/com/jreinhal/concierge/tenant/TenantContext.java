package com.jreinhal.concierge.tenant;

import java.util.Objects;

/**
 * Scoping token passed into every public operation. Two contexts are equal when they name the
 * same tenant with the same limits.
 *
 * <p>Instances are created from a provisioned {@link Tenant}; a quota edit produces a new
 * context rather than mutating an existing one.</p>
 */
public record TenantContext(
    String tenantId,
    TenantTier tier,
    TenantQuota quotaLimits,
    String namespacePrefix
) {
    public TenantContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        tier = tier == null ? TenantTier.STARTER : tier;
        quotaLimits = quotaLimits == null ? tier.defaultQuota() : quotaLimits;
        namespacePrefix = namespacePrefix == null || namespacePrefix.isBlank() ? "t_" + tenantId : namespacePrefix;
    }

    public static TenantContext of(String tenantId, TenantTier tier) {
        return new TenantContext(tenantId, tier, tier.defaultQuota(), null);
    }

    /**
     * Fails with {@link TenantMismatchException} unless the entity belongs to this tenant.
     */
    public void requireSameTenant(String entityTenantId) {
        if (!this.owns(entityTenantId)) {
            throw new TenantMismatchException(this.tenantId, entityTenantId);
        }
    }

    public boolean owns(String entityTenantId) {
        return Objects.equals(this.tenantId, entityTenantId);
    }

    public String namespaced(String key) {
        return this.namespacePrefix + ":" + key;
    }
}
