package com.jreinhal.concierge.tenant;

/**
 * Per-tenant limits. A limit of zero or less means unlimited.
 *
 * @param maxOpenHitlRequests pending plus assigned requests held at once
 * @param maxGoldenPaths golden-path records kept in the semantic store
 * @param maxPlaybooks playbooks materialized for the tenant
 */
public record TenantQuota(
    long maxOpenHitlRequests,
    long maxGoldenPaths,
    long maxPlaybooks
) {
    public static TenantQuota unlimited() {
        return new TenantQuota(0, 0, 0);
    }

    public long limitFor(QuotaResource resource) {
        return switch (resource) {
            case HITL_QUEUE -> this.maxOpenHitlRequests;
            case GOLDEN_PATHS -> this.maxGoldenPaths;
            case PLAYBOOKS -> this.maxPlaybooks;
        };
    }

    public boolean hasLimits() {
        return maxOpenHitlRequests > 0 || maxGoldenPaths > 0 || maxPlaybooks > 0;
    }
}
