package com.jreinhal.concierge.tenant;

import java.util.Locale;

public enum TenantTier {
    FREE(new TenantQuota(10, 1_000, 10)),
    STARTER(new TenantQuota(50, 5_000, 25)),
    PROFESSIONAL(new TenantQuota(200, 50_000, 100)),
    ENTERPRISE(new TenantQuota(1_000, 500_000, 500));

    private final TenantQuota defaultQuota;

    TenantTier(TenantQuota defaultQuota) {
        this.defaultQuota = defaultQuota;
    }

    public TenantQuota defaultQuota() {
        return this.defaultQuota;
    }

    public static TenantTier parse(String value, TenantTier fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return TenantTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tenant tier: " + value);
        }
    }
}
