package com.jreinhal.concierge.tenant;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Atomic per-tenant reservations. A failed reservation leaves usage untouched.
 */
@Service
public class TenantQuotaService {
    private static final Logger log = LoggerFactory.getLogger(TenantQuotaService.class);
    private final TenantStore tenantStore;

    public TenantQuotaService(TenantStore tenantStore) {
        this.tenantStore = tenantStore;
    }

    public void checkAndReserve(TenantContext ctx, QuotaResource resource, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Reservation amount must be positive");
        }
        long limit = ctx.quotaLimits().limitFor(resource);
        if (!this.tenantStore.reserve(ctx.tenantId(), resource, amount, limit)) {
            log.info("Quota exceeded for tenant {} on {} (limit {})", ctx.tenantId(), resource.key(), limit);
            throw new QuotaExceededException(resource, limit);
        }
    }

    public void release(TenantContext ctx, QuotaResource resource, long amount) {
        if (amount <= 0) {
            return;
        }
        this.tenantStore.release(ctx.tenantId(), resource, amount);
    }

    public Map<QuotaResource, Long> usage(TenantContext ctx) {
        return this.tenantStore.usage(ctx.tenantId());
    }
}
