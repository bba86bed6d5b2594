package com.jreinhal.concierge.tenant;

import com.jreinhal.concierge.exception.ConciergeException;

public class TenantMismatchException extends ConciergeException {
    private final String expectedTenantId;
    private final String actualTenantId;

    public TenantMismatchException(String expectedTenantId, String actualTenantId) {
        super("tenant_mismatch", "Entity does not belong to the calling tenant");
        this.expectedTenantId = expectedTenantId;
        this.actualTenantId = actualTenantId;
    }

    public String getExpectedTenantId() {
        return this.expectedTenantId;
    }

    public String getActualTenantId() {
        return this.actualTenantId;
    }
}
