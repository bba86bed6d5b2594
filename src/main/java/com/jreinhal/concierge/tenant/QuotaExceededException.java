package com.jreinhal.concierge.tenant;

import com.jreinhal.concierge.exception.ConciergeException;

public class QuotaExceededException extends ConciergeException {
    private final QuotaResource resource;
    private final long limit;

    public QuotaExceededException(QuotaResource resource, long limit) {
        super("quota_exceeded", "Tenant quota exceeded for " + resource.key() + " (limit " + limit + ")");
        this.resource = resource;
        this.limit = limit;
    }

    public QuotaResource getResource() {
        return this.resource;
    }

    public long getLimit() {
        return this.limit;
    }
}
