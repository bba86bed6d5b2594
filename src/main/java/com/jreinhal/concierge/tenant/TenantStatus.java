package com.jreinhal.concierge.tenant;

public enum TenantStatus {
    ACTIVE,
    SUSPENDED
}
