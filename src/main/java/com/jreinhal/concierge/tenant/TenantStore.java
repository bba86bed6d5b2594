package com.jreinhal.concierge.tenant;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable tenant registry plus the per-tenant usage counters quotas are enforced against.
 */
public interface TenantStore {

    Optional<Tenant> findById(String tenantId);

    List<Tenant> findAll();

    Tenant save(Tenant tenant);

    /**
     * Atomically adds {@code amount} to the usage counter unless the result would exceed
     * {@code limit}. A non-positive limit always succeeds.
     *
     * @return true when the reservation was applied
     */
    boolean reserve(String tenantId, QuotaResource resource, long amount, long limit);

    /**
     * Subtracts {@code amount}, never taking the counter below zero.
     */
    void release(String tenantId, QuotaResource resource, long amount);

    Map<QuotaResource, Long> usage(String tenantId);
}
