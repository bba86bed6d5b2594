package com.jreinhal.concierge.tenant;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTenantStore implements TenantStore {
    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();
    private final Map<String, Map<QuotaResource, Long>> usage = new ConcurrentHashMap<>();

    @Override
    public Optional<Tenant> findById(String tenantId) {
        return Optional.ofNullable(tenantId == null ? null : this.tenants.get(tenantId));
    }

    @Override
    public List<Tenant> findAll() {
        List<Tenant> all = new ArrayList<>(this.tenants.values());
        all.sort(Comparator.comparing(Tenant::id));
        return all;
    }

    @Override
    public Tenant save(Tenant tenant) {
        this.tenants.put(tenant.id(), tenant);
        return tenant;
    }

    @Override
    public boolean reserve(String tenantId, QuotaResource resource, long amount, long limit) {
        boolean[] applied = new boolean[1];
        this.usage.compute(tenantId, (id, existing) -> {
            Map<QuotaResource, Long> counters = existing != null ? existing : new EnumMap<>(QuotaResource.class);
            long current = counters.getOrDefault(resource, 0L);
            if (limit > 0 && current + amount > limit) {
                return counters;
            }
            counters.put(resource, current + amount);
            applied[0] = true;
            return counters;
        });
        return applied[0];
    }

    @Override
    public void release(String tenantId, QuotaResource resource, long amount) {
        this.usage.computeIfPresent(tenantId, (id, counters) -> {
            long current = counters.getOrDefault(resource, 0L);
            counters.put(resource, Math.max(0L, current - amount));
            return counters;
        });
    }

    @Override
    public Map<QuotaResource, Long> usage(String tenantId) {
        Map<QuotaResource, Long> result = new EnumMap<>(QuotaResource.class);
        for (QuotaResource resource : QuotaResource.values()) {
            result.put(resource, 0L);
        }
        this.usage.computeIfPresent(tenantId, (id, counters) -> {
            result.putAll(counters);
            return counters;
        });
        return result;
    }
}
