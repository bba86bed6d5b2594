package com.jreinhal.concierge.tenant;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/**
 * Tenants live in {@code tenants}; usage counters live in {@code tenant_usage}, one document per
 * tenant, so a reservation is a single guarded {@code findAndModify}.
 */
public class MongoTenantStore implements TenantStore {
    static final String TENANTS = "tenants";
    static final String USAGE = "tenant_usage";
    private final MongoTemplate mongoTemplate;

    public MongoTenantStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<Tenant> findById(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.mongoTemplate.findById(tenantId, Tenant.class, TENANTS));
    }

    @Override
    public List<Tenant> findAll() {
        return this.mongoTemplate.find(new Query().with(Sort.by("_id")), Tenant.class, TENANTS);
    }

    @Override
    public Tenant save(Tenant tenant) {
        return this.mongoTemplate.save(tenant, TENANTS);
    }

    @Override
    public boolean reserve(String tenantId, QuotaResource resource, long amount, long limit) {
        String field = "usage." + resource.key();
        this.mongoTemplate.upsert(Query.query(Criteria.where("_id").is(tenantId)),
                new Update().setOnInsert("tenantId", tenantId), USAGE);
        Criteria criteria = Criteria.where("_id").is(tenantId);
        if (limit > 0) {
            criteria = criteria.orOperator(
                    Criteria.where(field).exists(false),
                    Criteria.where(field).lte(limit - amount));
        }
        Document updated = this.mongoTemplate.findAndModify(Query.query(criteria),
                new Update().inc(field, amount),
                FindAndModifyOptions.options().returnNew(true),
                Document.class, USAGE);
        return updated != null;
    }

    @Override
    public void release(String tenantId, QuotaResource resource, long amount) {
        String field = "usage." + resource.key();
        Query query = Query.query(Criteria.where("_id").is(tenantId).and(field).gte(amount));
        this.mongoTemplate.updateFirst(query, new Update().inc(field, -amount), USAGE);
    }

    @Override
    public Map<QuotaResource, Long> usage(String tenantId) {
        Map<QuotaResource, Long> result = new EnumMap<>(QuotaResource.class);
        Document doc = this.mongoTemplate.findById(tenantId, Document.class, USAGE);
        Document counters = doc != null ? doc.get("usage", Document.class) : null;
        for (QuotaResource resource : QuotaResource.values()) {
            Object value = counters != null ? counters.get(resource.key()) : null;
            result.put(resource, value instanceof Number n ? n.longValue() : 0L);
        }
        return result;
    }
}
