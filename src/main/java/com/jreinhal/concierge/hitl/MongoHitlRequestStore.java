package com.jreinhal.concierge.hitl;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/**
 * Request store on {@code hitl_requests}. Transitions are {@code findAndModify} calls whose query
 * carries the guard, so Mongo's single-document atomicity gives the compare-and-swap.
 */
public class MongoHitlRequestStore implements HitlRequestStore {
    static final String COLLECTION = "hitl_requests";
    private static final List<HitlStatus> OPEN = List.of(HitlStatus.PENDING, HitlStatus.ASSIGNED);
    private final MongoTemplate mongoTemplate;

    public MongoHitlRequestStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public HitlRequest insertIfAbsent(HitlRequest request) {
        if (request.dedupKey() != null) {
            Optional<HitlRequest> existing = findByDedupKey(request.tenantId(), request.dedupKey());
            if (existing.isPresent()) {
                return existing.get();
            }
        }
        try {
            return this.mongoTemplate.insert(request, COLLECTION);
        }
        catch (DuplicateKeyException e) {
            if (request.dedupKey() == null) {
                throw e;
            }
            return findByDedupKey(request.tenantId(), request.dedupKey()).orElseThrow(() -> e);
        }
    }

    @Override
    public Optional<HitlRequest> findById(String requestId) {
        if (requestId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.mongoTemplate.findById(requestId, HitlRequest.class, COLLECTION));
    }

    @Override
    public Optional<HitlRequest> findByDedupKey(String tenantId, String dedupKey) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId).and("dedupKey").is(dedupKey));
        return Optional.ofNullable(this.mongoTemplate.findOne(query, HitlRequest.class, COLLECTION));
    }

    @Override
    public Optional<HitlRequest> claim(String tenantId, String requestId, String reviewerId, Instant now) {
        Query query = byId(tenantId, requestId);
        query.addCriteria(Criteria.where("status").is(HitlStatus.PENDING).and("slaDeadline").gt(now));
        Update update = new Update()
                .set("status", HitlStatus.ASSIGNED)
                .set("assignedTo", reviewerId)
                .set("assignedAt", now);
        return modify(query, update);
    }

    @Override
    public Optional<HitlRequest> complete(String tenantId, String requestId, String reviewerId, ReviewDecision decision,
                                          String notes, Map<String, Object> modifiedOutput, Instant now) {
        Query query = byId(tenantId, requestId);
        query.addCriteria(Criteria.where("status").is(HitlStatus.ASSIGNED)
                .and("assignedTo").is(reviewerId)
                .and("slaDeadline").gt(now));
        Update update = new Update()
                .set("status", HitlStatus.COMPLETED)
                .set("decision", decision)
                .set("notes", notes)
                .set("modifiedOutput", modifiedOutput)
                .set("respondedAt", now);
        return modify(query, update);
    }

    @Override
    public Optional<HitlRequest> release(String tenantId, String requestId, String expectedAssignee) {
        Query query = byId(tenantId, requestId);
        query.addCriteria(Criteria.where("status").is(HitlStatus.ASSIGNED).and("assignedTo").is(expectedAssignee));
        Update update = new Update()
                .set("status", HitlStatus.PENDING)
                .unset("assignedTo")
                .unset("assignedAt");
        return modify(query, update);
    }

    @Override
    public Optional<HitlRequest> expire(String tenantId, String requestId, Instant now) {
        Query query = byId(tenantId, requestId);
        query.addCriteria(Criteria.where("status").in(OPEN).and("slaDeadline").lte(now));
        Update update = new Update()
                .set("status", HitlStatus.EXPIRED)
                .set("expiredAt", now);
        return modify(query, update);
    }

    @Override
    public Optional<HitlRequest> recordEscalation(String tenantId, String requestId, String ruleName, HitlPriority newPriority) {
        Query query = byId(tenantId, requestId);
        query.addCriteria(Criteria.where("status").in(OPEN).and("appliedEscalations").ne(ruleName));
        Update update = new Update().push("appliedEscalations", ruleName);
        if (newPriority != null) {
            update.set("priority", newPriority);
        }
        return modify(query, update);
    }

    @Override
    public List<HitlRequest> findOverdue(Instant now, int limit) {
        Query query = Query.query(Criteria.where("status").in(OPEN).and("slaDeadline").lte(now))
                .with(Sort.by(Sort.Direction.ASC, "slaDeadline"))
                .limit(limit);
        return this.mongoTemplate.find(query, HitlRequest.class, COLLECTION);
    }

    @Override
    public List<HitlRequest> findOpen(Instant afterCreatedAt, String afterRequestId, int limit) {
        Criteria criteria = Criteria.where("status").in(OPEN);
        if (afterCreatedAt != null) {
            criteria = criteria.orOperator(
                    Criteria.where("createdAt").gt(afterCreatedAt),
                    Criteria.where("createdAt").is(afterCreatedAt).and("_id").gt(afterRequestId != null ? afterRequestId : ""));
        }
        Query query = Query.query(criteria)
                .with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")))
                .limit(limit);
        return this.mongoTemplate.find(query, HitlRequest.class, COLLECTION);
    }

    /**
     * Priorities are stored by name, so ordering by rank is done one priority band at a time.
     */
    @Override
    public List<HitlRequest> list(String tenantId, HitlStatus status, HitlPriority priority, int limit) {
        List<HitlRequest> result = new ArrayList<>();
        List<HitlPriority> bands = priority != null ? List.of(priority) : List.of(HitlPriority.values());
        for (HitlPriority band : bands) {
            int remaining = limit - result.size();
            if (remaining <= 0) {
                break;
            }
            Criteria criteria = Criteria.where("tenantId").is(tenantId).and("priority").is(band);
            if (status != null) {
                criteria = criteria.and("status").is(status);
            }
            Query query = Query.query(criteria)
                    .with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")))
                    .limit(remaining);
            result.addAll(this.mongoTemplate.find(query, HitlRequest.class, COLLECTION));
        }
        return result;
    }

    @Override
    public List<HitlRequest> findOpenByAssignee(String tenantId, String reviewerId) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId)
                .and("assignedTo").is(reviewerId)
                .and("status").is(HitlStatus.ASSIGNED));
        return this.mongoTemplate.find(query, HitlRequest.class, COLLECTION);
    }

    @Override
    public long count(String tenantId, HitlStatus status, HitlPriority priority) {
        Criteria criteria = Criteria.where("tenantId").is(tenantId);
        if (status != null) {
            criteria = criteria.and("status").is(status);
        }
        if (priority != null) {
            criteria = criteria.and("priority").is(priority);
        }
        return this.mongoTemplate.count(Query.query(criteria), COLLECTION);
    }

    @Override
    public List<HitlRequest> recentCompleted(String tenantId, int limit) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId).and("status").is(HitlStatus.COMPLETED))
                .with(Sort.by(Sort.Direction.DESC, "respondedAt"))
                .limit(limit);
        return this.mongoTemplate.find(query, HitlRequest.class, COLLECTION);
    }

    private Optional<HitlRequest> modify(Query query, Update update) {
        return Optional.ofNullable(this.mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), HitlRequest.class, COLLECTION));
    }

    private static Query byId(String tenantId, String requestId) {
        return Query.query(Criteria.where("_id").is(requestId).and("tenantId").is(tenantId));
    }
}
