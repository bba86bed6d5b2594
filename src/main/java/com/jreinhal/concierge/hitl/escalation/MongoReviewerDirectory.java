package com.jreinhal.concierge.hitl.escalation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

public class MongoReviewerDirectory implements ReviewerDirectory {
    static final String COLLECTION = "hitl_reviewers";
    private final MongoTemplate mongoTemplate;

    public MongoReviewerDirectory(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Reviewer register(Reviewer reviewer) {
        Query query = Query.query(Criteria.where("_id").is(reviewer.id()));
        Update update = new Update()
                .set("tenantId", reviewer.tenantId())
                .set("reviewerId", reviewer.reviewerId())
                .set("name", reviewer.name())
                .set("skills", reviewer.skills())
                .set("maxWorkload", reviewer.maxWorkload())
                .set("available", reviewer.available())
                .set("updatedAt", reviewer.updatedAt())
                .setOnInsert("registeredAt", reviewer.registeredAt());
        return this.mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), Reviewer.class, COLLECTION);
    }

    @Override
    public Optional<Reviewer> find(String tenantId, String reviewerId) {
        return Optional.ofNullable(this.mongoTemplate.findOne(scoped(tenantId, reviewerId), Reviewer.class, COLLECTION));
    }

    @Override
    public Optional<Reviewer> setAvailability(String tenantId, String reviewerId, boolean available, Instant at) {
        Update update = new Update().set("available", available).set("updatedAt", at);
        return Optional.ofNullable(this.mongoTemplate.findAndModify(scoped(tenantId, reviewerId), update,
                FindAndModifyOptions.options().returnNew(true), Reviewer.class, COLLECTION));
    }

    @Override
    public List<Reviewer> findAvailable(String tenantId) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId).and("available").is(true))
                .with(Sort.by("reviewerId"));
        return this.mongoTemplate.find(query, Reviewer.class, COLLECTION);
    }

    @Override
    public List<Reviewer> list(String tenantId) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId)).with(Sort.by("reviewerId"));
        return this.mongoTemplate.find(query, Reviewer.class, COLLECTION);
    }

    private static Query scoped(String tenantId, String reviewerId) {
        return Query.query(Criteria.where("_id").is(Reviewer.storageId(tenantId, reviewerId)).and("tenantId").is(tenantId));
    }
}
