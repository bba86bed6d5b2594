package com.jreinhal.concierge.playbook;

import com.mongodb.client.result.UpdateResult;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

public class MongoPlaybookStore implements PlaybookStore {
    static final String COLLECTION = "playbooks";
    private final MongoTemplate mongoTemplate;

    public MongoPlaybookStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void save(Playbook playbook) {
        this.mongoTemplate.save(playbook, COLLECTION);
    }

    @Override
    public Optional<Playbook> find(String tenantId, String playbookId) {
        Query query = Query.query(Criteria.where("_id").is(playbookId).and("tenantId").is(tenantId));
        return Optional.ofNullable(this.mongoTemplate.findOne(query, Playbook.class, COLLECTION));
    }

    @Override
    public List<Playbook> findByCategory(String tenantId, String category, PlaybookStatus status) {
        Criteria criteria = Criteria.where("tenantId").is(tenantId).and("category").is(category);
        if (status != null) {
            criteria = criteria.and("status").is(status);
        }
        Query query = Query.query(criteria).with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        return this.mongoTemplate.find(query, Playbook.class, COLLECTION);
    }

    @Override
    public List<Playbook> list(String tenantId, String category, int limit) {
        Criteria criteria = Criteria.where("tenantId").is(tenantId);
        if (category != null) {
            criteria = criteria.and("category").is(category);
        }
        Query query = Query.query(criteria)
                .with(Sort.by(Sort.Order.desc("updatedAt"), Sort.Order.asc("_id")))
                .limit(limit);
        return this.mongoTemplate.find(query, Playbook.class, COLLECTION);
    }

    @Override
    public Optional<Playbook> recordExecution(String tenantId, String playbookId, boolean success, Instant at) {
        Query query = Query.query(Criteria.where("_id").is(playbookId).and("tenantId").is(tenantId));
        Update update = new Update()
                .inc("executionCount", 1)
                .inc("executionSuccesses", success ? 1 : 0)
                .set("updatedAt", at);
        return Optional.ofNullable(this.mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Playbook.class, COLLECTION));
    }

    @Override
    public long removeSourceResolutions(String tenantId, Collection<String> resolutionIds) {
        if (resolutionIds.isEmpty()) {
            return 0L;
        }
        Query query = Query.query(Criteria.where("tenantId").is(tenantId).and("sourceResolutionIds").in(resolutionIds));
        Update update = new Update().pullAll("sourceResolutionIds", resolutionIds.toArray());
        UpdateResult result = this.mongoTemplate.updateMulti(query, update, COLLECTION);
        return result.getModifiedCount();
    }
}
