package com.jreinhal.concierge.activity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/**
 * Durable stream. Counters are one document per tenant in {@code activity_sequences}, bumped with
 * {@code $inc}; events carry a unique {@code (tenantId, sequenceNo)} index.
 */
public class MongoActivityStore implements ActivityStore {
    static final String EVENTS = "activity_events";
    static final String SEQUENCES = "activity_sequences";
    private final MongoTemplate mongoTemplate;

    public MongoActivityStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public long allocateSequence(String tenantId) {
        Document counter = this.mongoTemplate.findAndModify(
                Query.query(Criteria.where("_id").is(tenantId)),
                new Update().inc("seq", 1L),
                FindAndModifyOptions.options().upsert(true).returnNew(true),
                Document.class, SEQUENCES);
        if (counter == null || !(counter.get("seq") instanceof Number seq)) {
            throw new IllegalStateException("Sequence allocation returned no counter for tenant " + tenantId);
        }
        return seq.longValue();
    }

    @Override
    public void advanceSequenceTo(String tenantId, long floor) {
        this.mongoTemplate.upsert(Query.query(Criteria.where("_id").is(tenantId)),
                new Update().max("seq", floor), SEQUENCES);
    }

    @Override
    public long highestSequence(String tenantId) {
        Document counter = this.mongoTemplate.findById(tenantId, Document.class, SEQUENCES);
        return counter != null && counter.get("seq") instanceof Number seq ? seq.longValue() : 0L;
    }

    @Override
    public void insert(ActivityEvent event) {
        this.mongoTemplate.insert(event, EVENTS);
    }

    @Override
    public List<ActivityEvent> readAfter(String tenantId, long afterSequence, int limit) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId).and("sequenceNo").gt(afterSequence))
                .with(Sort.by(Sort.Direction.ASC, "sequenceNo"))
                .limit(limit);
        return this.mongoTemplate.find(query, ActivityEvent.class, EVENTS);
    }

    @Override
    public List<ActivityEvent> latest(String tenantId, int limit) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId))
                .with(Sort.by(Sort.Direction.DESC, "sequenceNo"))
                .limit(limit);
        List<ActivityEvent> newestFirst = new ArrayList<>(this.mongoTemplate.find(query, ActivityEvent.class, EVENTS));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Override
    public long count(String tenantId) {
        return this.mongoTemplate.count(Query.query(Criteria.where("tenantId").is(tenantId)), EVENTS);
    }

    @Override
    public long deleteBySubject(String tenantId, String subjectId) {
        List<Criteria> subjectMatches = new ArrayList<>();
        for (String key : ActivityEventTypes.SUBJECT_KEYS) {
            subjectMatches.add(Criteria.where("payload." + key).is(subjectId));
        }
        Query query = Query.query(Criteria.where("tenantId").is(tenantId)
                .orOperator(subjectMatches.toArray(new Criteria[0])));
        return this.mongoTemplate.remove(query, EVENTS).getDeletedCount();
    }

    @Override
    public boolean isDurable() {
        return true;
    }
}
