package com.jreinhal.concierge.feedback;

import com.jreinhal.concierge.vector.VectorMath;
import com.mongodb.client.result.DeleteResult;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

/**
 * Golden paths in {@code golden_paths}. Similarity is computed in-process over the tenant's
 * (optionally category-filtered) records, the same way the local vector store ranks documents.
 */
public class MongoGoldenPathStore implements GoldenPathStore {
    private static final Logger log = LoggerFactory.getLogger(MongoGoldenPathStore.class);
    static final String COLLECTION = "golden_paths";
    private final MongoTemplate mongoTemplate;

    public MongoGoldenPathStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean insertIfAbsent(GoldenPathRecord record) {
        try {
            this.mongoTemplate.insert(record, COLLECTION);
            return true;
        }
        catch (DuplicateKeyException e) {
            log.debug("Golden path {} already stored", record.pathId());
            return false;
        }
    }

    @Override
    public List<ScoredGoldenPath> search(String tenantId, float[] queryEmbedding, String category, int topK, double minSimilarity) {
        Criteria criteria = Criteria.where("tenantId").is(tenantId);
        String normalizedCategory = GoldenPathRecord.normalizeCategory(category);
        if (normalizedCategory != null) {
            criteria = criteria.and("category").is(normalizedCategory);
        }
        List<GoldenPathRecord> candidates = this.mongoTemplate.find(Query.query(criteria), GoldenPathRecord.class, COLLECTION);
        double queryNorm = VectorMath.squaredNorm(queryEmbedding);
        return candidates.stream()
                .filter(r -> tenantId.equals(r.tenantId()))
                .map(r -> new ScoredGoldenPath(r, VectorMath.cosine(queryEmbedding, queryNorm, r.queryEmbedding(), r.embeddingNorm())))
                .filter(scored -> scored.similarity() >= minSimilarity)
                .sorted(Comparator.comparingDouble(ScoredGoldenPath::similarity).reversed()
                        .thenComparing(scored -> scored.record().pathId()))
                .limit(topK)
                .toList();
    }

    @Override
    public long count(String tenantId) {
        return this.mongoTemplate.count(Query.query(Criteria.where("tenantId").is(tenantId)), COLLECTION);
    }

    @Override
    public List<GoldenPathRecord> recent(String tenantId, int limit) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId))
                .with(Sort.by(Sort.Direction.DESC, "createdAt"))
                .limit(limit);
        return this.mongoTemplate.find(query, GoldenPathRecord.class, COLLECTION);
    }

    @Override
    public long deleteBySubject(String tenantId, String subjectId) {
        Query query = Query.query(Criteria.where("tenantId").is(tenantId).and("subjectId").is(subjectId));
        DeleteResult result = this.mongoTemplate.remove(query, COLLECTION);
        return result.getDeletedCount();
    }
}
