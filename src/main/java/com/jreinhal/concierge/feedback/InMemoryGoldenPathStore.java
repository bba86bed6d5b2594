package com.jreinhal.concierge.feedback;

import com.jreinhal.concierge.vector.VectorMath;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryGoldenPathStore implements GoldenPathStore {
    private final Map<String, GoldenPathRecord> records = new ConcurrentHashMap<>();

    @Override
    public boolean insertIfAbsent(GoldenPathRecord record) {
        return this.records.putIfAbsent(record.pathId(), record) == null;
    }

    @Override
    public List<ScoredGoldenPath> search(String tenantId, float[] queryEmbedding, String category, int topK, double minSimilarity) {
        double queryNorm = VectorMath.squaredNorm(queryEmbedding);
        return this.records.values().stream()
                .filter(r -> r.tenantId().equals(tenantId))
                .filter(r -> category == null || category.equalsIgnoreCase(r.category()))
                .map(r -> new ScoredGoldenPath(r, VectorMath.cosine(queryEmbedding, queryNorm, r.queryEmbedding(), r.embeddingNorm())))
                .filter(scored -> scored.similarity() >= minSimilarity)
                .sorted(Comparator.comparingDouble(ScoredGoldenPath::similarity).reversed()
                        .thenComparing(scored -> scored.record().pathId()))
                .limit(topK)
                .toList();
    }

    @Override
    public long count(String tenantId) {
        return this.records.values().stream().filter(r -> r.tenantId().equals(tenantId)).count();
    }

    @Override
    public List<GoldenPathRecord> recent(String tenantId, int limit) {
        return this.records.values().stream()
                .filter(r -> r.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(GoldenPathRecord::createdAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public long deleteBySubject(String tenantId, String subjectId) {
        List<String> doomed = this.records.values().stream()
                .filter(r -> r.tenantId().equals(tenantId) && Objects.equals(subjectId, r.subjectId()))
                .map(GoldenPathRecord::pathId)
                .toList();
        long removed = 0;
        for (String pathId : doomed) {
            if (this.records.remove(pathId) != null) {
                removed++;
            }
        }
        return removed;
    }
}
