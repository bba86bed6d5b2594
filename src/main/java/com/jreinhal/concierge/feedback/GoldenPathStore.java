package com.jreinhal.concierge.feedback;

import java.util.List;

public interface GoldenPathStore {

    /**
     * @return false when a record with the same path id already exists
     */
    boolean insertIfAbsent(GoldenPathRecord record);

    /**
     * Tenant records ranked by cosine similarity to the query embedding, best first.
     *
     * @param category optional filter
     */
    List<ScoredGoldenPath> search(String tenantId, float[] queryEmbedding, String category, int topK, double minSimilarity);

    long count(String tenantId);

    List<GoldenPathRecord> recent(String tenantId, int limit);

    long deleteBySubject(String tenantId, String subjectId);

    record ScoredGoldenPath(GoldenPathRecord record, double similarity) {
    }
}
