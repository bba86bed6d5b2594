package com.jreinhal.concierge.feedback;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * A human-approved resolution trace. Immutable once written; the id is derived from the source
 * request so ingesting the same request twice stores one record.
 */
@Document(collection = "golden_paths")
@CompoundIndexes({
    @CompoundIndex(name = "tenant_category_idx", def = "{'tenantId': 1, 'category': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "tenant_subject_idx", def = "{'tenantId': 1, 'subjectId': 1}")
})
public record GoldenPathRecord(
    @Id String pathId,
    String tenantId,
    String sourceRequestId,
    String category,
    String query,
    String resolution,
    List<String> steps,
    List<String> articles,
    double confidence,
    GoldenPathOutcome outcome,
    String approvedBy,
    String subjectId,
    List<Double> queryEmbedding,
    Double embeddingNorm,
    Instant createdAt
) {
    public GoldenPathRecord {
        steps = steps == null ? List.of() : List.copyOf(steps);
        articles = articles == null ? List.of() : List.copyOf(articles);
    }

    /**
     * Categories are stored and filtered lower-cased and trimmed so every store matches them the same way.
     * Returns {@code null} for a blank category.
     */
    public static String normalizeCategory(String category) {
        return category == null || category.isBlank() ? null : category.trim().toLowerCase(Locale.ROOT);
    }

    public static String pathIdFor(String requestId) {
        return "gp-" + requestId;
    }

    public boolean isEmbedded() {
        return this.queryEmbedding != null && !this.queryEmbedding.isEmpty();
    }

    public GoldenPathRecord withEmbedding(List<Double> embedding, double norm) {
        return new GoldenPathRecord(pathId, tenantId, sourceRequestId, category, query, resolution, steps, articles,
                confidence, outcome, approvedBy, subjectId, embedding, norm, createdAt);
    }
}
