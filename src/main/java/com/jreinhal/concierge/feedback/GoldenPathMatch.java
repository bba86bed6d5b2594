package com.jreinhal.concierge.feedback;

import java.util.List;

/**
 * Search hit without the stored embedding.
 */
public record GoldenPathMatch(
    String pathId,
    String category,
    String query,
    String resolution,
    List<String> steps,
    List<String> articles,
    double confidence,
    GoldenPathOutcome outcome,
    double similarity
) {
    static GoldenPathMatch of(GoldenPathRecord record, double similarity) {
        return new GoldenPathMatch(record.pathId(), record.category(), record.query(), record.resolution(),
                record.steps(), record.articles(), record.confidence(), record.outcome(), similarity);
    }
}
