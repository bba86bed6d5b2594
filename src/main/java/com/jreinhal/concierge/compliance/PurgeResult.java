package com.jreinhal.concierge.compliance;

import java.time.Instant;

/**
 * @param subjectHash tenant-scoped SHA-256 of the subject id; the raw id is never stored
 * @param tombstoneSequence sequence number of the {@code compliance.purged} event
 */
public record PurgeResult(
    String subjectHash,
    long goldenPathsDeleted,
    long graphNodesDeleted,
    long playbooksUpdated,
    long eventsDeleted,
    long tombstoneSequence,
    Instant purgedAt
) {
}
