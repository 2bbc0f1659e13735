package com.vidnyan.cleanup.domain.finding;

import java.time.Instant;

/**
 * One unit of source text registered for analysis.
 * The id is assigned by the primary store and never changes; the status moves from
 * {@link SubmissionStatus#RUNNING} to its final value once.
 */
public record Submission(
    long id,
    String filename,
    String content,
    Instant createdAt,
    SubmissionStatus status
) {
}
