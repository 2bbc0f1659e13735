package com.vidnyan.cleanup.application.port.out;

import com.vidnyan.cleanup.domain.finding.AgentFailure;
import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.finding.Submission;
import com.vidnyan.cleanup.domain.finding.SubmissionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Port for the durable, append-only finding store.
 * Implementations raise {@link com.vidnyan.cleanup.application.error.StoreConnectivityException}
 * when the backing store cannot be reached.
 */
public interface FindingStore extends AutoCloseable {

    /**
     * Name used in logs and failure reports, e.g. {@code primary} or {@code security-fork}.
     */
    String name();

    /**
     * Create the table if absent. Idempotent.
     */
    void ensureSchema(FindingTable table);

    /**
     * Append findings for a submission. No deduplication: repeated calls add duplicate rows.
     * @return number of rows inserted
     */
    int insert(FindingTable table, long submissionId, List<Finding> findings);

    /**
     * Register a submission and return its id. Only called on the primary store.
     */
    long newSubmissionId(String filename, String content);

    /**
     * Set the final status of a submission and append the failures that led to it.
     * Only called on the primary store.
     */
    void recordOutcome(long submissionId, SubmissionStatus status, List<AgentFailure> failures);

    Optional<Submission> findSubmission(long submissionId);

    /**
     * Failures recorded for a submission, in category order.
     */
    List<AgentFailure> findFailures(long submissionId);

    /**
     * Stored findings of a submission in insertion order.
     */
    List<Finding> findFindings(FindingTable table, long submissionId);

    /**
     * Check that the store answers.
     */
    boolean ping();

    @Override
    default void close() {
    }
}
