package com.vidnyan.cleanup.application.error;

import com.vidnyan.cleanup.domain.finding.AgentFailure;
import com.vidnyan.cleanup.domain.finding.SubmissionStatus;
import lombok.Getter;

import java.util.List;

/**
 * A stored submission exists but has no report: it was aborted or never finished.
 */
@Getter
public class ReportUnavailableException extends CleanupException {

    private final long submissionId;
    private final SubmissionStatus status;
    private final List<AgentFailure> failures;

    public ReportUnavailableException(long submissionId, SubmissionStatus status, List<AgentFailure> failures) {
        super("Submission #" + submissionId + " has no report: analysis " + status.name().toLowerCase());
        this.submissionId = submissionId;
        this.status = status;
        this.failures = List.copyOf(failures);
    }
}
