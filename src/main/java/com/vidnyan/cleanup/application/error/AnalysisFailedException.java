package com.vidnyan.cleanup.application.error;

import com.vidnyan.cleanup.domain.finding.AgentFailure;
import lombok.Getter;

import java.util.List;

/**
 * A submission was aborted because at least one analyzer failed.
 * Nothing was merged for it. The cause is the first failure in category order.
 */
@Getter
public class AnalysisFailedException extends CleanupException {

    private final long submissionId;
    private final List<AgentFailure> failures;

    public AnalysisFailedException(long submissionId, List<AgentFailure> failures, Throwable cause) {
        super("Analysis of submission #" + submissionId + " failed: " + failures.get(0).describe(), cause);
        this.submissionId = submissionId;
        this.failures = List.copyOf(failures);
    }
}
