package com.vidnyan.cleanup.application.port.in;

import com.vidnyan.cleanup.domain.finding.AnalysisReport;

import java.util.Optional;

/**
 * Primary use case: analyze one file across all categories.
 * This is the main entry point to the application.
 */
public interface AnalyzeSubmissionUseCase {

    /**
     * Register the content, run every analyzer and return the merged report.
     * @throws com.vidnyan.cleanup.application.error.AnalysisFailedException when the failure policy
     *         rejects a partial result
     */
    AnalysisReport submit(String content, String filename);

    /**
     * Rebuild the report of a stored submission from its merged findings.
     * A partial submission's report carries its recorded failures.
     * @return empty when no submission has this id
     * @throws com.vidnyan.cleanup.application.error.ReportUnavailableException when the submission
     *         was aborted or has not finished
     */
    Optional<AnalysisReport> report(long submissionId);
}
