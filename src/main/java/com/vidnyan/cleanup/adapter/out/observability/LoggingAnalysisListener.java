package com.vidnyan.cleanup.adapter.out.observability;

import com.vidnyan.cleanup.application.port.out.AnalysisListener;
import com.vidnyan.cleanup.domain.finding.AnalysisReport;
import com.vidnyan.cleanup.domain.finding.Category;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Writes coordinator events to the application log.
 */
@Slf4j
@Component
public class LoggingAnalysisListener implements AnalysisListener {

    @Override
    public void submissionRegistered(long submissionId, String filename, String mode) {
        log.info("Submission #{} registered: {} ({} mode)", submissionId, filename, mode);
    }

    @Override
    public void agentStarted(long submissionId, Category category, String store) {
        log.info("  #{} {} analyzer started on store '{}'", submissionId, category.key(), store);
    }

    @Override
    public void agentFinished(long submissionId, Category category, String store, int findings, Duration elapsed) {
        log.info("  #{} {} analyzer finished: {} issues in {}ms", submissionId, category.key(), findings,
                elapsed.toMillis());
    }

    @Override
    public void agentFailed(long submissionId, Category category, String store, Throwable error) {
        log.error("  #{} {} analyzer failed on store '{}': {}", submissionId, category.key(), store,
                error.getMessage(), error);
    }

    @Override
    public void findingsMerged(long submissionId, int findings) {
        log.info("  #{} merged {} findings into the primary store", submissionId, findings);
    }

    @Override
    public void analysisCompleted(AnalysisReport report) {
        log.info("Submission #{} complete: {} issues (security={}, quality={}, performance={}, best_practices={}){}",
                report.submissionId(), report.totalIssues(),
                report.security().count(), report.quality().count(),
                report.performance().count(), report.bestPractices().count(),
                report.isPartial() ? " - partial, " + report.failures().size() + " analyzer(s) failed" : "");
    }

    @Override
    public void analysisAborted(long submissionId, Throwable cause) {
        log.error("Submission #{} aborted: {}", submissionId, cause.getMessage());
    }
}
