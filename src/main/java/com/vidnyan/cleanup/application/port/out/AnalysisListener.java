package com.vidnyan.cleanup.application.port.out;

import com.vidnyan.cleanup.domain.finding.AnalysisReport;
import com.vidnyan.cleanup.domain.finding.Category;

import java.time.Duration;

/**
 * Receives progress events from the coordinator. All methods default to no-ops.
 * Called from worker threads in forked mode, so implementations must be thread-safe.
 */
public interface AnalysisListener {

    AnalysisListener NONE = new AnalysisListener() {
    };

    default void submissionRegistered(long submissionId, String filename, String mode) {
    }

    default void agentStarted(long submissionId, Category category, String store) {
    }

    default void agentFinished(long submissionId, Category category, String store, int findings, Duration elapsed) {
    }

    default void agentFailed(long submissionId, Category category, String store, Throwable error) {
    }

    default void findingsMerged(long submissionId, int findings) {
    }

    default void analysisCompleted(AnalysisReport report) {
    }

    default void analysisAborted(long submissionId, Throwable cause) {
    }
}
