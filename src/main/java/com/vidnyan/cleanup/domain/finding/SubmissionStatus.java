package com.vidnyan.cleanup.domain.finding;

/**
 * How the analysis of a submission ended.
 */
public enum SubmissionStatus {
    /** Registered, analyzers not yet joined. */
    RUNNING,
    /** Every analyzer succeeded and all findings were merged. */
    COMPLETED,
    /** Some analyzers failed under best effort; the survivors' findings were merged. */
    PARTIAL,
    /** An analyzer failed under all-or-nothing; nothing was merged. */
    ABORTED;

    public boolean hasReport() {
        return this == COMPLETED || this == PARTIAL;
    }

    /**
     * Rows written before outcomes were recorded carry no status and were only ever merged on success.
     */
    public static SubmissionStatus fromColumn(String value) {
        return value == null ? COMPLETED : valueOf(value);
    }
}
