package com.vidnyan.cleanup.application.service;

/**
 * What the coordinator does when some analyzers fail.
 */
public enum FailurePolicy {

    /**
     * Any failure aborts the submission: nothing is merged and the caller gets an error.
     */
    ALL_OR_NOTHING,

    /**
     * Successful categories are merged and reported; failed ones are listed in the report.
     */
    BEST_EFFORT
}
