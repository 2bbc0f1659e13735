package com.vidnyan.cleanup.application.service;

import com.vidnyan.cleanup.domain.finding.AgentFailure;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;

import java.util.List;

/**
 * Result of one analyzer invocation: its findings, or the error that stopped it.
 */
record AgentOutcome(
    Category category,
    String store,
    List<Finding> findings,
    Throwable error
) {

    static AgentOutcome success(Category category, String store, List<Finding> findings) {
        return new AgentOutcome(category, store, List.copyOf(findings), null);
    }

    static AgentOutcome failure(Category category, String store, Throwable error) {
        return new AgentOutcome(category, store, List.of(), error);
    }

    boolean failed() {
        return error != null;
    }

    AgentFailure toFailure() {
        return AgentFailure.of(category, store, error);
    }
}
