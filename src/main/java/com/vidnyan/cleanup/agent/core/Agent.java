package com.vidnyan.cleanup.agent.core;

/**
 * A unit of work the coordinator schedules on its own.
 * Implementations hold every resource they use, so two agents never share mutable state.
 */
public interface Agent<I, O> {

    /**
     * Name used in logs and failure reports, e.g. {@code security@security-fork}.
     */
    String getName();

    /**
     * Run to completion. Failures are thrown, never returned.
     */
    O execute(I input);
}
