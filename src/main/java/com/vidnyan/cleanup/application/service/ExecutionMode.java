package com.vidnyan.cleanup.application.service;

import java.util.Locale;

/**
 * How the analyzers of one submission are scheduled.
 */
public enum ExecutionMode {

    /**
     * All analyzers run concurrently, each against its own store where one is configured.
     */
    FORKED,

    /**
     * Analyzers run one after another on the calling thread against the primary store.
     */
    SEQUENTIAL;

    /**
     * Forked mode requires isolated stores for at least the security and quality analyzers.
     * Depends on configuration only.
     */
    public static ExecutionMode select(StoreSettings settings) {
        return settings.hasSecurityFork() && settings.hasQualityFork() ? FORKED : SEQUENTIAL;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
