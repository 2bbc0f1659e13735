package com.vidnyan.cleanup.application.service;

import com.vidnyan.cleanup.domain.finding.Category;

import java.util.Optional;

/**
 * Store endpoints read once at startup.
 * The primary URL is required; fork URLs are optional.
 */
public record StoreSettings(
    String primaryUrl,
    String securityForkUrl,
    String qualityForkUrl,
    String performanceForkUrl,
    String bestPracticesForkUrl
) {

    public static StoreSettings primaryOnly(String primaryUrl) {
        return new StoreSettings(primaryUrl, null, null, null, null);
    }

    public boolean hasPrimary() {
        return hasText(primaryUrl);
    }

    public boolean hasSecurityFork() {
        return hasText(securityForkUrl);
    }

    public boolean hasQualityFork() {
        return hasText(qualityForkUrl);
    }

    /**
     * Isolated store URL for a category, if configured.
     */
    public Optional<String> forkUrl(Category category) {
        String url = switch (category) {
            case SECURITY -> securityForkUrl;
            case QUALITY -> qualityForkUrl;
            case PERFORMANCE -> performanceForkUrl;
            case BEST_PRACTICES -> bestPracticesForkUrl;
        };
        return hasText(url) ? Optional.of(url.trim()) : Optional.empty();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
