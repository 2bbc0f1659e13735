package com.vidnyan.cleanup.domain.finding;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Analysis categories. Declaration order is the merge and presentation order.
 */
public enum Category {
    SECURITY("security"),
    QUALITY("quality"),
    PERFORMANCE("performance"),
    BEST_PRACTICES("best_practices");

    private final String key;

    Category(String key) {
        this.key = key;
    }

    /**
     * Stable lower-case key, stored as {@code agent_type} in merged findings.
     */
    @JsonValue
    public String key() {
        return key;
    }

    public static Category fromKey(String key) {
        return Arrays.stream(values())
                .filter(c -> c.key.equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown category: " + key));
    }
}
