package com.vidnyan.cleanup.domain.finding;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Describes one analyzer invocation that did not complete.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AgentFailure(
    Category category,
    String store,
    String errorType,
    String message
) {

    public static AgentFailure of(Category category, String store, Throwable error) {
        return new AgentFailure(category, store, error.getClass().getSimpleName(), error.getMessage());
    }

    public String describe() {
        return category.key() + " analyzer on store '" + store + "' failed: " + errorType + ": " + message;
    }
}
