package com.vidnyan.cleanup.application.error;

import com.vidnyan.cleanup.domain.finding.Category;
import lombok.Getter;

/**
 * An analyzer failed on its input.
 */
@Getter
public class AnalyzerLogicException extends CleanupException {

    private final Category category;

    public AnalyzerLogicException(Category category, String message, Throwable cause) {
        super(category.key() + " analyzer failed: " + message, cause);
        this.category = category;
    }
}
