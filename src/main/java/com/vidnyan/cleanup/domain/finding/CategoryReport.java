package com.vidnyan.cleanup.domain.finding;

import java.util.List;

/**
 * Findings of one category within a report.
 */
public record CategoryReport(
    Category category,
    int count,
    List<Finding> issues
) {

    public CategoryReport {
        issues = List.copyOf(issues);
        if (count != issues.size()) {
            throw new IllegalArgumentException(
                    "Count " + count + " does not match " + issues.size() + " " + category.key() + " findings");
        }
    }

    public static CategoryReport of(Category category, List<Finding> issues) {
        return new CategoryReport(category, issues.size(), issues);
    }

    public static CategoryReport empty(Category category) {
        return new CategoryReport(category, 0, List.of());
    }
}
