package com.vidnyan.cleanup.domain.finding;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Aggregate result of one submission.
 * Derived from findings, never persisted on its own. Serialized with snake_case keys.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AnalysisReport(
    long submissionId,
    String filename,
    String mode,
    CategoryReport security,
    CategoryReport quality,
    CategoryReport performance,
    CategoryReport bestPractices,
    int totalIssues,
    List<AgentFailure> failures
) {

    public AnalysisReport {
        failures = List.copyOf(failures);
        int sum = security.count() + quality.count() + performance.count() + bestPractices.count();
        if (totalIssues != sum) {
            throw new IllegalArgumentException("totalIssues " + totalIssues + " != category sum " + sum);
        }
    }

    /**
     * Assemble a report from findings grouped by category. Missing categories are empty.
     */
    public static AnalysisReport assemble(long submissionId, String filename, String mode,
                                          Map<Category, List<Finding>> findings,
                                          List<AgentFailure> failures) {
        Map<Category, CategoryReport> reports = new EnumMap<>(Category.class);
        int total = 0;
        for (Category category : Category.values()) {
            List<Finding> issues = findings.getOrDefault(category, List.of());
            reports.put(category, CategoryReport.of(category, issues));
            total += issues.size();
        }
        return new AnalysisReport(submissionId, filename, mode,
                reports.get(Category.SECURITY),
                reports.get(Category.QUALITY),
                reports.get(Category.PERFORMANCE),
                reports.get(Category.BEST_PRACTICES),
                total,
                failures);
    }

    public CategoryReport category(Category category) {
        return switch (category) {
            case SECURITY -> security;
            case QUALITY -> quality;
            case PERFORMANCE -> performance;
            case BEST_PRACTICES -> bestPractices;
        };
    }

    /**
     * All findings in merge order.
     */
    @JsonIgnore
    public List<Finding> allFindings() {
        return Stream.of(security, quality, performance, bestPractices)
                .flatMap(r -> r.issues().stream())
                .toList();
    }

    @JsonIgnore
    public boolean isPartial() {
        return !failures.isEmpty();
    }
}
