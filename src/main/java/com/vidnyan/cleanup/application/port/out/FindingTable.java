package com.vidnyan.cleanup.application.port.out;

import com.vidnyan.cleanup.domain.finding.Category;

import java.util.Optional;

/**
 * Finding tables known to the stores: one per category plus the merged record.
 */
public enum FindingTable {
    SECURITY_FINDINGS("security_findings", Category.SECURITY),
    QUALITY_FINDINGS("quality_findings", Category.QUALITY),
    PERFORMANCE_FINDINGS("performance_findings", Category.PERFORMANCE),
    BEST_PRACTICES_FINDINGS("best_practices_findings", Category.BEST_PRACTICES),
    MERGED_FINDINGS("merged_findings", null);

    private final String tableName;
    private final Category category;

    FindingTable(String tableName, Category category) {
        this.tableName = tableName;
        this.category = category;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Category of the rows, empty for the merged table whose rows carry their own agent type.
     */
    public Optional<Category> category() {
        return Optional.ofNullable(category);
    }

    public boolean isMerged() {
        return category == null;
    }

    public static FindingTable forCategory(Category category) {
        return switch (category) {
            case SECURITY -> SECURITY_FINDINGS;
            case QUALITY -> QUALITY_FINDINGS;
            case PERFORMANCE -> PERFORMANCE_FINDINGS;
            case BEST_PRACTICES -> BEST_PRACTICES_FINDINGS;
        };
    }
}
