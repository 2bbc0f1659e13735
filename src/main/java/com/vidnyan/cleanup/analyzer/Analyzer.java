package com.vidnyan.cleanup.analyzer;

import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;

import java.util.List;

/**
 * Rule-based analyzer for one category.
 * Implementations are stateless: the same text and filename always yield the same ordered findings.
 */
public interface Analyzer {

    Category category();

    /**
     * Analyze raw source text.
     * @param text full file content
     * @param filename used for language detection only
     * @return findings in rule-table order
     */
    List<Finding> analyze(String text, String filename);

    default String getName() {
        return getClass().getSimpleName();
    }
}
