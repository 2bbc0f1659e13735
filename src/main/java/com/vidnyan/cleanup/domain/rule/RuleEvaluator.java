package com.vidnyan.cleanup.domain.rule;

import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.source.SourceText;

import java.util.List;

/**
 * One entry of an analyzer's rule table.
 * Evaluation must be a pure function of the source text.
 */
public interface RuleEvaluator {

    /**
     * Stable rule id, e.g. {@code SEC-SECRET}.
     */
    String id();

    /**
     * Evaluate the rule and return findings in line order.
     */
    List<Finding> evaluate(SourceText source);

    /**
     * Get the evaluator name for logging.
     */
    default String getName() {
        return getClass().getSimpleName() + "[" + id() + "]";
    }
}
