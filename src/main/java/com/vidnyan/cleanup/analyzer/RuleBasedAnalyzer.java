package com.vidnyan.cleanup.analyzer;

import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.rule.RuleEvaluator;
import com.vidnyan.cleanup.domain.source.SourceText;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Analyzer backed by an ordered rule table.
 * Findings are the concatenation of each rule's findings, in table order.
 */
@Slf4j
public abstract class RuleBasedAnalyzer implements Analyzer {

    private final Category category;

    protected RuleBasedAnalyzer(Category category) {
        this.category = category;
    }

    @Override
    public Category category() {
        return category;
    }

    /**
     * Rules applicable to the given source, in evaluation order.
     */
    protected abstract List<RuleEvaluator> rules(SourceText source);

    @Override
    public List<Finding> analyze(String text, String filename) {
        SourceText source = SourceText.of(text, filename);
        List<Finding> findings = new ArrayList<>();
        for (RuleEvaluator rule : rules(source)) {
            List<Finding> ruleFindings = rule.evaluate(source);
            log.debug("{}: {} found {} issues", getName(), rule.id(), ruleFindings.size());
            findings.addAll(ruleFindings);
        }
        return List.copyOf(findings);
    }
}
