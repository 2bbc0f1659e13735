package com.vidnyan.cleanup.domain.rule;

import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.source.SourceText;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered group of line rules evaluated line-major: for each line, every rule in table order.
 * Every match is reported independently with the stripped line as snippet.
 */
public record LineRuleGroup(
    String id,
    Category category,
    List<LineRule> rules
) implements RuleEvaluator {

    public LineRuleGroup {
        rules = List.copyOf(rules);
    }

    @Override
    public List<Finding> evaluate(SourceText source) {
        List<Finding> findings = new ArrayList<>();
        for (int n = 1; n <= source.lineCount(); n++) {
            String line = source.line(n);
            for (LineRule rule : rules) {
                if (rule.predicate().test(source, n, line)) {
                    findings.add(Finding.builder(category)
                            .issue(rule.issue())
                            .line(n)
                            .snippet(line.strip())
                            .severity(rule.severity())
                            .remediation(rule.remediation())
                            .build());
                }
            }
        }
        return findings;
    }
}
