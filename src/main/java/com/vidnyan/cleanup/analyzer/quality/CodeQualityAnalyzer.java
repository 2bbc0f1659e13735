package com.vidnyan.cleanup.analyzer.quality;

import com.vidnyan.cleanup.analyzer.RuleBasedAnalyzer;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.finding.Severity;
import com.vidnyan.cleanup.domain.rule.RuleEvaluator;
import com.vidnyan.cleanup.domain.source.SourceText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Function length, line length, missing documentation and verbatim duplication.
 */
@Component
public class CodeQualityAnalyzer extends RuleBasedAnalyzer {

    static final int MAX_FUNCTION_LINES = 50;
    static final int MAX_LINE_LENGTH = 120;
    static final int DOC_WINDOW = 3;
    static final int MIN_DUPLICATE_LENGTH = 20;
    static final int MIN_DUPLICATE_COUNT = 3;

    private static final Pattern DEFINITION = Pattern.compile("\\s*def\\s+(\\w+)\\s*\\(");

    private static final List<RuleEvaluator> RULES = List.of(
            new LongFunctionRule(),
            new LongLineRule(),
            new MissingDocstringRule(),
            new DuplicateLineRule());

    public CodeQualityAnalyzer() {
        super(Category.QUALITY);
    }

    @Override
    protected List<RuleEvaluator> rules(SourceText source) {
        return RULES;
    }

    /**
     * A function starts at a definition line and ends at the first later line in column 0.
     * A new definition restarts the span; a function open at end of file ends after its last content line.
     */
    static final class LongFunctionRule implements RuleEvaluator {

        @Override
        public String id() {
            return "QUAL-LONG-FUNCTION";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            List<Finding> findings = new ArrayList<>();
            String name = null;
            int start = 0;
            for (int n = 1; n <= source.lineCount(); n++) {
                String line = source.line(n);
                Matcher def = DEFINITION.matcher(line);
                if (def.lookingAt()) {
                    name = def.group(1);
                    start = n;
                } else if (name != null && SourceText.startsAtColumnZero(line)) {
                    report(findings, name, start, n - start);
                    name = null;
                }
            }
            if (name != null) {
                report(findings, name, start, source.lastContentLine() + 1 - start);
            }
            return findings;
        }

        private void report(List<Finding> findings, String name, int start, int length) {
            if (length > MAX_FUNCTION_LINES) {
                findings.add(Finding.builder(Category.QUALITY)
                        .issue("Long function: " + name + "()")
                        .line(start)
                        .snippet("Function is " + length + " lines long")
                        .severity(Severity.MEDIUM)
                        .remediation("Break into smaller, focused functions")
                        .build());
            }
        }
    }

    static final class LongLineRule implements RuleEvaluator {

        @Override
        public String id() {
            return "QUAL-LINE-LENGTH";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            List<Finding> findings = new ArrayList<>();
            for (int n = 1; n <= source.lineCount(); n++) {
                String line = source.line(n);
                if (line.length() > MAX_LINE_LENGTH) {
                    findings.add(Finding.builder(Category.QUALITY)
                            .issue("Line too long")
                            .line(n)
                            .snippet(line.substring(0, 80) + "...")
                            .severity(Severity.LOW)
                            .remediation("Break into multiple lines (PEP 8: max 79-120 chars)")
                            .build());
                }
            }
            return findings;
        }
    }

    /**
     * A definition is documented when one of the next three lines opens a docstring.
     */
    static final class MissingDocstringRule implements RuleEvaluator {

        @Override
        public String id() {
            return "QUAL-DOCSTRING";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            List<Finding> findings = new ArrayList<>();
            for (int n = 1; n <= source.lineCount(); n++) {
                String line = source.line(n);
                if (DEFINITION.matcher(line).lookingAt() && !documented(source, n)) {
                    findings.add(Finding.builder(Category.QUALITY)
                            .issue("Missing docstring")
                            .line(n)
                            .snippet(line.strip())
                            .severity(Severity.LOW)
                            .remediation("Add docstring to explain function purpose")
                            .build());
                }
            }
            return findings;
        }

        private boolean documented(SourceText source, int definitionLine) {
            int last = Math.min(source.lineCount(), definitionLine + DOC_WINDOW);
            for (int n = definitionLine + 1; n <= last; n++) {
                String candidate = source.line(n);
                if (candidate.contains("\"\"\"") || candidate.contains("'''")) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Non-comment lines longer than 20 characters repeated verbatim 3 or more times,
     * reported once at the first occurrence.
     */
    static final class DuplicateLineRule implements RuleEvaluator {

        @Override
        public String id() {
            return "QUAL-DUPLICATE";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            Map<String, List<Integer>> occurrences = new LinkedHashMap<>();
            for (int n = 1; n <= source.lineCount(); n++) {
                String stripped = source.line(n).strip();
                if (stripped.length() > MIN_DUPLICATE_LENGTH && !stripped.startsWith("#")) {
                    occurrences.computeIfAbsent(stripped, k -> new ArrayList<>()).add(n);
                }
            }

            List<Finding> findings = new ArrayList<>();
            occurrences.forEach((text, lines) -> {
                if (lines.size() >= MIN_DUPLICATE_COUNT) {
                    findings.add(Finding.builder(Category.QUALITY)
                            .issue("Duplicate code detected")
                            .line(lines.get(0))
                            .snippet("Repeated " + lines.size() + " times: "
                                    + text.substring(0, Math.min(50, text.length())) + "...")
                            .severity(Severity.MEDIUM)
                            .remediation("Extract into a reusable function")
                            .build());
                }
            });
            return findings;
        }
    }
}
