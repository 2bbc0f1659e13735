package com.vidnyan.cleanup.analyzer.performance;

import com.vidnyan.cleanup.analyzer.RuleBasedAnalyzer;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.finding.Severity;
import com.vidnyan.cleanup.domain.rule.LineRule;
import com.vidnyan.cleanup.domain.rule.LineRuleGroup;
import com.vidnyan.cleanup.domain.rule.RuleEvaluator;
import com.vidnyan.cleanup.domain.source.SourceText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Query-in-loop, indexing, result-set size, loop nesting, connection reuse and loop-body heuristics.
 */
@Component
public class PerformanceAnalyzer extends RuleBasedAnalyzer {

    private static final List<String> QUERY_KEYWORDS = List.of("execute", "query", "select", "fetch");
    private static final List<String> FILTER_OPERATORS = List.of("=", "in", "like");

    static final LineRuleGroup MISSING_INDEX = new LineRuleGroup("PERF-INDEX", Category.PERFORMANCE, List.of(
            LineRule.of("Query might benefit from index", Severity.MEDIUM,
                    PerformanceAnalyzer::filtersWithoutPrimaryKey,
                    "Consider adding database index on queried columns")));

    static final LineRuleGroup SELECT_STAR = new LineRuleGroup("PERF-SELECT-STAR", Category.PERFORMANCE, List.of(
            LineRule.patternIgnoreCase("SELECT * fetches unnecessary data", Severity.MEDIUM,
                    "select\\s+\\*\\s+from",
                    "Specify only needed columns instead of SELECT *")));

    static final LineRuleGroup FETCH_ALL = new LineRuleGroup("PERF-FETCHALL", Category.PERFORMANCE, List.of(
            LineRule.patternIgnoreCase("fetchall() loads all rows into memory", Severity.MEDIUM,
                    "fetchall\\(\\)",
                    "Use pagination (LIMIT/OFFSET) or fetchmany() for large datasets")));

    private static final List<RuleEvaluator> RULES = List.of(
            new LoopQueryRule(),
            MISSING_INDEX,
            SELECT_STAR,
            new NestedLoopRule(),
            new ConnectionCountRule(),
            FETCH_ALL,
            new LoopBodyRule("PERF-LOOP-CONCAT", 10,
                    line -> line.contains("+=") && lower(line).contains("str"),
                    line -> line.contains("for ") || line.contains("while "),
                    "String concatenation in loop",
                    "Use list.append() then \"\".join() for better performance"),
            new LoopBodyRule("PERF-LOOP-APPEND", 3,
                    line -> line.contains(".append("),
                    line -> line.contains("for "),
                    "Consider list comprehension",
                    "List comprehensions are faster than append in loops"));

    public PerformanceAnalyzer() {
        super(Category.PERFORMANCE);
    }

    @Override
    protected List<RuleEvaluator> rules(SourceText source) {
        return RULES;
    }

    private static String lower(String line) {
        return line.toLowerCase(Locale.ROOT);
    }

    private static boolean filtersWithoutPrimaryKey(SourceText source, int n, String line) {
        String lower = lower(line);
        return lower.contains("where")
                && FILTER_OPERATORS.stream().anyMatch(lower::contains)
                && !lower.contains("where id")
                && lower.contains("execute");
    }

    private static Finding finding(String issue, int line, String snippet, Severity severity, String fix) {
        return Finding.builder(Category.PERFORMANCE)
                .issue(issue)
                .line(line)
                .snippet(snippet)
                .severity(severity)
                .remediation(fix)
                .build();
    }

    /**
     * A loop line followed within 4 lines by a query call. Reported once per loop line.
     */
    static final class LoopQueryRule implements RuleEvaluator {

        static final int WINDOW = 4;

        @Override
        public String id() {
            return "PERF-N-PLUS-ONE";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            List<Finding> findings = new ArrayList<>();
            for (int n = 1; n <= source.lineCount(); n++) {
                String line = source.line(n);
                if (!lower(line).contains("for ")) {
                    continue;
                }
                int last = Math.min(source.lineCount(), n + WINDOW);
                for (int next = n + 1; next <= last; next++) {
                    String candidate = lower(source.line(next));
                    if (QUERY_KEYWORDS.stream().anyMatch(candidate::contains)) {
                        findings.add(finding("Potential N+1 query problem", n, line.strip(), Severity.HIGH,
                                "Move query outside loop or use batch query with JOIN"));
                        break;
                    }
                }
            }
            return findings;
        }
    }

    /**
     * A loop indented deeper than an earlier loop less than 20 lines above it.
     */
    static final class NestedLoopRule implements RuleEvaluator {

        static final int DISTANCE = 20;

        private record LoopLine(int line, int indent) {
        }

        @Override
        public String id() {
            return "PERF-NESTED-LOOP";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            List<Finding> findings = new ArrayList<>();
            List<LoopLine> loops = new ArrayList<>();
            for (int n = 1; n <= source.lineCount(); n++) {
                String line = source.line(n);
                if (!line.contains("for ")) {
                    continue;
                }
                int indent = SourceText.indentation(line);
                for (LoopLine previous : loops) {
                    if (indent > previous.indent() && n - previous.line() < DISTANCE) {
                        findings.add(finding("Nested loop detected (O(n²) complexity)", n, line.strip(),
                                Severity.MEDIUM, "Consider using set/dict lookup or algorithm optimization"));
                        break;
                    }
                }
                loops.add(new LoopLine(n, indent));
            }
            return findings;
        }
    }

    /**
     * More than one connection-open call in the file. File-scoped, carries the count.
     */
    static final class ConnectionCountRule implements RuleEvaluator {

        @Override
        public String id() {
            return "PERF-CONNECTIONS";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            long opens = source.lines().stream()
                    .filter(line -> lower(line).contains("connect("))
                    .count();
            if (opens <= 1) {
                return List.of();
            }
            return List.of(finding("Multiple connection calls detected (" + opens + ")", Finding.FILE_LINE,
                    "Found " + opens + " separate connection calls", Severity.HIGH,
                    "Use connection pooling or context manager to reuse connections"));
        }
    }

    /**
     * A trigger line with a loop-opening line among the preceding {@code window} lines.
     */
    static final class LoopBodyRule implements RuleEvaluator {

        private final String id;
        private final int window;
        private final Predicate<String> trigger;
        private final Predicate<String> loopOpening;
        private final String issue;
        private final String remediation;

        LoopBodyRule(String id, int window, Predicate<String> trigger, Predicate<String> loopOpening,
                     String issue, String remediation) {
            this.id = id;
            this.window = window;
            this.trigger = trigger;
            this.loopOpening = loopOpening;
            this.issue = issue;
            this.remediation = remediation;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            List<Finding> findings = new ArrayList<>();
            for (int n = 1; n <= source.lineCount(); n++) {
                String line = source.line(n);
                if (trigger.test(line) && insideLoop(source, n)) {
                    findings.add(finding(issue, n, line.strip(), Severity.LOW, remediation));
                }
            }
            return findings;
        }

        private boolean insideLoop(SourceText source, int n) {
            for (int previous = Math.max(1, n - window); previous < n; previous++) {
                if (loopOpening.test(source.line(previous))) {
                    return true;
                }
            }
            return false;
        }
    }
}
