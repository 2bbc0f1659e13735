package com.vidnyan.cleanup.analyzer.bestpractices;

import com.vidnyan.cleanup.analyzer.RuleBasedAnalyzer;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.finding.Severity;
import com.vidnyan.cleanup.domain.rule.LinePredicate;
import com.vidnyan.cleanup.domain.rule.LineRule;
import com.vidnyan.cleanup.domain.rule.LineRuleGroup;
import com.vidnyan.cleanup.domain.rule.RuleEvaluator;
import com.vidnyan.cleanup.domain.source.Language;
import com.vidnyan.cleanup.domain.source.SourceText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.vidnyan.cleanup.domain.finding.Severity.HIGH;
import static com.vidnyan.cleanup.domain.finding.Severity.LOW;
import static com.vidnyan.cleanup.domain.finding.Severity.MEDIUM;

/**
 * Language-specific idioms layered on general rules.
 * Python rules apply only to {@code .py} files; general rules apply to every file.
 */
@Component
public class BestPracticesAnalyzer extends RuleBasedAnalyzer {

    static final int MAX_NESTING = 4;
    static final int INDENT_WIDTH = 4;
    static final int NAMING_THRESHOLD = 3;
    static final int MAX_DEFINITION_LINES = 100;

    static final LineRuleGroup PYTHON_IDIOMS = new LineRuleGroup("BP-PYTHON", Category.BEST_PRACTICES, List.of(
            LineRule.of("Print statement in production code", LOW,
                    BestPracticesAnalyzer::productionPrint,
                    "Use logging module instead of print() for production code"),
            LineRule.of("Bare except clause catches all exceptions", MEDIUM,
                    LinePredicate.lookingAt(Pattern.compile("\\s*except\\s*:")).onStripped(),
                    "Specify exception types (e.g., except ValueError:) or use except Exception:"),
            LineRule.of("Mutable default argument", HIGH,
                    BestPracticesAnalyzer::mutableDefault,
                    "Use None as default and initialize inside function: def func(arg=None): arg = arg or []"),
            LineRule.of("Unnecessary pass statement", LOW,
                    BestPracticesAnalyzer::unjustifiedPass,
                    "Consider removing or adding a comment explaining why it's empty"),
            LineRule.of("Lambda assignment should be a function", MEDIUM,
                    LinePredicate.find(Pattern.compile("^\\s*\\w+\\s*=\\s*lambda\\s")).onStripped(),
                    "Use def instead of assigning lambda to a variable"),
            LineRule.of("Using type() for type checking", MEDIUM,
                    LinePredicate.find(Pattern.compile("type\\s*\\([^)]+\\)\\s*==")).onStripped(),
                    "Use isinstance() instead of type() == for type checking"),
            LineRule.of("Explicit boolean comparison", LOW,
                    LinePredicate.find(Pattern.compile("==\\s*(True|False)\\b")).onStripped(),
                    "Use \"if variable:\" instead of \"if variable == True:\""),
            LineRule.of("Using len() in conditional", LOW,
                    LinePredicate.find(Pattern.compile("if\\s+len\\s*\\([^)]+\\)\\s*[><=]")).onStripped(),
                    "Use \"if collection:\" instead of \"if len(collection) > 0:\""),
            LineRule.of("Wildcard import", MEDIUM,
                    LinePredicate.find(Pattern.compile("from\\s+\\w+\\s+import\\s+\\*")).onStripped(),
                    "Import specific items or use \"import module\" instead of \"from module import *\""),
            LineRule.of("Multiple statements on one line", LOW,
                    (source, n, line) -> {
                        String stripped = line.strip();
                        return stripped.contains(";") && !stripped.startsWith("#");
                    },
                    "Put each statement on its own line for better readability")));

    static final LineRuleGroup TODO_MARKERS = new LineRuleGroup("BP-TODO", Category.BEST_PRACTICES, List.of(
            LineRule.patternIgnoreCase("TODO/FIXME comment found", LOW,
                    "(#|//)\\s*(TODO|FIXME|HACK|XXX)",
                    "Address the TODO or create a tracked issue for it")));

    static final LineRuleGroup MAGIC_NUMBERS = new LineRuleGroup("BP-MAGIC-NUMBER", Category.BEST_PRACTICES, List.of(
            LineRule.of("Magic number detected", LOW,
                    BestPracticesAnalyzer::magicNumber,
                    "Define magic numbers as named constants for better maintainability")));

    private static final Pattern MUTABLE_DEFAULT = Pattern.compile("=\\s*\\[\\s*]|=\\s*\\{\\s*}");
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("\\b(?!0\\b|1\\b|-1\\b)\\d{2,}\\b");
    private static final Pattern CODE_LIKE_COMMENT =
            Pattern.compile("[=+\\-*/(){}\\[\\]]|def |class |import |if |for |while ");
    private static final Pattern CAMEL_CASE = Pattern.compile("\\b[a-z]+[A-Z][a-zA-Z]*\\b");
    private static final Pattern SNAKE_CASE = Pattern.compile("\\b[a-z]+_[a-z]+\\b");
    private static final Pattern DEFINITION = Pattern.compile("\\s*def\\s+(\\w+)");

    private static final List<RuleEvaluator> GENERAL_RULES = List.of(
            TODO_MARKERS,
            MAGIC_NUMBERS,
            new DeepNestingRule(),
            new CommentedCodeRule(),
            new NamingConventionRule(),
            new LongDefinitionRule());

    public BestPracticesAnalyzer() {
        super(Category.BEST_PRACTICES);
    }

    @Override
    protected List<RuleEvaluator> rules(SourceText source) {
        if (source.language() != Language.PYTHON) {
            return GENERAL_RULES;
        }
        List<RuleEvaluator> rules = new ArrayList<>();
        rules.add(PYTHON_IDIOMS);
        rules.addAll(GENERAL_RULES);
        return rules;
    }

    private static boolean productionPrint(SourceText source, int n, String line) {
        String stripped = line.strip();
        return stripped.contains("print(")
                && !stripped.startsWith("#")
                && !stripped.toLowerCase(Locale.ROOT).contains("debug")
                && !source.text().contains("__main__");
    }

    private static boolean mutableDefault(SourceText source, int n, String line) {
        String stripped = line.strip();
        return stripped.contains("def ") && MUTABLE_DEFAULT.matcher(stripped).find();
    }

    private static boolean unjustifiedPass(SourceText source, int n, String line) {
        if (!line.strip().equals("pass") || n == 1) {
            return false;
        }
        String previous = source.line(n - 1).strip();
        return !previous.contains("except") && !previous.contains("class");
    }

    private static boolean magicNumber(SourceText source, int n, String line) {
        int comment = line.indexOf('#');
        String code = comment >= 0 ? line.substring(0, comment) : line;
        return NUMERIC_LITERAL.matcher(code).find()
                && !code.contains("range")
                && !code.contains("sleep");
    }

    private static Finding finding(String issue, int line, String snippet, Severity severity, String fix) {
        return Finding.builder(Category.BEST_PRACTICES)
                .issue(issue)
                .line(line)
                .snippet(snippet)
                .severity(severity)
                .remediation(fix)
                .build();
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    /**
     * First line nested deeper than 4 indentation levels. Reported once.
     */
    static final class DeepNestingRule implements RuleEvaluator {

        @Override
        public String id() {
            return "BP-NESTING";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            for (int n = 1; n <= source.lineCount(); n++) {
                String line = source.line(n);
                if (line.isBlank()) {
                    continue;
                }
                int level = SourceText.indentation(line) / INDENT_WIDTH;
                if (level > MAX_NESTING) {
                    return List.of(finding("Deeply nested code (" + level + " levels)", n, line.strip(), MEDIUM,
                            "Refactor to reduce nesting (extract methods, use early returns)"));
                }
            }
            return List.of();
        }
    }

    /**
     * Three consecutive comment lines that look like code. Reported once, at the first line of the run.
     */
    static final class CommentedCodeRule implements RuleEvaluator {

        @Override
        public String id() {
            return "BP-COMMENTED-CODE";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            int run = 0;
            for (int n = 1; n <= source.lineCount(); n++) {
                String line = source.line(n);
                String stripped = line.strip();
                if (stripped.startsWith("#") && stripped.length() > 3 && CODE_LIKE_COMMENT.matcher(line).find()) {
                    run++;
                } else {
                    run = 0;
                }
                if (run >= 3) {
                    return List.of(finding("Large block of commented-out code", n - 2,
                            "Multiple lines of commented code", LOW,
                            "Remove commented code (use version control instead)"));
                }
            }
            return List.of();
        }
    }

    /**
     * camelCase and snake_case identifiers each appearing more than 3 times. File-scoped.
     */
    static final class NamingConventionRule implements RuleEvaluator {

        @Override
        public String id() {
            return "BP-NAMING";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            int camel = count(CAMEL_CASE, source.text());
            int snake = count(SNAKE_CASE, source.text());
            if (Math.min(camel, snake) <= NAMING_THRESHOLD) {
                return List.of();
            }
            return List.of(finding("Inconsistent naming convention", Finding.FILE_LINE,
                    "Mixed camelCase (" + camel + ") and snake_case (" + snake + ")", LOW,
                    "Use consistent naming convention throughout (Python: snake_case)"));
        }
    }

    /**
     * Definitions spanning more than 100 lines. A later definition closes the current one;
     * so does a column-0 line that is not a definition. File-scoped, one finding per name.
     */
    static final class LongDefinitionRule implements RuleEvaluator {

        @Override
        public String id() {
            return "BP-LONG-DEFINITION";
        }

        @Override
        public List<Finding> evaluate(SourceText source) {
            Map<String, Integer> spans = new LinkedHashMap<>();
            String current = null;
            int start = 0;
            for (int n = 1; n <= source.lineCount(); n++) {
                String line = source.line(n);
                Matcher def = DEFINITION.matcher(line);
                if (def.lookingAt()) {
                    if (current != null) {
                        spans.put(current, n - start);
                    }
                    current = def.group(1);
                    start = n;
                } else if (current != null && SourceText.startsAtColumnZero(line) && !line.contains("def ")) {
                    spans.put(current, n - start);
                    current = null;
                }
            }
            if (current != null) {
                spans.put(current, source.lastContentLine() + 1 - start);
            }

            List<Finding> findings = new ArrayList<>();
            spans.forEach((name, length) -> {
                if (length > MAX_DEFINITION_LINES) {
                    findings.add(finding("Function \"" + name + "\" is very long (" + length + " lines)",
                            Finding.FILE_LINE, "Function exceeds 100 lines", MEDIUM,
                            "Break down into smaller, focused functions following Single Responsibility Principle"));
                }
            });
            return findings;
        }
    }
}
