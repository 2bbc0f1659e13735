package com.vidnyan.cleanup.analyzer.security;

import com.vidnyan.cleanup.analyzer.RuleBasedAnalyzer;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.rule.LineRule;
import com.vidnyan.cleanup.domain.rule.LineRuleGroup;
import com.vidnyan.cleanup.domain.rule.RuleEvaluator;
import com.vidnyan.cleanup.domain.source.SourceText;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.vidnyan.cleanup.domain.finding.Severity.CRITICAL;
import static com.vidnyan.cleanup.domain.finding.Severity.HIGH;

/**
 * Detects hardcoded secrets, injection-shaped query construction and dynamic evaluation.
 * Severity is fixed per rule group.
 */
@Component
public class SecurityAnalyzer extends RuleBasedAnalyzer {

    private static final String SECRET_FIX = "Use environment variables or secret management system";
    private static final String QUERY_FIX = "Use parameterized queries with placeholders";

    static final LineRuleGroup HARDCODED_SECRETS = new LineRuleGroup("SEC-SECRET", Category.SECURITY, List.of(
            LineRule.patternIgnoreCase("Hardcoded password", HIGH,
                    "password\\s*=\\s*[\"']([^\"']+)[\"']", SECRET_FIX),
            LineRule.patternIgnoreCase("Hardcoded API key", HIGH,
                    "api[_-]?key\\s*=\\s*[\"']([^\"']+)[\"']", SECRET_FIX),
            LineRule.patternIgnoreCase("Hardcoded secret", HIGH,
                    "secret\\s*=\\s*[\"']([^\"']+)[\"']", SECRET_FIX),
            LineRule.patternIgnoreCase("Hardcoded token", HIGH,
                    "token\\s*=\\s*[\"']([^\"']+)[\"']", SECRET_FIX),
            LineRule.patternIgnoreCase("AWS credentials", HIGH,
                    "aws[_-]?access[_-]?key", SECRET_FIX)));

    static final LineRuleGroup SQL_INJECTION = new LineRuleGroup("SEC-SQLI", Category.SECURITY, List.of(
            LineRule.pattern("SQL injection via f-string", CRITICAL,
                    "execute\\s*\\(\\s*f[\"'].*\\{.*}.*[\"']", QUERY_FIX),
            LineRule.pattern("SQL injection via string formatting", CRITICAL,
                    "execute\\s*\\(\\s*[\"'].*%s.*[\"'].*%", QUERY_FIX),
            LineRule.pattern("SQL injection via concatenation", CRITICAL,
                    "execute\\s*\\(\\s*.+\\s*\\+\\s*.+\\)", QUERY_FIX),
            LineRule.pattern("SQL injection in cursor.execute", CRITICAL,
                    "cursor\\.execute\\s*\\([^,]+\\+", QUERY_FIX)));

    static final LineRuleGroup DYNAMIC_EVALUATION = new LineRuleGroup("SEC-EVAL", Category.SECURITY, List.of(
            dangerous("eval"),
            dangerous("exec"),
            dangerous("__import__")));

    private static final List<RuleEvaluator> RULES = List.of(HARDCODED_SECRETS, SQL_INJECTION, DYNAMIC_EVALUATION);

    public SecurityAnalyzer() {
        super(Category.SECURITY);
    }

    @Override
    protected List<RuleEvaluator> rules(SourceText source) {
        return RULES;
    }

    private static LineRule dangerous(String function) {
        return LineRule.pattern("Dangerous function: " + function + "()", HIGH,
                "\\b" + function + "\\s*\\(",
                "Avoid using " + function + "() - find safer alternatives");
    }
}
