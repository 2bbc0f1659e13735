package com.vidnyan.cleanup.domain.rule;

import com.vidnyan.cleanup.domain.finding.Severity;

import java.util.regex.Pattern;

/**
 * Declarative per-line rule: predicate mapped to issue, severity and fix.
 */
public record LineRule(
    String issue,
    Severity severity,
    LinePredicate predicate,
    String remediation
) {

    public static LineRule of(String issue, Severity severity, LinePredicate predicate, String remediation) {
        return new LineRule(issue, severity, predicate, remediation);
    }

    public static LineRule pattern(String issue, Severity severity, String regex, String remediation) {
        return new LineRule(issue, severity, LinePredicate.find(Pattern.compile(regex)), remediation);
    }

    public static LineRule patternIgnoreCase(String issue, Severity severity, String regex, String remediation) {
        return new LineRule(issue, severity,
                LinePredicate.find(Pattern.compile(regex, Pattern.CASE_INSENSITIVE)), remediation);
    }
}
