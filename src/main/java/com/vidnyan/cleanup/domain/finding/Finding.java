package com.vidnyan.cleanup.domain.finding;

import java.util.Objects;

/**
 * A detected defect.
 * Immutable value object with no identity of its own.
 */
public record Finding(
    Category category,
    String issue,
    int line,
    String snippet,
    Severity severity,
    String remediation
) {

    /**
     * Line reported for file-scoped findings.
     */
    public static final int FILE_LINE = 1;

    static final int MAX_SNIPPET = 200;

    public Finding {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(issue, "issue");
        Objects.requireNonNull(severity, "severity");
        if (line < 1) {
            throw new IllegalArgumentException("Line numbers are 1-based, got " + line);
        }
        snippet = truncate(snippet == null ? "" : snippet);
        remediation = remediation == null ? "" : remediation;
    }

    /**
     * Builder for Finding.
     */
    public static Builder builder(Category category) {
        return new Builder(category);
    }

    private static String truncate(String text) {
        return text.length() <= MAX_SNIPPET ? text : text.substring(0, MAX_SNIPPET);
    }

    public static class Builder {
        private final Category category;
        private String issue;
        private int line = FILE_LINE;
        private String snippet = "";
        private Severity severity = Severity.LOW;
        private String remediation = "";

        private Builder(Category category) {
            this.category = category;
        }

        public Builder issue(String issue) { this.issue = issue; return this; }
        public Builder line(int line) { this.line = line; return this; }
        public Builder snippet(String snippet) { this.snippet = snippet; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder remediation(String remediation) { this.remediation = remediation; return this; }

        public Finding build() {
            return new Finding(category, issue, line, snippet, severity, remediation);
        }
    }
}
