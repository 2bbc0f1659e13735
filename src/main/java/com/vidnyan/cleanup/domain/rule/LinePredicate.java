package com.vidnyan.cleanup.domain.rule;

import com.vidnyan.cleanup.domain.source.SourceText;

import java.util.regex.Pattern;

/**
 * Test applied to a single line, with access to the whole source for context.
 */
@FunctionalInterface
public interface LinePredicate {

    boolean test(SourceText source, int lineNumber, String line);

    /**
     * Pattern found anywhere in the line.
     */
    static LinePredicate find(Pattern pattern) {
        return (source, n, line) -> pattern.matcher(line).find();
    }

    /**
     * Pattern matching from the start of the line.
     */
    static LinePredicate lookingAt(Pattern pattern) {
        return (source, n, line) -> pattern.matcher(line).lookingAt();
    }

    /**
     * Apply this predicate to the stripped line.
     */
    default LinePredicate onStripped() {
        return (source, n, line) -> test(source, n, line.strip());
    }

    default LinePredicate and(LinePredicate other) {
        return (source, n, line) -> test(source, n, line) && other.test(source, n, line);
    }

    default LinePredicate negate() {
        return (source, n, line) -> !test(source, n, line);
    }
}
