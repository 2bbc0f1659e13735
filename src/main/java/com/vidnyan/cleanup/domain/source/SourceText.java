package com.vidnyan.cleanup.domain.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raw text of a submission split into lines.
 * Line numbers are 1-based. Lines keep their indentation; a trailing carriage return is dropped.
 */
public final class SourceText {

    private final String filename;
    private final String text;
    private final List<String> lines;
    private final Language language;

    private SourceText(String filename, String text, List<String> lines) {
        this.filename = filename;
        this.text = text;
        this.lines = lines;
        this.language = Language.fromFilename(filename);
    }

    public static SourceText of(String text, String filename) {
        Objects.requireNonNull(text, "text");
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return new SourceText(filename == null ? "" : filename, text, Collections.unmodifiableList(lines));
    }

    public String filename() {
        return filename;
    }

    public String text() {
        return text;
    }

    public Language language() {
        return language;
    }

    public List<String> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    /**
     * Line by 1-based number.
     */
    public String line(int number) {
        return lines.get(number - 1);
    }

    /**
     * Number of the last line with non-whitespace content, or 0 for blank text.
     */
    public int lastContentLine() {
        for (int n = lines.size(); n >= 1; n--) {
            if (!line(n).isBlank()) {
                return n;
            }
        }
        return 0;
    }

    /**
     * Count of leading whitespace characters.
     */
    public static int indentation(String line) {
        return line.length() - line.stripLeading().length();
    }

    /**
     * True when the line starts in column 0 with a non-whitespace character.
     */
    public static boolean startsAtColumnZero(String line) {
        return !line.isEmpty() && !Character.isWhitespace(line.charAt(0));
    }
}
