package com.vidnyan.cleanup.domain.source;

import java.util.Arrays;
import java.util.Locale;

/**
 * Source language, detected from the file extension only.
 */
public enum Language {
    PYTHON("py"),
    JAVASCRIPT("js"),
    TYPESCRIPT("ts"),
    JAVA("java"),
    GO("go"),
    RUBY("rb"),
    CPP("cpp"),
    C("c"),
    UNKNOWN("");

    private final String extension;

    Language(String extension) {
        this.extension = extension;
    }

    public static Language fromFilename(String filename) {
        int dot = filename == null ? -1 : filename.lastIndexOf('.');
        if (dot < 0) {
            return UNKNOWN;
        }
        String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l != UNKNOWN && l.extension.equals(ext))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
