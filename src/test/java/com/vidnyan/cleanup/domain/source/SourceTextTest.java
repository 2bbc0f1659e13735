package com.vidnyan.cleanup.domain.source;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceTextTest {

    @Test
    void lines_ShouldBeOneBasedWithoutCarriageReturns() {
        SourceText source = SourceText.of("a = 1\r\n  b = 2\r\n\n", "crlf.py");

        assertEquals(4, source.lineCount());
        assertEquals("a = 1", source.line(1));
        assertEquals("  b = 2", source.line(2));
        assertEquals(2, source.lastContentLine());
        assertEquals(Language.PYTHON, source.language());
    }

    @Test
    void blankText_ShouldHaveNoContentLine() {
        SourceText source = SourceText.of("", "empty.py");

        assertEquals(1, source.lineCount());
        assertEquals(0, source.lastContentLine());
    }

    @Test
    void indentationHelpers() {
        assertEquals(8, SourceText.indentation("        x"));
        assertTrue(SourceText.startsAtColumnZero("x = 1"));
        assertFalse(SourceText.startsAtColumnZero("  x = 1"));
        assertFalse(SourceText.startsAtColumnZero(""));
    }

    @Test
    void language_ShouldComeFromExtensionOnly() {
        assertEquals(Language.PYTHON, Language.fromFilename("pkg/Module.PY"));
        assertEquals(Language.JAVA, Language.fromFilename("Main.java"));
        assertEquals(Language.UNKNOWN, Language.fromFilename("py"));
        assertEquals(Language.UNKNOWN, Language.fromFilename("notes.txt"));
        assertEquals(Language.UNKNOWN, Language.fromFilename(null));
    }
}
