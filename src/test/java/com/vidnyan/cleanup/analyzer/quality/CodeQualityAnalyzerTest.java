package com.vidnyan.cleanup.analyzer.quality;

import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.finding.Severity;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodeQualityAnalyzerTest {

    private final CodeQualityAnalyzer analyzer = new CodeQualityAnalyzer();

    private static String function(String name, int bodyLines, boolean documented) {
        StringBuilder code = new StringBuilder("def ").append(name).append("(data):\n");
        if (documented) {
            code.append("    \"\"\"Process data.\"\"\"\n");
        }
        for (int i = 1; i <= bodyLines - (documented ? 1 : 0); i++) {
            code.append("    v").append(i).append(" = data\n");
        }
        return code.toString();
    }

    @Test
    void longUndocumentedFunction_ShouldReportLengthAndMissingDocstring() {
        String code = function("process", 60, false) + "result = process(1)\n";

        List<Finding> findings = analyzer.analyze(code, "long.py");

        assertEquals(2, findings.size());
        Finding longFunction = findings.get(0);
        assertEquals("Long function: process()", longFunction.issue());
        assertEquals(Severity.MEDIUM, longFunction.severity());
        assertEquals(1, longFunction.line());
        assertEquals("Function is 61 lines long", longFunction.snippet());

        Finding docstring = findings.get(1);
        assertEquals("Missing docstring", docstring.issue());
        assertEquals(Severity.LOW, docstring.severity());
        assertEquals(1, docstring.line());
    }

    @Test
    void functionOpenAtEndOfFile_ShouldStillBeMeasured() {
        String code = function("tail", 55, true);

        List<Finding> findings = analyzer.analyze(code, "tail.py");

        assertEquals(1, findings.size());
        assertEquals("Long function: tail()", findings.get(0).issue());
        assertEquals("Function is 56 lines long", findings.get(0).snippet());
    }

    @Test
    void shortDocumentedFunction_ShouldBeClean() {
        String code = function("small", 10, true) + "small(1)\n";

        assertTrue(analyzer.analyze(code, "small.py").isEmpty());
    }

    @Test
    void docstringBeyondThreeLines_ShouldNotCount() {
        String code = """
                def late(x):
                    a = 1
                    b = 2
                    c = 3
                    \"\"\"Too late.\"\"\"
                """;

        List<Finding> findings = analyzer.analyze(code, "late.py");

        assertEquals(List.of("Missing docstring"), findings.stream().map(Finding::issue).toList());
    }

    @Test
    void longLine_ShouldBeTruncatedInSnippet() {
        String line = "x = \"" + "a".repeat(130) + "\"";

        List<Finding> findings = analyzer.analyze(line + "\n", "wide.py");

        assertEquals(1, findings.size());
        assertEquals("Line too long", findings.get(0).issue());
        assertEquals(Severity.LOW, findings.get(0).severity());
        assertEquals(line.substring(0, 80) + "...", findings.get(0).snippet());
    }

    @Test
    void lineRepeatedThreeTimes_ShouldBeReportedOnceAtFirstOccurrence() {
        String repeated = "total = compute_total(items)";
        String code = "a = 1\n" + repeated + "\n" + repeated + "\nb = 2\n" + repeated + "\n"
                + "# commented out line that is long enough\n".repeat(3);

        List<Finding> findings = analyzer.analyze(code, "dup.py");

        assertEquals(1, findings.size());
        Finding duplicate = findings.get(0);
        assertEquals("Duplicate code detected", duplicate.issue());
        assertEquals(Severity.MEDIUM, duplicate.severity());
        assertEquals(2, duplicate.line());
        assertEquals("Repeated 3 times: " + repeated + "...", duplicate.snippet());
    }

    @Test
    void analysis_ShouldBeDeterministic() throws IOException {
        String code;
        try (InputStream in = getClass().getResourceAsStream("/samples/bad_code.py")) {
            assertNotNull(in, "sample fixture missing");
            code = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }

        List<Finding> first = analyzer.analyze(code, "bad_code.py");

        assertFalse(first.isEmpty());
        assertEquals(first, analyzer.analyze(code, "bad_code.py"));
        assertEquals(first, new CodeQualityAnalyzer().analyze(code, "bad_code.py"));
    }
}
