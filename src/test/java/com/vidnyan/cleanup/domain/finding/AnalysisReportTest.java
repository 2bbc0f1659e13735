package com.vidnyan.cleanup.domain.finding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisReportTest {

    private static Finding finding(Category category, String issue, int line) {
        return Finding.builder(category).issue(issue).line(line).severity(Severity.HIGH).build();
    }

    @Test
    void assemble_ShouldFillMissingCategoriesAndSumCounts() {
        AnalysisReport report = AnalysisReport.assemble(7, "a.py", "sequential", Map.of(
                Category.SECURITY, List.of(finding(Category.SECURITY, "s1", 1), finding(Category.SECURITY, "s2", 2)),
                Category.PERFORMANCE, List.of(finding(Category.PERFORMANCE, "p1", 3))), List.of());

        assertEquals(2, report.security().count());
        assertEquals(0, report.quality().count());
        assertEquals(1, report.performance().count());
        assertEquals(0, report.bestPractices().count());
        assertEquals(3, report.totalIssues());
        assertEquals(List.of("s1", "s2", "p1"), report.allFindings().stream().map(Finding::issue).toList());
        assertFalse(report.isPartial());
    }

    @Test
    void inconsistentTotal_ShouldBeRejected() {
        CategoryReport empty = CategoryReport.empty(Category.SECURITY);
        assertThrows(IllegalArgumentException.class, () -> new AnalysisReport(1, "a.py", "forked",
                empty, CategoryReport.empty(Category.QUALITY), CategoryReport.empty(Category.PERFORMANCE),
                CategoryReport.empty(Category.BEST_PRACTICES), 1, List.of()));
    }

    @Test
    void finding_ShouldTruncateSnippetAndRejectLineZero() {
        Finding truncated = Finding.builder(Category.QUALITY).issue("x").snippet("y".repeat(300)).build();

        assertEquals(Finding.MAX_SNIPPET, truncated.snippet().length());
        assertThrows(IllegalArgumentException.class,
                () -> Finding.builder(Category.QUALITY).issue("x").line(0).build());
    }

    @Test
    void json_ShouldUseSnakeCaseAndCategoryKeys() throws Exception {
        AnalysisReport report = AnalysisReport.assemble(3, "b.py", "forked", Map.of(
                Category.BEST_PRACTICES, List.of(finding(Category.BEST_PRACTICES, "bp", 4))),
                List.of(new AgentFailure(Category.QUALITY, "quality-fork", "StoreConnectivityException", "down")));

        JsonNode json = new ObjectMapper().valueToTree(report);

        assertEquals(3, json.get("submission_id").asLong());
        assertEquals(1, json.get("total_issues").asInt());
        assertEquals(1, json.get("best_practices").get("count").asInt());
        assertEquals("best_practices", json.get("best_practices").get("issues").get(0).get("category").asText());
        assertEquals("StoreConnectivityException", json.get("failures").get(0).get("error_type").asText());
        assertFalse(json.has("totalIssues"));
        assertFalse(json.has("all_findings"));
        assertFalse(json.has("partial"));
    }
}
