package com.vidnyan.cleanup.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.cleanup.application.port.in.AnalyzeSubmissionUseCase;
import com.vidnyan.cleanup.config.CleanupProperties;
import com.vidnyan.cleanup.domain.finding.AgentFailure;
import com.vidnyan.cleanup.domain.finding.AnalysisReport;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.finding.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI Runner for analyzing a single file.
 * Runs when cleanup.analyze.path is set, then shuts the application down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner {

    private static final int MAX_LISTED = 100;

    private final AnalyzeSubmissionUseCase analyzeSubmissionUseCase;
    private final CleanupProperties properties;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) throws Exception {
        String sourcePath = properties.getAnalyze().getPath();
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source file specified. Set cleanup.analyze.path to analyze one on startup.");
            return;
        }

        int exitCode = 1;
        try {
            Path file = Path.of(sourcePath);
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║           Cleanup Agents - Multi-Agent Code Review           ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(sourcePath, 50));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            String content = Files.readString(file, StandardCharsets.UTF_8);
            Path name = file.getFileName();
            AnalysisReport report = analyzeSubmissionUseCase.submit(content,
                    name != null ? name.toString() : sourcePath);

            printResults(report);

            String reportJson = properties.getAnalyze().getReportJson();
            if (reportJson != null && !reportJson.isBlank()) {
                objectMapper.writeValue(Path.of(reportJson).toFile(), report);
                log.info("Report written to {}", reportJson);
            }

            log.info("");
            log.info("Analysis complete!");
            exitCode = 0;
        } finally {
            int code = exitCode;
            SpringApplication.exit(context, () -> code);
        }
    }

    private void printResults(AnalysisReport report) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS - submission #{} ({})", report.submissionId(), report.filename());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Mode:            {}", report.mode());
        for (Category category : Category.values()) {
            log.info(" {} {}", pad(category.key() + ":", 16), report.category(category).count());
        }
        log.info(" Total issues:    {}", report.totalIssues());
        log.info("───────────────────────────────────────────────────────────────");

        log.info(" SEVERITIES:");
        log.info("   🔴 Critical: {}", count(report, Severity.CRITICAL));
        log.info("   🟠 High:     {}", count(report, Severity.HIGH));
        log.info("   🟡 Medium:   {}", count(report, Severity.MEDIUM));
        log.info("   🔵 Low:      {}", count(report, Severity.LOW));
        log.info("═══════════════════════════════════════════════════════════════");

        for (AgentFailure failure : report.failures()) {
            log.warn(" ⚠️  {}", failure.describe());
        }

        if (report.totalIssues() == 0) {
            log.info("");
            log.info("✅ No issues found! Your code is clean.");
            return;
        }

        log.info("");
        log.info(" ISSUE DETAILS:");
        log.info("───────────────────────────────────────────────────────────────");

        int listed = 0;
        for (Finding finding : report.allFindings()) {
            listed++;
            if (listed > MAX_LISTED) {
                log.info(" ... and {} more issues", report.totalIssues() - MAX_LISTED);
                break;
            }

            String severity = switch (finding.severity()) {
                case CRITICAL -> "🔴 CRITICAL";
                case HIGH -> "🟠 HIGH";
                case MEDIUM -> "🟡 MEDIUM";
                case LOW -> "🔵 LOW";
            };

            log.info("");
            log.info(" {} [{}]", severity, finding.category().key());
            log.info(" Line:     {}", finding.line());
            log.info(" Issue:    {}", finding.issue());
            log.info(" Code:     {}", finding.snippet());
            log.info(" Fix:      {}", finding.remediation());
        }
    }

    private static long count(AnalysisReport report, Severity severity) {
        return report.allFindings().stream().filter(f -> f.severity() == severity).count();
    }

    private static String pad(String text, int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
