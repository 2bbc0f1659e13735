package com.vidnyan.cleanup.adapter.in.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.vidnyan.cleanup.adapter.out.store.JdbcFindingStoreFactory;
import com.vidnyan.cleanup.analyzer.bestpractices.BestPracticesAnalyzer;
import com.vidnyan.cleanup.analyzer.performance.PerformanceAnalyzer;
import com.vidnyan.cleanup.analyzer.quality.CodeQualityAnalyzer;
import com.vidnyan.cleanup.analyzer.security.SecurityAnalyzer;
import com.vidnyan.cleanup.application.port.out.AnalysisListener;
import com.vidnyan.cleanup.application.service.Coordinator;
import com.vidnyan.cleanup.application.service.FailurePolicy;
import com.vidnyan.cleanup.application.service.StoreSettings;
import com.vidnyan.cleanup.application.service.StoreTopology;
import com.vidnyan.cleanup.config.CleanupConfiguration;
import com.vidnyan.cleanup.config.CleanupProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.support.GenericApplicationContext;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisCliRunnerTest {

    @TempDir
    Path tempDir;

    private StoreTopology topology;
    private ThreadPoolTaskExecutor workers;
    private Coordinator coordinator;
    private GenericApplicationContext context;

    @BeforeEach
    void setUp() {
        topology = StoreTopology.from(
                StoreSettings.primaryOnly("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1"),
                new JdbcFindingStoreFactory(null, null, Duration.ofSeconds(2), 2));
        workers = new CleanupConfiguration().analysisExecutor();
        workers.initialize();
        coordinator = new Coordinator(topology, List.of(new SecurityAnalyzer(), new CodeQualityAnalyzer(),
                new PerformanceAnalyzer(), new BestPracticesAnalyzer()), FailurePolicy.ALL_OR_NOTHING,
                AnalysisListener.NONE, workers);
        context = new GenericApplicationContext();
        context.refresh();
    }

    @AfterEach
    void tearDown() {
        workers.shutdown();
        topology.close();
    }

    @Test
    void run_ShouldAnalyzeFileAndWriteJsonReport() throws Exception {
        Path source = tempDir.resolve("creds.py");
        Files.writeString(source, "password = \"admin123\"\n");
        Path report = tempDir.resolve("report.json");

        CleanupProperties properties = new CleanupProperties();
        properties.getAnalyze().setPath(source.toString());
        properties.getAnalyze().setReportJson(report.toString());
        CleanupConfiguration configuration = new CleanupConfiguration();

        new AnalysisCliRunner(coordinator, properties, configuration.objectMapper(), context).run();

        assertTrue(Files.exists(report));
        JsonNode json = configuration.objectMapper().readTree(report.toFile());
        assertEquals("creds.py", json.get("filename").asText());
        assertEquals(1, json.get("security").get("count").asInt());
        assertEquals("Hardcoded password", json.get("security").get("issues").get(0).get("issue").asText());
        assertFalse(context.isActive(), "runner should shut the application down");
    }

    @Test
    void run_WithoutPath_ShouldDoNothing() throws Exception {
        new AnalysisCliRunner(coordinator, new CleanupProperties(),
                new CleanupConfiguration().objectMapper(), context).run();

        assertTrue(context.isActive());
    }
}
