package com.vidnyan.cleanup.agent;

import com.vidnyan.cleanup.adapter.out.store.JdbcFindingStoreFactory;
import com.vidnyan.cleanup.analyzer.Analyzer;
import com.vidnyan.cleanup.analyzer.security.SecurityAnalyzer;
import com.vidnyan.cleanup.application.error.AnalyzerLogicException;
import com.vidnyan.cleanup.application.port.out.FindingStore;
import com.vidnyan.cleanup.application.port.out.FindingTable;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisAgentTest {

    private FindingStore store;

    @BeforeEach
    void openStore() {
        store = new JdbcFindingStoreFactory(null, null, Duration.ofSeconds(2), 2)
                .create("security-fork", "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    }

    @AfterEach
    void closeStore() {
        store.close();
    }

    @Test
    void execute_ShouldAnalyzeAndPersistToItsStore() {
        AnalysisAgent agent = new AnalysisAgent(new SecurityAnalyzer(), store);
        long id = store.newSubmissionId("creds.py", "password = \"admin123\"\n");

        AnalysisAgent.Output output = agent.execute(
                new AnalysisAgent.Input(id, "password = \"admin123\"\n", "creds.py"));

        assertEquals("security@security-fork", agent.getName());
        assertEquals(Category.SECURITY, output.category());
        assertEquals(1, output.persisted());
        assertEquals(output.findings(), store.findFindings(FindingTable.SECURITY_FINDINGS, id));
    }

    @Test
    void persistTwice_ShouldStoreDuplicates() {
        AnalysisAgent agent = new AnalysisAgent(new SecurityAnalyzer(), store);
        AnalysisAgent.Input input = new AnalysisAgent.Input(5, "token = \"t\"\n", "t.py");
        List<Finding> findings = agent.analyze(input);

        agent.persist(findings, 5);
        agent.persist(findings, 5);

        assertEquals(2, store.findFindings(FindingTable.SECURITY_FINDINGS, 5).size());
    }

    @Test
    void analyzerCrash_ShouldSurfaceAsLogicError() {
        Analyzer crashing = new Analyzer() {
            @Override
            public Category category() {
                return Category.PERFORMANCE;
            }

            @Override
            public List<Finding> analyze(String text, String filename) {
                throw new IndexOutOfBoundsException("line 0");
            }
        };
        AnalysisAgent agent = new AnalysisAgent(crashing, store);

        AnalyzerLogicException error = assertThrows(AnalyzerLogicException.class,
                () -> agent.execute(new AnalysisAgent.Input(1, "x", "x.py")));

        assertEquals(Category.PERFORMANCE, error.getCategory());
        assertInstanceOf(IndexOutOfBoundsException.class, error.getCause());
    }
}
