package com.vidnyan.cleanup.agent;

import com.vidnyan.cleanup.agent.core.Agent;
import com.vidnyan.cleanup.analyzer.Analyzer;
import com.vidnyan.cleanup.application.error.AnalyzerLogicException;
import com.vidnyan.cleanup.application.error.CleanupException;
import com.vidnyan.cleanup.application.port.out.FindingStore;
import com.vidnyan.cleanup.application.port.out.FindingTable;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Runs one analyzer and persists its findings to the store it was built with,
 * either the primary store or the category's isolated fork.
 */
@Slf4j
public class AnalysisAgent implements Agent<AnalysisAgent.Input, AnalysisAgent.Output> {

    private final Analyzer analyzer;
    private final FindingStore store;

    public AnalysisAgent(Analyzer analyzer, FindingStore store) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public String getName() {
        return analyzer.category().key() + "@" + store.name();
    }

    public Category category() {
        return analyzer.category();
    }

    public String storeName() {
        return store.name();
    }

    @Override
    public Output execute(Input input) {
        List<Finding> findings = analyze(input);
        int persisted = persist(findings, input.submissionId());
        log.debug("{} persisted {} findings for submission #{}", getName(), persisted, input.submissionId());
        return new Output(category(), persisted, findings);
    }

    /**
     * Pure analysis step. Unexpected analyzer failures surface as {@link AnalyzerLogicException}.
     */
    public List<Finding> analyze(Input input) {
        try {
            return analyzer.analyze(input.content(), input.filename());
        } catch (CleanupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalyzerLogicException(category(), e.getMessage(), e);
        }
    }

    /**
     * Create the category table if absent and append the findings.
     * Not idempotent at row level: calling twice for the same submission stores duplicates.
     * @return number of rows written
     */
    public int persist(List<Finding> findings, long submissionId) {
        FindingTable table = FindingTable.forCategory(category());
        store.ensureSchema(table);
        return store.insert(table, submissionId, findings);
    }

    public record Input(long submissionId, String content, String filename) {
    }

    public record Output(Category category, int persisted, List<Finding> findings) {
    }
}
