package com.vidnyan.cleanup.application.service;

import com.vidnyan.cleanup.agent.AnalysisAgent;
import com.vidnyan.cleanup.analyzer.Analyzer;
import com.vidnyan.cleanup.application.error.AnalysisFailedException;
import com.vidnyan.cleanup.application.error.CleanupException;
import com.vidnyan.cleanup.application.error.ConfigurationException;
import com.vidnyan.cleanup.application.error.ReportUnavailableException;
import com.vidnyan.cleanup.application.port.in.AnalyzeSubmissionUseCase;
import com.vidnyan.cleanup.application.port.out.AnalysisListener;
import com.vidnyan.cleanup.application.port.out.FindingStore;
import com.vidnyan.cleanup.application.port.out.FindingTable;
import com.vidnyan.cleanup.domain.finding.AgentFailure;
import com.vidnyan.cleanup.domain.finding.AnalysisReport;
import com.vidnyan.cleanup.domain.finding.Category;
import com.vidnyan.cleanup.domain.finding.Finding;
import com.vidnyan.cleanup.domain.finding.Submission;
import com.vidnyan.cleanup.domain.finding.SubmissionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Coordinates the four analyzers for one submission.
 *
 * Flow:
 * 1. Register the submission on the primary store (single id source)
 * 2. Fan out: forked (one pooled worker per analyzer, isolated stores) or sequential (primary store)
 * 3. Wait for every analyzer to finish
 * 4. Apply the failure policy
 * 5. Merge all findings into the primary store in category order
 * 6. Record the outcome and assemble the report
 *
 * There is no timeout: a hung analyzer blocks its submission.
 */
@Slf4j
public class Coordinator implements AnalyzeSubmissionUseCase {

    private final StoreTopology topology;
    private final List<Analyzer> analyzers;
    private final FailurePolicy failurePolicy;
    private final AnalysisListener listener;
    private final AsyncTaskExecutor workers;

    public Coordinator(StoreTopology topology, List<Analyzer> analyzers, FailurePolicy failurePolicy,
                       AnalysisListener listener, AsyncTaskExecutor workers) {
        this.topology = topology;
        this.analyzers = inCategoryOrder(analyzers);
        this.failurePolicy = failurePolicy;
        this.listener = listener != null ? listener : AnalysisListener.NONE;
        this.workers = workers;
    }

    public ExecutionMode mode() {
        return topology.mode();
    }

    @Override
    public AnalysisReport submit(String content, String filename) {
        if (content == null) {
            throw new IllegalArgumentException("content is required");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename is required");
        }

        FindingStore primary = topology.primary();
        long submissionId = primary.newSubmissionId(filename, content);
        listener.submissionRegistered(submissionId, filename, mode().key());

        List<AnalysisAgent> agents = analyzers.stream()
                .map(analyzer -> new AnalysisAgent(analyzer, topology.storeFor(analyzer.category())))
                .toList();
        AnalysisAgent.Input input = new AnalysisAgent.Input(submissionId, content, filename);

        List<AgentOutcome> outcomes = mode() == ExecutionMode.FORKED
                ? runForked(agents, input)
                : runSequential(agents, input);

        List<AgentOutcome> failed = outcomes.stream().filter(AgentOutcome::failed).toList();
        List<AgentFailure> failures = failed.stream().map(AgentOutcome::toFailure).toList();
        if (!failed.isEmpty() && failurePolicy == FailurePolicy.ALL_OR_NOTHING) {
            AnalysisFailedException error = new AnalysisFailedException(submissionId, failures, failed.get(0).error());
            recordAborted(primary, error);
            listener.analysisAborted(submissionId, error);
            throw error;
        }

        Map<Category, List<Finding>> collected = new EnumMap<>(Category.class);
        for (AgentOutcome outcome : outcomes) {
            if (!outcome.failed()) {
                collected.put(outcome.category(), outcome.findings());
            }
        }

        merge(submissionId, collected);
        primary.recordOutcome(submissionId,
                failures.isEmpty() ? SubmissionStatus.COMPLETED : SubmissionStatus.PARTIAL, failures);

        AnalysisReport report = AnalysisReport.assemble(submissionId, filename, mode().key(), collected, failures);
        listener.analysisCompleted(report);
        return report;
    }

    @Override
    public Optional<AnalysisReport> report(long submissionId) {
        FindingStore primary = topology.primary();
        return primary.findSubmission(submissionId).map(submission -> rebuild(primary, submission));
    }

    private AnalysisReport rebuild(FindingStore primary, Submission submission) {
        long submissionId = submission.id();
        if (!submission.status().hasReport()) {
            throw new ReportUnavailableException(submissionId, submission.status(), primary.findFailures(submissionId));
        }
        primary.ensureSchema(FindingTable.MERGED_FINDINGS);
        Map<Category, List<Finding>> grouped = new EnumMap<>(Category.class);
        for (Finding finding : primary.findFindings(FindingTable.MERGED_FINDINGS, submissionId)) {
            grouped.computeIfAbsent(finding.category(), c -> new ArrayList<>()).add(finding);
        }
        List<AgentFailure> failures = submission.status() == SubmissionStatus.PARTIAL
                ? primary.findFailures(submissionId)
                : List.of();
        return AnalysisReport.assemble(submissionId, submission.filename(), "stored", grouped, failures);
    }

    /**
     * A store error here must not replace the analyzer failure the caller is about to receive.
     */
    private void recordAborted(FindingStore primary, AnalysisFailedException error) {
        try {
            primary.recordOutcome(error.getSubmissionId(), SubmissionStatus.ABORTED, error.getFailures());
        } catch (CleanupException e) {
            log.warn("Could not record abort of submission #{}: {}", error.getSubmissionId(), e.getMessage());
            error.addSuppressed(e);
        }
    }

    private List<AgentOutcome> runSequential(List<AnalysisAgent> agents, AnalysisAgent.Input input) {
        List<AgentOutcome> outcomes = new ArrayList<>();
        for (AnalysisAgent agent : agents) {
            AgentOutcome outcome = run(agent, input);
            outcomes.add(outcome);
            if (outcome.failed() && failurePolicy == FailurePolicy.ALL_OR_NOTHING) {
                log.debug("Stopping sequential run of submission #{} after {} failed",
                        input.submissionId(), agent.getName());
                break;
            }
        }
        return outcomes;
    }

    private List<AgentOutcome> runForked(List<AnalysisAgent> agents, AnalysisAgent.Input input) {
        List<Future<AgentOutcome>> futures = new ArrayList<>();
        for (AnalysisAgent agent : agents) {
            futures.add(workers.submit(() -> run(agent, input)));
        }

        // Joined in category order; completion order does not matter.
        List<AgentOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < agents.size(); i++) {
            outcomes.add(await(futures.get(i), agents.get(i), input.submissionId()));
        }
        return outcomes;
    }

    private AgentOutcome await(Future<AgentOutcome> future, AnalysisAgent agent, long submissionId) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CleanupException("Interrupted while waiting for analyzers of submission #" + submissionId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            listener.agentFailed(submissionId, agent.category(), agent.storeName(), cause);
            return AgentOutcome.failure(agent.category(), agent.storeName(), cause);
        }
    }

    private AgentOutcome run(AnalysisAgent agent, AnalysisAgent.Input input) {
        long submissionId = input.submissionId();
        listener.agentStarted(submissionId, agent.category(), agent.storeName());
        Instant start = Instant.now();
        try {
            AnalysisAgent.Output output = agent.execute(input);
            listener.agentFinished(submissionId, agent.category(), agent.storeName(),
                    output.persisted(), Duration.between(start, Instant.now()));
            return AgentOutcome.success(agent.category(), agent.storeName(), output.findings());
        } catch (RuntimeException e) {
            listener.agentFailed(submissionId, agent.category(), agent.storeName(), e);
            return AgentOutcome.failure(agent.category(), agent.storeName(), e);
        }
    }

    /**
     * Tag every finding with its category and append it to the primary store's merged record,
     * in category order regardless of which analyzer finished first.
     */
    private void merge(long submissionId, Map<Category, List<Finding>> collected) {
        List<Finding> merged = new ArrayList<>();
        for (Category category : Category.values()) {
            merged.addAll(collected.getOrDefault(category, List.of()));
        }
        FindingStore primary = topology.primary();
        primary.ensureSchema(FindingTable.MERGED_FINDINGS);
        int written = primary.insert(FindingTable.MERGED_FINDINGS, submissionId, merged);
        listener.findingsMerged(submissionId, written);
    }

    private static List<Analyzer> inCategoryOrder(List<Analyzer> analyzers) {
        EnumSet<Category> seen = EnumSet.noneOf(Category.class);
        for (Analyzer analyzer : analyzers) {
            if (!seen.add(analyzer.category())) {
                throw new ConfigurationException("More than one analyzer registered for " + analyzer.category());
            }
        }
        if (seen.size() != Category.values().length) {
            throw new ConfigurationException("No analyzer registered for " + EnumSet.complementOf(seen));
        }
        return analyzers.stream()
                .sorted(Comparator.comparing(Analyzer::category))
                .toList();
    }
}
