package com.agentflow.orchestrator.service;

import com.agentflow.orchestrator.model.WorkflowDefinition;
import com.agentflow.orchestrator.workflow.WorkflowValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Applies one workflow to many repositories ("apply-all").
 *
 * Each repository is an independent run with its own ExecutionContext and
 * run state, executed on a fixed pool so at most {@code workers} runs are
 * in flight. Runs share nothing but the append-only
 * {@link RunResultAccumulator}.
 *
 * Once every run is done, per-run reports and the global aggregate are
 * written (unless dry-run). A run that blew up is rethrown after the others
 * have finished.
 */
@Service
public class BatchRunService {

    private static final Logger log = LoggerFactory.getLogger(BatchRunService.class);

    /** What a batch produced; paths are empty on dry-run or failed writes. */
    public record BatchOutcome(List<RunReport> reports,
                               AggregateReport aggregate,
                               List<Path> written) {}

    private final WorkflowRunService runService;
    private final ReportWriter       writer;
    private final int                defaultWorkers;

    public BatchRunService(WorkflowRunService runService,
                           ReportWriter writer,
                           @Value("${agentflow.batch.workers:4}") int defaultWorkers) {
        this.runService     = runService;
        this.writer         = writer;
        this.defaultWorkers = defaultWorkers;
    }

    public int defaultWorkers() {
        return defaultWorkers;
    }

    public BatchOutcome runAll(WorkflowDefinition workflow,
                               List<Path> repositories,
                               int workers,
                               Path outDir,
                               boolean dryRun) {
        WorkflowValidator.validate(workflow);
        int poolSize = Math.max(1, Math.min(workers > 0 ? workers : defaultWorkers, Math.max(repositories.size(), 1)));
        log.info("Applying workflow '{}' to {} repositor(ies) with {} worker(s){}",
                workflow.name(), repositories.size(), poolSize, dryRun ? " [dry-run]" : "");

        RunResultAccumulator accumulator = new RunResultAccumulator();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        try {
            List<Callable<RunReport>> jobs = new ArrayList<>();
            for (Path repo : repositories) {
                jobs.add(() -> {
                    RunReport report = runService.run(workflow, repo.toString(), repo.toString());
                    accumulator.append(report);
                    return report;
                });
            }
            List<Future<RunReport>> futures = pool.invokeAll(jobs);
            rethrowFirstFailure(futures, repositories);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while applying workflow '" + workflow.name() + "'", e);
        } finally {
            pool.shutdownNow();
        }

        List<RunReport> reports = accumulator.snapshot();
        AggregateReport aggregate = writer.aggregate(workflow.name(), reports,
                workflow.policy().governance());

        List<Path> written = new ArrayList<>();
        if (!dryRun) {
            for (RunReport report : reports) {
                Path file = outDir.resolve(ReportWriter.fileSafe(report.label()) + ".json");
                writer.write(report, file).ifPresent(written::add);
            }
            writer.writeAggregate(aggregate, outDir).ifPresent(written::add);
        }
        return new BatchOutcome(reports, aggregate, written);
    }

    private static void rethrowFirstFailure(List<Future<RunReport>> futures, List<Path> repositories)
            throws InterruptedException {
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Run for {} failed: {}", repositories.get(i), cause.getMessage(), cause);
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                throw new IllegalStateException("Run for " + repositories.get(i) + " failed", cause);
            }
        }
    }
}
