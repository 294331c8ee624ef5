package com.agentflow.orchestrator.service;

import com.agentflow.orchestrator.governance.ComplianceEvaluator;
import com.agentflow.orchestrator.governance.ResultSummarizer;
import com.agentflow.orchestrator.governance.Summary;
import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.model.GovernanceThresholds;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Writes run artifacts as pretty-printed JSON.
 *
 * Persistence is best effort: a failed write is logged and reported as an
 * empty Optional, never thrown. Whether a run is acceptable is decided by
 * its compliance, not by whether its file could be written.
 */
@Component
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper        json;
    private final ResultSummarizer    summarizer;
    private final ComplianceEvaluator evaluator;

    public ReportWriter(ObjectMapper objectMapper,
                        ResultSummarizer summarizer,
                        ComplianceEvaluator evaluator) {
        this.json       = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.summarizer = summarizer;
        this.evaluator  = evaluator;
    }

    /** Write one run's report to {@code file}; returns the file on success. */
    public Optional<Path> write(RunReport report, Path file) {
        return writeJson(report, file);
    }

    /** Write a batch aggregate as {@code global-<workflow>.json} in {@code dir}. */
    public Optional<Path> writeAggregate(AggregateReport aggregate, Path dir) {
        return writeJson(aggregate, dir.resolve("global-" + fileSafe(aggregate.workflow()) + ".json"));
    }

    /** Merge all reports of one workflow; summary and compliance are recomputed over the merged results. */
    public AggregateReport aggregate(String workflow, List<RunReport> reports, GovernanceThresholds thresholds) {
        List<AgentResult> merged = reports.stream()
                .flatMap(r -> r.results().stream())
                .toList();
        Summary summary = summarizer.summarize(merged);
        return new AggregateReport(workflow,
                reports.stream().map(RunReport::runId).toList(),
                merged, summary, evaluator.evaluate(summary, thresholds));
    }

    private Optional<Path> writeJson(Object value, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            json.writeValue(file.toFile(), value);
            log.info("Wrote {}", file);
            return Optional.of(file);
        } catch (Exception e) {
            log.warn("Could not write report {}, continuing without it: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /** Turns a label or path into a single safe file-name segment. */
    public static String fileSafe(String s) {
        String cleaned = s.replaceAll("[^A-Za-z0-9._-]+", "_").replaceAll("^_+|_+$", "");
        return cleaned.isEmpty() ? "run" : cleaned;
    }
}
