package com.agentflow.orchestrator.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Append-only collector for reports produced by concurrent runs. The only
 * mutable state the runs of a batch share.
 */
public class RunResultAccumulator {

    private final ConcurrentLinkedQueue<RunReport> reports = new ConcurrentLinkedQueue<>();

    public void append(RunReport report) {
        reports.add(report);
    }

    public int size() {
        return reports.size();
    }

    /** Copy of everything appended so far, ordered by label then run id. */
    public List<RunReport> snapshot() {
        List<RunReport> copy = new ArrayList<>(reports);
        copy.sort(Comparator.comparing(RunReport::label).thenComparing(RunReport::runId));
        return copy;
    }
}
