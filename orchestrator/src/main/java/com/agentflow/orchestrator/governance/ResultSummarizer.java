package com.agentflow.orchestrator.governance;

import com.agentflow.orchestrator.model.AgentResult;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a flat result list into per-agent and global statistics.
 * Pure: no I/O, no state.
 */
@Component
public class ResultSummarizer {

    public Summary summarize(List<AgentResult> results) {
        Map<String, StatusCounts> perAgent = new LinkedHashMap<>();
        StatusCounts totals = StatusCounts.ZERO;

        for (AgentResult r : results) {
            perAgent.merge(r.task(), StatusCounts.ZERO.plus(r.status()),
                    (existing, ignored) -> existing.plus(r.status()));
            totals = totals.plus(r.status());
        }

        return new Summary(
                Collections.unmodifiableMap(perAgent),
                totals,
                rate(totals.success(), totals.total()),
                rate(totals.error(),   totals.total()),
                rate(totals.timeout(), totals.total()),
                rate(totals.skipped(), totals.total()));
    }

    private static double rate(int count, int total) {
        return total == 0 ? 0.0 : (double) count / total;
    }
}
