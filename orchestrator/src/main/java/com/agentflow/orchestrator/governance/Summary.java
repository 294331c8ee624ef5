package com.agentflow.orchestrator.governance;

import java.util.Map;

/**
 * Per-agent and global statistics derived from a result list.
 * Always recomputed from scratch, never updated incrementally.
 *
 * Rates are {@code count / totals.total}; all zero when there are no results.
 */
public record Summary(
        Map<String, StatusCounts> perAgent,
        StatusCounts              totals,
        double                    successRate,
        double                    errorRate,
        double                    timeoutRate,
        double                    skippedRate) {
}
