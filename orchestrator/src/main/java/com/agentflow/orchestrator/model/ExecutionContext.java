package com.agentflow.orchestrator.model;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Per-run identity threaded through every task invocation for correlation.
 *
 * A context is created fresh for each workflow run and never reused; cache
 * and circuit-breaker state is attributed to exactly one context.
 *
 * @param runId     label-derived, unique per invocation
 * @param label     human label (repository path, "api", ...)
 * @param startedAt when the run began
 */
public record ExecutionContext(String runId, String label, Instant startedAt) {

    public static ExecutionContext create(String label, Clock clock) {
        String safeLabel = (label == null || label.isBlank()) ? "run" : label;
        Instant now = clock.instant();
        String suffix = Integer.toHexString(ThreadLocalRandom.current().nextInt(0x100000, 0x1000000));
        return new ExecutionContext(slug(safeLabel) + "-" + now.toEpochMilli() + "-" + suffix,
                safeLabel, now);
    }

    private static String slug(String label) {
        String s = label.replaceAll("[^A-Za-z0-9._-]+", "-").replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "run" : s;
    }
}
