package com.agentflow.orchestrator.governance;

import java.util.List;

/**
 * Verdict of a summary against governance thresholds.
 * {@code passed=false} is the signal for CI to fail the build.
 */
public record Compliance(boolean passed, List<String> violations) {

    public Compliance {
        violations = List.copyOf(violations);
    }

    public static Compliance of(List<String> violations) {
        return new Compliance(violations.isEmpty(), violations);
    }
}
