package com.agentflow.orchestrator.governance;

import com.agentflow.orchestrator.model.TaskStatus;

/**
 * Outcome counts for one agent, or for a whole run.
 */
public record StatusCounts(int total, int success, int error, int timeout, int skipped) {

    public static final StatusCounts ZERO = new StatusCounts(0, 0, 0, 0, 0);

    public StatusCounts plus(TaskStatus status) {
        return switch (status) {
            case SUCCESS -> new StatusCounts(total + 1, success + 1, error, timeout, skipped);
            case ERROR   -> new StatusCounts(total + 1, success, error + 1, timeout, skipped);
            case TIMEOUT -> new StatusCounts(total + 1, success, error, timeout + 1, skipped);
            case SKIPPED -> new StatusCounts(total + 1, success, error, timeout, skipped + 1);
        };
    }
}
