package com.agentflow.orchestrator.model;

/**
 * Terminal result of one agent task within one run. Exactly one is
 * produced per task, including skipped tasks.
 *
 * @param task         agent name of the task
 * @param status       terminal outcome
 * @param output       agent output on success, null otherwise
 * @param errorMessage failure description for ERROR / TIMEOUT / SKIPPED
 * @param attempts     attempts actually made; 0 for cached and skipped results
 * @param durationMs   wall-clock time spent on the task, backoff included
 */
public record AgentResult(
        String     task,
        TaskStatus status,
        Object     output,
        String     errorMessage,
        int        attempts,
        long       durationMs) {

    public static AgentResult success(String task, Object output, int attempts, long durationMs) {
        return new AgentResult(task, TaskStatus.SUCCESS, output, null, attempts, durationMs);
    }

    public static AgentResult failure(String task, TaskStatus status, String message,
                                      int attempts, long durationMs) {
        return new AgentResult(task, status, null, message, attempts, durationMs);
    }

    public static AgentResult skipped(String task, String reason) {
        return new AgentResult(task, TaskStatus.SKIPPED, null, reason, 0, 0L);
    }
}
