package com.agentflow.orchestrator.agent;

/**
 * Thrown by an agent when it ran but produced a business error.
 * Recorded as {@code status=error}; retried while attempts remain.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
