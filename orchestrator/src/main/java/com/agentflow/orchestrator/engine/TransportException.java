package com.agentflow.orchestrator.engine;

/**
 * Thrown by an {@link AgentInvoker} when the transport itself failed
 * (connection refused, authentication rejected, endpoint missing) rather
 * than the task.
 *
 * The core never lets it escape a run: the failing task and every task
 * after it are recorded as {@code status=error}.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
