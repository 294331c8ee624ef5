package com.agentflow.orchestrator.workflow;

/**
 * A workflow or policy is malformed. Raised before any task executes.
 */
public class WorkflowDefinitionException extends RuntimeException {

    public WorkflowDefinitionException(String message) {
        super(message);
    }

    public WorkflowDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
