package com.agentflow.orchestrator.workflow;

public class WorkflowNotFoundException extends RuntimeException {
    public WorkflowNotFoundException(String name) {
        super("No workflow found with name: '" + name + "'");
    }
}
