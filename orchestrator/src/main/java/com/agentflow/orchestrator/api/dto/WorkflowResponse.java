package com.agentflow.orchestrator.api.dto;

import com.agentflow.orchestrator.model.Transport;
import com.agentflow.orchestrator.model.WorkflowDefinition;

/** Listing entry for GET /workflows. */
public record WorkflowResponse(String name, String description, Transport transport, int taskCount) {

    public static WorkflowResponse from(WorkflowDefinition wf) {
        return new WorkflowResponse(wf.name(), wf.description(), wf.transport(),
                wf.tasks() == null ? 0 : wf.tasks().size());
    }
}
