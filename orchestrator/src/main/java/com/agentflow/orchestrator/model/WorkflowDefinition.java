package com.agentflow.orchestrator.model;

import java.util.List;

/**
 * A named, ordered list of agent tasks plus the transport and policy used
 * to run them. Loaded once per invocation and read-only afterwards.
 */
public record WorkflowDefinition(
        String          name,
        String          description,
        Transport       transport,
        Policy          policy,
        List<AgentTask> tasks) {

    public WorkflowDefinition {
        transport = transport != null ? transport : Transport.LOCAL;
        policy    = policy    != null ? policy    : Policy.empty();
        tasks     = tasks     != null ? List.copyOf(tasks) : null;
    }

    /** Same workflow, different name (used when the file omits "name"). */
    public WorkflowDefinition named(String newName) {
        return new WorkflowDefinition(newName, description, transport, policy, tasks);
    }
}
