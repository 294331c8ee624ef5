package com.agentflow.orchestrator.transport;

import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.ExecutionContext;
import com.agentflow.orchestrator.model.Policy;
import com.agentflow.orchestrator.model.Transport;

import java.util.List;

/**
 * Execution strategy for a workflow's task list.
 *
 * Every implementation returns one result per task, in task order, in the
 * same shape as the local core, so callers never branch on transport. Task
 * and transport failures come back as data; {@link #execute} only throws
 * for malformed input.
 */
public interface TransportAdapter {

    Transport transport();

    List<AgentResult> execute(List<AgentTask> tasks, ExecutionContext ctx, Policy policy);
}
