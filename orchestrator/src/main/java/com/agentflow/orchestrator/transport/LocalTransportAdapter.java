package com.agentflow.orchestrator.transport;

import com.agentflow.orchestrator.engine.OrchestratorCore;
import com.agentflow.orchestrator.engine.RunState;
import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.ExecutionContext;
import com.agentflow.orchestrator.model.Policy;
import com.agentflow.orchestrator.model.Transport;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * In-process transport: the orchestrator core with a fresh run state per
 * call, so cache and breaker state never leak between runs.
 */
@Component
public class LocalTransportAdapter implements TransportAdapter {

    private final OrchestratorCore core;

    public LocalTransportAdapter(OrchestratorCore core) {
        this.core = core;
    }

    @Override
    public Transport transport() {
        return Transport.LOCAL;
    }

    @Override
    public List<AgentResult> execute(List<AgentTask> tasks, ExecutionContext ctx, Policy policy) {
        return core.run(tasks, ctx, policy, RunState.local());
    }
}
