package com.agentflow.orchestrator.transport;

import com.agentflow.orchestrator.engine.OrchestratorCore;
import com.agentflow.orchestrator.engine.RunState;
import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.ExecutionContext;
import com.agentflow.orchestrator.model.Policy;
import com.agentflow.orchestrator.model.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs tasks as hosted backend functions.
 *
 * Hosted functions have no breaker or cache of their own, so the run keeps
 * full local policy state: a function that keeps failing trips the breaker
 * and a repeated task is served from the cache.
 *
 * Without both credentials the run falls back to the local transport
 * instead of failing: a missing remote key must never block a workflow
 * that can run locally.
 */
@Component
public class ManagedTransportAdapter implements TransportAdapter {

    private static final Logger log = LoggerFactory.getLogger(ManagedTransportAdapter.class);

    private final ManagedBackendClient  client;
    private final OrchestratorCore      core;
    private final LocalTransportAdapter local;

    public ManagedTransportAdapter(ManagedBackendClient client,
                                   OrchestratorCore core,
                                   LocalTransportAdapter local) {
        this.client = client;
        this.core   = core;
        this.local  = local;
    }

    @Override
    public Transport transport() {
        return Transport.MANAGED;
    }

    @Override
    public List<AgentResult> execute(List<AgentTask> tasks, ExecutionContext ctx, Policy policy) {
        if (!client.hasCredentials()) {
            log.warn("Run {}: managed backend credentials absent, falling back to local transport", ctx.runId());
            return local.execute(tasks, ctx, policy);
        }
        return core.execute(tasks, ctx, policy, RunState.local(), client::invoke);
    }
}
