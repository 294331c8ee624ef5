package com.agentflow.orchestrator.transport;

import com.agentflow.orchestrator.agent.AgentException;
import com.agentflow.orchestrator.engine.OrchestratorCore;
import com.agentflow.orchestrator.engine.RunState;
import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.ExecutionContext;
import com.agentflow.orchestrator.model.Policy;
import com.agentflow.orchestrator.model.Transport;
import com.agentflow.orchestrator.transport.dto.ProtocolTaskRequest;
import com.agentflow.orchestrator.transport.dto.ProtocolTaskResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Delegates task execution to the external agent-protocol service.
 *
 * Timeout, retry and backoff come from the workflow policy and are applied
 * here through the core. Caching and circuit breaking are the remote
 * side's business, so the run state has both disabled. If the service
 * retries internally, those retries are invisible: only the status this
 * side observes ends up in the result.
 */
@Component
public class ProtocolTransportAdapter implements TransportAdapter {

    private static final Logger log = LoggerFactory.getLogger(ProtocolTransportAdapter.class);

    private final ProtocolClient   client;
    private final OrchestratorCore core;

    public ProtocolTransportAdapter(ProtocolClient client, OrchestratorCore core) {
        this.client = client;
        this.core   = core;
    }

    @Override
    public Transport transport() {
        return Transport.PROTOCOL;
    }

    @Override
    public List<AgentResult> execute(List<AgentTask> tasks, ExecutionContext ctx, Policy policy) {
        if (!client.isConfigured()) {
            log.error("Run {}: protocol transport selected but no service is configured", ctx.runId());
        }
        return core.execute(tasks, ctx, policy, RunState.remote(), this::dispatch);
    }

    private Object dispatch(AgentTask task, ExecutionContext ctx, long timeoutMs) throws TimeoutException {
        ProtocolTaskResponse resp = client.execute(
                new ProtocolTaskRequest(ctx.runId(), task.name(), task.input(), timeoutMs));

        String status = resp.status() == null ? "" : resp.status().trim().toLowerCase();
        return switch (status) {
            case "success" -> resp.output();
            case "timeout" -> throw new TimeoutException(
                    resp.error() != null ? resp.error() : "Remote agent '" + task.name() + "' timed out");
            case "error"   -> throw new AgentException(
                    resp.error() != null ? resp.error() : "Remote agent '" + task.name() + "' failed");
            default        -> throw new AgentException(
                    "Unrecognised protocol status '" + resp.status() + "' for '" + task.name() + "'");
        };
    }
}
