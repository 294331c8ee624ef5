package com.agentflow.orchestrator.engine;

import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.ExecutionContext;

/**
 * One attempt at executing one task, as seen by {@link OrchestratorCore}.
 *
 * Outcome mapping:
 * <ul>
 *   <li>return value: success, the value becomes the task output</li>
 *   <li>{@link java.util.concurrent.TimeoutException}: the attempt timed out
 *       on the far side (the core enforces its own deadline as well)</li>
 *   <li>{@link TransportException}: the transport is unusable, the run is
 *       over</li>
 *   <li>any other exception: application error</li>
 * </ul>
 */
@FunctionalInterface
public interface AgentInvoker {

    /**
     * @param timeoutMs the policy deadline for this attempt, {@code <= 0} when unbounded;
     *                  remote invokers forward it as their request timeout
     */
    Object invoke(AgentTask task, ExecutionContext ctx, long timeoutMs) throws Exception;
}
