package com.agentflow.orchestrator.agent;

import com.agentflow.orchestrator.model.ExecutionContext;

import java.util.Map;

/**
 * Contract every in-process agent satisfies to be schedulable by the local
 * transport.
 *
 * What an agent computes is its own business. The orchestrator only relies
 * on three things:
 * <ul>
 *   <li>{@link #name()} is unique. It doubles as the circuit-breaker
 *       identity and the metrics tag.</li>
 *   <li>{@link #execute} returns an output, or throws to signal failure.
 *       {@link AgentException} is the expected way to report a business
 *       error; any other exception is treated the same way.</li>
 *   <li>{@link #execute} responds to thread interruption, so a timed-out
 *       attempt can be cancelled. Agents that ignore interrupts still time
 *       out, they just keep a pool thread busy until they return.</li>
 * </ul>
 */
public interface Agent {

    String name();

    /** One-line description, logged when the agent is registered. */
    default String description() {
        return "";
    }

    Object execute(Map<String, Object> input, ExecutionContext ctx) throws Exception;
}
