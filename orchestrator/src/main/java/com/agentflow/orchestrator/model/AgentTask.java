package com.agentflow.orchestrator.model;

import java.util.Map;

/**
 * A named unit of work with structured input; the atomic unit the
 * orchestrator schedules.
 *
 * The name doubles as the agent identity for circuit breaking; the pair
 * (name, input) is the cache identity (see {@code TaskCacheKey}).
 *
 * @param name  agent name, e.g. "echo"
 * @param input JSON-like structured input; never null, deep-copied and
 *              unmodifiable at every level
 */
public record AgentTask(String name, Map<String, Object> input) {

    public AgentTask {
        input = StructuredValues.freezeMap(input);
    }

    public static AgentTask of(String name) {
        return new AgentTask(name, Map.of());
    }
}
