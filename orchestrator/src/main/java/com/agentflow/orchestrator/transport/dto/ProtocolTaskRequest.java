package com.agentflow.orchestrator.transport.dto;

import java.util.Map;

/**
 * Body of POST /tasks/execute on the agent-protocol service.
 * {@code timeoutMs} is a hint; the orchestrator enforces its own deadline.
 */
public record ProtocolTaskRequest(
        String              runId,
        String              task,
        Map<String, Object> input,
        long                timeoutMs) {}
