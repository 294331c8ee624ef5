package com.agentflow.orchestrator.transport.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response from POST /tasks/execute.
 *
 * @param status "success" | "error" | "timeout"
 * @param output task output when status is "success"
 * @param error  failure description otherwise
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProtocolTaskResponse(String status, JsonNode output, String error) {}
