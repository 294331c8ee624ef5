package com.agentflow.orchestrator.api.dto;

/**
 * Request body for POST /workflows/{name}/runs.
 *
 * @param label    correlation label for the run id; defaults to "api"
 * @param repoPath optional repository the run is applied to
 */
public record RunRequest(String label, String repoPath) {}
