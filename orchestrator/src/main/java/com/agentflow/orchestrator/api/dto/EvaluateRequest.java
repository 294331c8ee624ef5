package com.agentflow.orchestrator.api.dto;

import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.model.GovernanceThresholds;

import java.util.List;

/** Request body for POST /compliance/evaluate. */
public record EvaluateRequest(List<AgentResult> results, GovernanceThresholds thresholds) {}
