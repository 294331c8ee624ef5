package com.agentflow.orchestrator.api.dto;

import com.agentflow.orchestrator.governance.Compliance;
import com.agentflow.orchestrator.governance.Summary;

public record EvaluateResponse(Summary summary, Compliance compliance) {}
