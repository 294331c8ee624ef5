package com.agentflow.orchestrator.service;

import com.agentflow.orchestrator.governance.Compliance;
import com.agentflow.orchestrator.governance.Summary;
import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.Policy;
import com.agentflow.orchestrator.model.Transport;

import java.time.Instant;
import java.util.List;

/**
 * The artifact of one workflow run: what ran, how, and how it went.
 * Serialized as-is to the per-run JSON file and the HTTP response.
 *
 * @param repoPath repository the run was applied to, null for label-only runs
 * @param policy   the effective policy (defaults applied)
 */
public record RunReport(
        String            label,
        String            repoPath,
        String            runId,
        Instant           startedAt,
        String            workflow,
        Transport         transport,
        Policy            policy,
        List<AgentTask>   tasks,
        List<AgentResult> results,
        Summary           summary,
        Compliance        compliance) {}
