package com.agentflow.orchestrator.service;

import com.agentflow.orchestrator.governance.Compliance;
import com.agentflow.orchestrator.governance.Summary;
import com.agentflow.orchestrator.model.AgentResult;

import java.util.List;

/**
 * Results of every run of one workflow in a batch, merged, with summary and
 * compliance recomputed over the merged list.
 *
 * @param runs run ids that contributed, in label order
 */
public record AggregateReport(
        String            workflow,
        List<String>      runs,
        List<AgentResult> results,
        Summary           summary,
        Compliance        compliance) {}
