package com.agentflow.orchestrator.service;

import com.agentflow.orchestrator.governance.Compliance;
import com.agentflow.orchestrator.governance.ComplianceEvaluator;
import com.agentflow.orchestrator.governance.ResultSummarizer;
import com.agentflow.orchestrator.governance.Summary;
import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.model.ExecutionContext;
import com.agentflow.orchestrator.model.Policy;
import com.agentflow.orchestrator.model.WorkflowDefinition;
import com.agentflow.orchestrator.transport.TransportAdapter;
import com.agentflow.orchestrator.transport.TransportAdapterRegistry;
import com.agentflow.orchestrator.workflow.WorkflowValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * One workflow run, end to end:
 *
 *   workflow → fresh ExecutionContext → transport adapter → results
 *            → summary → compliance → {@link RunReport}
 *
 * Task failures never make this throw; only a malformed workflow does, and
 * it does so before any task executes.
 */
@Service
public class WorkflowRunService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunService.class);

    private final TransportAdapterRegistry adapters;
    private final ResultSummarizer         summarizer;
    private final ComplianceEvaluator      evaluator;
    private final Policy                   defaults;
    private final Clock                    clock;

    public WorkflowRunService(TransportAdapterRegistry adapters,
                              ResultSummarizer summarizer,
                              ComplianceEvaluator evaluator,
                              Policy defaultPolicy,
                              Clock clock) {
        this.adapters   = adapters;
        this.summarizer = summarizer;
        this.evaluator  = evaluator;
        this.defaults   = defaultPolicy;
        this.clock      = clock;
    }

    public RunReport run(WorkflowDefinition workflow, String label) {
        return run(workflow, label, null);
    }

    /**
     * @param label    correlation label for the run id
     * @param repoPath repository the workflow is applied to, may be null
     */
    public RunReport run(WorkflowDefinition workflow, String label, String repoPath) {
        WorkflowValidator.validate(workflow);

        Policy policy = workflow.policy().withDefaults(defaults);
        ExecutionContext ctx = ExecutionContext.create(label, clock);
        TransportAdapter adapter = adapters.forTransport(workflow.transport());

        log.info("Run {}: workflow '{}' via {} transport ({} task(s))",
                ctx.runId(), workflow.name(), workflow.transport().wireName(), workflow.tasks().size());

        List<AgentResult> results = adapter.execute(workflow.tasks(), ctx, policy);
        Summary summary = summarizer.summarize(results);
        Compliance compliance = evaluator.evaluate(summary, policy.governanceOrNone());

        if (compliance.passed()) {
            log.info("Run {}: compliant (success rate {})", ctx.runId(), summary.successRate());
        } else {
            log.warn("Run {}: NOT compliant: {}", ctx.runId(), compliance.violations());
        }

        return new RunReport(ctx.label(), repoPath, ctx.runId(), ctx.startedAt(),
                workflow.name(), workflow.transport(), policy, workflow.tasks(),
                results, summary, compliance);
    }
}
