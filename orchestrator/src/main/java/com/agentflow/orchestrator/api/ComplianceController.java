package com.agentflow.orchestrator.api;

import com.agentflow.orchestrator.api.dto.EvaluateRequest;
import com.agentflow.orchestrator.api.dto.EvaluateResponse;
import com.agentflow.orchestrator.governance.ComplianceEvaluator;
import com.agentflow.orchestrator.governance.ResultSummarizer;
import com.agentflow.orchestrator.governance.Summary;
import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.workflow.WorkflowDefinitionException;
import com.agentflow.orchestrator.workflow.WorkflowValidator;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Summarize and judge a caller-provided result list, e.g. results that a
 * remote system produced without going through this orchestrator.
 */
@RestController
@RequestMapping("/compliance")
public class ComplianceController {

    private final ResultSummarizer    summarizer;
    private final ComplianceEvaluator evaluator;

    public ComplianceController(ResultSummarizer summarizer, ComplianceEvaluator evaluator) {
        this.summarizer = summarizer;
        this.evaluator  = evaluator;
    }

    @PostMapping("/evaluate")
    public EvaluateResponse evaluate(@RequestBody EvaluateRequest req) {
        try {
            WorkflowValidator.validateThresholds(req.thresholds());
        } catch (WorkflowDefinitionException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        List<AgentResult> results = req.results() == null ? List.of() : req.results();
        for (AgentResult r : results) {
            if (r == null || r.task() == null || r.status() == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "Every result needs a task name and a status");
            }
        }
        Summary summary = summarizer.summarize(results);
        return new EvaluateResponse(summary, evaluator.evaluate(summary, req.thresholds()));
    }
}
