package com.agentflow.orchestrator.api;

import com.agentflow.orchestrator.api.dto.RunRequest;
import com.agentflow.orchestrator.api.dto.WorkflowResponse;
import com.agentflow.orchestrator.model.WorkflowDefinition;
import com.agentflow.orchestrator.service.RunReport;
import com.agentflow.orchestrator.service.WorkflowRunService;
import com.agentflow.orchestrator.workflow.WorkflowDefinitionException;
import com.agentflow.orchestrator.workflow.WorkflowLoader;
import com.agentflow.orchestrator.workflow.WorkflowNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for workflows.
 *
 * GET  /workflows             : list loadable workflows
 * GET  /workflows/{name}      : full definition
 * POST /workflows/{name}/runs : run it now and return the report
 */
@RestController
@RequestMapping("/workflows")
public class WorkflowController {

    private final WorkflowLoader     loader;
    private final WorkflowRunService runService;

    public WorkflowController(WorkflowLoader loader, WorkflowRunService runService) {
        this.loader     = loader;
        this.runService = runService;
    }

    @GetMapping
    public List<WorkflowResponse> list() {
        return loader.all().values().stream()
                .map(WorkflowResponse::from)
                .toList();
    }

    @GetMapping("/{name}")
    public WorkflowDefinition get(@PathVariable String name) {
        return load(name);
    }

    /**
     * Run a workflow synchronously.
     *
     * Always 201 once the run happened, even if every task failed: the
     * verdict is in the report's compliance block.
     *
     * Example:
     *   curl -X POST http://localhost:8080/workflows/smoke/runs \
     *     -H "Content-Type: application/json" -d '{"label":"nightly"}'
     */
    @PostMapping("/{name}/runs")
    public ResponseEntity<RunReport> run(@PathVariable String name,
                                         @RequestBody(required = false) RunRequest req) {
        WorkflowDefinition workflow = load(name);
        String label = (req == null || req.label() == null || req.label().isBlank()) ? "api" : req.label();
        String repoPath = req == null ? null : req.repoPath();
        RunReport report = runService.run(workflow, label, repoPath);
        return ResponseEntity.status(HttpStatus.CREATED).body(report);
    }

    private WorkflowDefinition load(String name) {
        try {
            return loader.load(name);
        } catch (WorkflowNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        } catch (WorkflowDefinitionException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }
}
