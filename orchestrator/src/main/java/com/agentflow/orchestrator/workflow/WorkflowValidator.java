package com.agentflow.orchestrator.workflow;

import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.GovernanceThresholds;
import com.agentflow.orchestrator.model.Policy;
import com.agentflow.orchestrator.model.WorkflowDefinition;

import java.util.List;

/**
 * Shape checks for workflows, task lists and policies.
 *
 * Only programmer errors are rejected here. Zero or negative timing values
 * are legal policy values and pass.
 */
public final class WorkflowValidator {

    private WorkflowValidator() {}

    public static void validate(WorkflowDefinition workflow) {
        if (workflow == null) {
            throw new WorkflowDefinitionException("Workflow is null");
        }
        if (workflow.name() == null || workflow.name().isBlank()) {
            throw new WorkflowDefinitionException("Workflow has no name");
        }
        try {
            validateTasks(workflow.tasks());
            validatePolicy(workflow.policy());
        } catch (WorkflowDefinitionException e) {
            throw new WorkflowDefinitionException("Workflow '" + workflow.name() + "': " + e.getMessage(), e);
        }
    }

    public static void validateTasks(List<AgentTask> tasks) {
        if (tasks == null) {
            throw new WorkflowDefinitionException("Task list is missing");
        }
        for (int i = 0; i < tasks.size(); i++) {
            AgentTask task = tasks.get(i);
            if (task == null) {
                throw new WorkflowDefinitionException("Task #" + i + " is null");
            }
            if (task.name() == null || task.name().isBlank()) {
                throw new WorkflowDefinitionException("Task #" + i + " has no name");
            }
        }
    }

    public static void validatePolicy(Policy policy) {
        if (policy == null) {
            return;
        }
        validateThresholds(policy.governance());
    }

    public static void validateThresholds(GovernanceThresholds thresholds) {
        if (thresholds == null) {
            return;
        }
        checkRate("minSuccessRate", thresholds.minSuccessRate());
        checkRate("maxErrorRate", thresholds.maxErrorRate());
        if (thresholds.maxTimeoutsPerAgent() != null && thresholds.maxTimeoutsPerAgent() < 0) {
            throw new WorkflowDefinitionException(
                    "maxTimeoutsPerAgent must be >= 0, got " + thresholds.maxTimeoutsPerAgent());
        }
    }

    private static void checkRate(String field, Double value) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
            throw new WorkflowDefinitionException(field + " must be within [0, 1], got " + value);
        }
    }
}
