package com.agentflow.orchestrator.workflow;

import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.GovernanceThresholds;
import com.agentflow.orchestrator.model.Policy;
import com.agentflow.orchestrator.model.WorkflowDefinition;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowValidatorTest {

    @Test
    void nullTaskList_rejected() {
        WorkflowDefinition wf = new WorkflowDefinition("wf", null, null, null, null);

        assertThatThrownBy(() -> WorkflowValidator.validate(wf))
                .isInstanceOf(WorkflowDefinitionException.class)
                .hasMessageContaining("'wf'")
                .hasMessageContaining("missing");
    }

    @Test
    void nullTaskInList_rejected() {
        assertThatThrownBy(() -> WorkflowValidator.validateTasks(Arrays.asList(AgentTask.of("a"), null)))
                .isInstanceOf(WorkflowDefinitionException.class)
                .hasMessageContaining("#1");
    }

    @Test
    void blankWorkflowName_rejected() {
        assertThatThrownBy(() -> WorkflowValidator.validate(new WorkflowDefinition(" ", null, null, null, List.of())))
                .isInstanceOf(WorkflowDefinitionException.class);
    }

    @Test
    void rateBounds_inclusive_andNaNRejected() {
        assertThatCode(() -> WorkflowValidator.validateThresholds(new GovernanceThresholds(0.0, 1.0, 0)))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> WorkflowValidator.validateThresholds(new GovernanceThresholds(null, 1.01, null)))
                .hasMessageContaining("maxErrorRate");
        assertThatThrownBy(() -> WorkflowValidator.validateThresholds(new GovernanceThresholds(Double.NaN, null, null)))
                .hasMessageContaining("minSuccessRate");
    }

    @Test
    void negativeTimeoutCeiling_rejected() {
        assertThatThrownBy(() -> WorkflowValidator.validateThresholds(new GovernanceThresholds(null, null, -1)))
                .isInstanceOf(WorkflowDefinitionException.class)
                .hasMessageContaining("maxTimeoutsPerAgent");
    }

    @Test
    void negativeTimingValues_areLegal() {
        Policy policy = new Policy(-1, -1, -1, -1, -1, null);

        assertThatCode(() -> WorkflowValidator.validate(
                new WorkflowDefinition("wf", null, null, policy, List.of(AgentTask.of("noop")))))
                .doesNotThrowAnyException();
    }
}
