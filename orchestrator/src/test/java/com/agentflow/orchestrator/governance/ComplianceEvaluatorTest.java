package com.agentflow.orchestrator.governance;

import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.model.GovernanceThresholds;
import com.agentflow.orchestrator.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComplianceEvaluatorTest {

    final ResultSummarizer    summarizer = new ResultSummarizer();
    final ComplianceEvaluator evaluator  = new ComplianceEvaluator();

    // 2 success, 1 error, 1 timeout on "slow"
    final Summary mixed = summarizer.summarize(List.of(
            AgentResult.success("fast", 1, 1, 1),
            AgentResult.success("fast", 2, 1, 1),
            AgentResult.failure("broken", TaskStatus.ERROR, "boom", 1, 1),
            AgentResult.failure("slow", TaskStatus.TIMEOUT, "late", 1, 1)));

    @Test
    void nullThresholds_pass() {
        Compliance c = evaluator.evaluate(mixed, null);

        assertThat(c.passed()).isTrue();
        assertThat(c.violations()).isEmpty();
    }

    @Test
    void absentThresholds_areNeverChecked() {
        assertThat(evaluator.evaluate(mixed, GovernanceThresholds.none()).passed()).isTrue();
    }

    @Test
    void successRateBelowMinimum_isAViolation() {
        Compliance c = evaluator.evaluate(mixed, new GovernanceThresholds(0.9, null, null));

        assertThat(c.passed()).isFalse();
        assertThat(c.violations()).containsExactly("success rate 0.500 is below the minimum 0.900");
    }

    @Test
    void successRateEqualToMinimum_passes() {
        assertThat(evaluator.evaluate(mixed, new GovernanceThresholds(0.5, null, null)).passed()).isTrue();
    }

    @Test
    void errorRateAboveMaximum_isAViolation() {
        Compliance c = evaluator.evaluate(mixed, new GovernanceThresholds(null, 0.1, null));

        assertThat(c.violations()).containsExactly("error rate 0.250 exceeds the maximum 0.100");
    }

    @Test
    void timeoutCeiling_oneViolationPerOffendingAgent() {
        Summary s = summarizer.summarize(List.of(
                AgentResult.failure("a", TaskStatus.TIMEOUT, "t", 1, 1),
                AgentResult.failure("a", TaskStatus.TIMEOUT, "t", 1, 1),
                AgentResult.failure("b", TaskStatus.TIMEOUT, "t", 1, 1),
                AgentResult.failure("c", TaskStatus.TIMEOUT, "t", 1, 1),
                AgentResult.failure("c", TaskStatus.TIMEOUT, "t", 1, 1)));

        Compliance c = evaluator.evaluate(s, new GovernanceThresholds(null, null, 1));

        assertThat(c.violations()).containsExactly(
                "agent 'a' timed out 2 time(s), maximum is 1",
                "agent 'c' timed out 2 time(s), maximum is 1");
    }

    @Test
    void allThresholdsViolated_reportsEach() {
        Compliance c = evaluator.evaluate(mixed, new GovernanceThresholds(1.0, 0.0, 0));

        assertThat(c.passed()).isFalse();
        assertThat(c.violations()).hasSize(3);
    }

    @Test
    void emptySummary_passesRateCeilingsButFailsPositiveFloor() {
        Summary empty = summarizer.summarize(List.of());

        assertThat(evaluator.evaluate(empty, new GovernanceThresholds(null, 0.0, 0)).passed()).isTrue();
        assertThat(evaluator.evaluate(empty, new GovernanceThresholds(0.5, null, null)).passed()).isFalse();
    }

    @Test
    void passingIsMonotonicInSuccess() {
        GovernanceThresholds thresholds = new GovernanceThresholds(0.5, 0.5, 0);
        Summary worse = summarizer.summarize(List.of(
                AgentResult.success("a", 1, 1, 1),
                AgentResult.failure("a", TaskStatus.ERROR, "x", 1, 1)));
        Summary better = summarizer.summarize(List.of(
                AgentResult.success("a", 1, 1, 1),
                AgentResult.success("a", 1, 1, 1)));

        assertThat(evaluator.evaluate(worse, thresholds).passed()).isTrue();
        assertThat(evaluator.evaluate(better, thresholds).passed()).isTrue();

        GovernanceThresholds strict = new GovernanceThresholds(0.75, null, null);
        assertThat(evaluator.evaluate(worse, strict).passed()).isFalse();
        assertThat(evaluator.evaluate(better, strict).passed()).isTrue();
    }

    @Test
    void loweringMinSuccessRate_neverTurnsAPassIntoAFailure() {
        double[] descending = {1.0, 0.9, 0.75, 0.6, 0.5, 0.49, 0.25, 0.1, 0.0};
        boolean passedBefore = false;

        for (double min : descending) {
            boolean passed = evaluator.evaluate(mixed, new GovernanceThresholds(min, null, null)).passed();
            if (passedBefore) {
                assertThat(passed).as("minSuccessRate=%s", min).isTrue();
            }
            passedBefore = passed;
        }

        // the sweep crosses the 0.5 success rate of the fixed summary
        assertThat(evaluator.evaluate(mixed, new GovernanceThresholds(1.0, null, null)).passed()).isFalse();
        assertThat(passedBefore).isTrue();
    }
}
