package com.agentflow.orchestrator.governance;

import com.agentflow.orchestrator.model.GovernanceThresholds;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares a {@link Summary} against {@link GovernanceThresholds}.
 *
 * Each threshold is checked only when set; nothing is defaulted. One
 * violation string per failed check, and one per offending agent for the
 * timeout ceiling.
 */
@Component
public class ComplianceEvaluator {

    public Compliance evaluate(Summary summary, GovernanceThresholds thresholds) {
        if (thresholds == null) {
            return Compliance.of(List.of());
        }
        List<String> violations = new ArrayList<>();

        Double minSuccess = thresholds.minSuccessRate();
        if (minSuccess != null && summary.successRate() < minSuccess) {
            violations.add(String.format(Locale.ROOT,
                    "success rate %.3f is below the minimum %.3f", summary.successRate(), minSuccess));
        }

        Double maxError = thresholds.maxErrorRate();
        if (maxError != null && summary.errorRate() > maxError) {
            violations.add(String.format(Locale.ROOT,
                    "error rate %.3f exceeds the maximum %.3f", summary.errorRate(), maxError));
        }

        Integer maxTimeouts = thresholds.maxTimeoutsPerAgent();
        if (maxTimeouts != null) {
            for (Map.Entry<String, StatusCounts> e : summary.perAgent().entrySet()) {
                if (e.getValue().timeout() > maxTimeouts) {
                    violations.add(String.format(Locale.ROOT,
                            "agent '%s' timed out %d time(s), maximum is %d",
                            e.getKey(), e.getValue().timeout(), maxTimeouts));
                }
            }
        }

        return Compliance.of(violations);
    }
}
