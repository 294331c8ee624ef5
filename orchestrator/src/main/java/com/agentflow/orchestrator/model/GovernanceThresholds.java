package com.agentflow.orchestrator.model;

/**
 * Caller-declared acceptance bounds for a run's aggregate health.
 *
 * Every threshold is independently optional. A null threshold is never
 * evaluated and no default is ever substituted for it.
 *
 * @param minSuccessRate      success-rate floor in [0, 1]
 * @param maxErrorRate        error-rate ceiling in [0, 1]
 * @param maxTimeoutsPerAgent per-agent timeout ceiling, >= 0
 */
public record GovernanceThresholds(
        Double  minSuccessRate,
        Double  maxErrorRate,
        Integer maxTimeoutsPerAgent) {

    public static GovernanceThresholds none() {
        return new GovernanceThresholds(null, null, null);
    }
}
