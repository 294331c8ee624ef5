package com.agentflow.orchestrator.model;

/**
 * Execution policy attached to a workflow.
 *
 * All fields are optional in workflow files; {@link #withDefaults(Policy)}
 * fills the gaps from the engine-level defaults before a run starts. Once
 * resolved a policy is never changed for the lifetime of a run.
 *
 * Zero or negative values are legal: {@code maxRetries <= 0} means exactly
 * one attempt, {@code backoffMs <= 0} no wait, {@code cacheTtlMs <= 0} no
 * cache hits, {@code timeoutMs <= 0} no deadline and
 * {@code circuitBreakerThreshold <= 0} no breaker.
 */
public record Policy(
        Integer              timeoutMs,
        Integer              maxRetries,
        Integer              backoffMs,
        Integer              cacheTtlMs,
        Integer              circuitBreakerThreshold,
        GovernanceThresholds governance) {

    public static Policy empty() {
        return new Policy(null, null, null, null, null, null);
    }

    /** Returns a copy where every null field is taken from {@code defaults}. */
    public Policy withDefaults(Policy defaults) {
        return new Policy(
                timeoutMs               != null ? timeoutMs               : defaults.timeoutMs(),
                maxRetries              != null ? maxRetries              : defaults.maxRetries(),
                backoffMs               != null ? backoffMs               : defaults.backoffMs(),
                cacheTtlMs              != null ? cacheTtlMs              : defaults.cacheTtlMs(),
                circuitBreakerThreshold != null ? circuitBreakerThreshold : defaults.circuitBreakerThreshold(),
                governance              != null ? governance              : defaults.governance());
    }

    /** Attempts allowed per task: {@code max(maxRetries, 0) + 1}. */
    public int maxAttempts() {
        return Math.max(intOrZero(maxRetries), 0) + 1;
    }

    public long timeoutMillis()       { return intOrZero(timeoutMs); }
    public long backoffMillis()       { return Math.max(intOrZero(backoffMs), 0); }
    public long cacheTtlMillis()      { return intOrZero(cacheTtlMs); }
    public int  breakerThreshold()    { return intOrZero(circuitBreakerThreshold); }

    public GovernanceThresholds governanceOrNone() {
        return governance != null ? governance : GovernanceThresholds.none();
    }

    private static int intOrZero(Integer v) {
        return v == null ? 0 : v;
    }
}
