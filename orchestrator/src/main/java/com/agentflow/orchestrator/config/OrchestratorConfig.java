package com.agentflow.orchestrator.config;

import com.agentflow.orchestrator.model.GovernanceThresholds;
import com.agentflow.orchestrator.model.Policy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Engine-level defaults and shared infrastructure beans.
 *
 * Policy defaults fill whatever a workflow's policy leaves out. Governance
 * thresholds are not defaulted: an absent threshold is never
 * evaluated.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Policy defaultPolicy(
            @Value("${agentflow.policy.timeout-ms:30000}")              int timeoutMs,
            @Value("${agentflow.policy.max-retries:2}")                 int maxRetries,
            @Value("${agentflow.policy.backoff-ms:500}")                int backoffMs,
            @Value("${agentflow.policy.cache-ttl-ms:300000}")           int cacheTtlMs,
            @Value("${agentflow.policy.circuit-breaker-threshold:3}")   int breakerThreshold) {
        return new Policy(timeoutMs, maxRetries, backoffMs, cacheTtlMs, breakerThreshold,
                GovernanceThresholds.none());
    }
}
