package com.agentflow.orchestrator.agent;

import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.ExecutionContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process agent registry used by the local transport.
 *
 * All {@link Agent} beans are collected at startup via constructor
 * injection; adding an agent only requires declaring it as
 * {@code @Component}.
 *
 * Every invocation is timed and counted:
 * <pre>
 *   agentflow.agent.calls{agent, status="success|error"}
 *   agentflow.agent.duration{agent}
 * </pre>
 */
@Component
public class AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public AgentRegistry(List<Agent> allAgents, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (Agent agent : allAgents) {
            Agent previous = agents.put(agent.name(), agent);
            if (previous != null) {
                throw new IllegalStateException("Duplicate agent name: '" + agent.name() + "'");
            }
            log.info("Registered agent '{}': {}", agent.name(), agent.description());
        }
    }

    public Agent get(String name) {
        Agent agent = agents.get(name);
        if (agent == null) {
            throw new AgentNotFoundException(name);
        }
        return agent;
    }

    public boolean contains(String name) {
        return agents.containsKey(name);
    }

    /** Returns all registered agent names (sorted). */
    public List<String> agentNames() {
        return agents.keySet().stream().sorted().toList();
    }

    /**
     * Invoke the agent named by the task. Exceptions from the agent
     * propagate unchanged; the caller decides what a failure means.
     */
    public Object invoke(AgentTask task, ExecutionContext ctx) throws Exception {
        Agent agent = get(task.name());

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return agent.execute(task.input(), ctx);
        } catch (Exception e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("agentflow.agent.duration", "agent", task.name()));
            meterRegistry.counter("agentflow.agent.calls",
                    "agent", task.name(), "status", status).increment();
        }
    }
}
