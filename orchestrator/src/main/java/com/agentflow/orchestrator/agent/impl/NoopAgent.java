package com.agentflow.orchestrator.agent.impl;

import com.agentflow.orchestrator.agent.Agent;
import com.agentflow.orchestrator.model.ExecutionContext;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class NoopAgent implements Agent {

    @Override public String name()        { return "noop"; }
    @Override public String description() { return "Do nothing and succeed."; }

    @Override
    public Object execute(Map<String, Object> input, ExecutionContext ctx) {
        return Map.of("ok", true);
    }
}
