package com.agentflow.orchestrator.agent.impl;

import com.agentflow.orchestrator.agent.Agent;
import com.agentflow.orchestrator.model.ExecutionContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Returns its input together with the run it was called from.
 * Handy for smoke-testing a workflow file end to end.
 */
@Component
public class EchoAgent implements Agent {

    @Override public String name()        { return "echo"; }
    @Override public String description() { return "Echo the task input back as output."; }

    @Override
    public Object execute(Map<String, Object> input, ExecutionContext ctx) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("runId", ctx.runId());
        out.put("label", ctx.label());
        out.put("input", input);
        return out;
    }
}
