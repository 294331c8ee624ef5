package com.agentflow.orchestrator.agent;

public class AgentNotFoundException extends AgentException {
    public AgentNotFoundException(String name) {
        super("No agent registered with name: '" + name + "'");
    }
}
