package com.agentflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Execution strategy used to run a workflow's tasks.
 *
 * LOCAL   : in-process, full policy enforcement
 * PROTOCOL: external agent-protocol service ("mcp" in older workflow files)
 * MANAGED : hosted backend functions ("supabase" in older workflow files)
 */
public enum Transport {
    LOCAL,
    PROTOCOL,
    MANAGED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static Transport fromWire(String value) {
        if (value == null || value.isBlank()) {
            return LOCAL;
        }
        return switch (value.trim().toLowerCase()) {
            case "local"             -> LOCAL;
            case "protocol", "mcp"   -> PROTOCOL;
            case "managed", "supabase" -> MANAGED;
            default -> throw new IllegalArgumentException("Unknown transport: '" + value + "'");
        };
    }
}
