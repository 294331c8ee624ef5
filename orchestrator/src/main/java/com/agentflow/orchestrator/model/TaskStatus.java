package com.agentflow.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal outcome of one agent task within a run.
 *
 * SUCCESS: an attempt returned normally (or the output came from the cache)
 * ERROR  : the last attempt failed with an application or transport error
 * TIMEOUT: the last attempt exceeded the policy deadline
 * SKIPPED: never attempted because the agent's circuit breaker was open
 */
public enum TaskStatus {
    SUCCESS,
    ERROR,
    TIMEOUT,
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static TaskStatus fromWire(String value) {
        return TaskStatus.valueOf(value.trim().toUpperCase());
    }
}
