package com.agentflow.orchestrator.engine;

import com.agentflow.orchestrator.model.AgentTask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Cache identity of a task: its name plus a stable hash of its input.
 *
 * The hash is SHA-256 over canonical JSON (map keys sorted), so two inputs
 * that are structurally equal produce the same key regardless of map
 * insertion order.
 */
public record TaskCacheKey(String name, String inputHash) {

    private static final Logger log = LoggerFactory.getLogger(TaskCacheKey.class);

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .findAndAddModules()
            .build();

    public static TaskCacheKey of(AgentTask task) {
        return new TaskCacheKey(task.name(), stableHash(task));
    }

    static String stableHash(AgentTask task) {
        String canonical;
        try {
            canonical = CANONICAL.writeValueAsString(task.input());
        } catch (JsonProcessingException e) {
            // Input holds something Jackson cannot write; hash its toString() instead.
            log.warn("Input of task '{}' is not JSON-serializable, caching on toString(): {}",
                    task.name(), e.getOriginalMessage());
            canonical = String.valueOf(task.input());
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
