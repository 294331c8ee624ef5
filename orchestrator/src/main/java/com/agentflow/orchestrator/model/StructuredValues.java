package com.agentflow.orchestrator.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deep copies of JSON-like values (task inputs, agent outputs).
 *
 * Maps, lists and sets come back unmodifiable at every level, keeping
 * iteration order and null entries. Jackson trees are deep-copied. Any
 * other value is returned as is and assumed immutable.
 */
public final class StructuredValues {

    private StructuredValues() {}

    public static Map<String, Object> freezeMap(Map<String, ?> map) {
        if (map == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k, freeze(v)));
        return Collections.unmodifiableMap(copy);
    }

    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof JsonNode node) {
            return node.deepCopy();
        }
        return value;
    }
}
