package com.agentflow.orchestrator.engine;

import com.agentflow.orchestrator.model.AgentTask;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunStateTest {

    static final Instant T0  = Instant.parse("2026-03-01T10:00:00Z");
    static final TaskCacheKey KEY = TaskCacheKey.of(AgentTask.of("lint"));

    @Test
    void lookup_withinTtl_hits_atTtl_missesAndEvicts() {
        RunState state = RunState.local();
        state.store(KEY, "out", T0);

        assertThat(state.lookup(KEY, T0.plusMillis(999), 1_000)).isPresent();
        assertThat(state.lookup(KEY, T0.plusMillis(1_000), 1_000)).isEmpty();
        assertThat(state.cacheSize()).isZero();
    }

    @Test
    void nullOutputIsCacheable() {
        RunState state = RunState.local();
        state.store(KEY, null, T0);

        assertThat(state.lookup(KEY, T0, 1_000)).hasValueSatisfying(e -> assertThat(e.output()).isNull());
    }

    @Test
    void breaker_opensAtThreshold_andSuccessResets() {
        RunState state = RunState.local();

        assertThat(state.recordFailure("lint")).isEqualTo(1);
        assertThat(state.isCircuitOpen("lint", 2)).isFalse();
        assertThat(state.recordFailure("lint")).isEqualTo(2);
        assertThat(state.isCircuitOpen("lint", 2)).isTrue();
        assertThat(state.isCircuitOpen("other", 2)).isFalse();

        state.recordSuccess("lint");
        assertThat(state.failures("lint")).isZero();
        assertThat(state.isCircuitOpen("lint", 2)).isFalse();
    }

    @Test
    void thresholdZeroOrNegative_neverOpens() {
        RunState state = RunState.local();
        state.recordFailure("lint");

        assertThat(state.isCircuitOpen("lint", 0)).isFalse();
        assertThat(state.isCircuitOpen("lint", -1)).isFalse();
    }

    @Test
    void remote_disablesCacheAndBreaker() {
        RunState state = RunState.remote();
        state.store(KEY, "out", T0);
        state.recordFailure("lint");

        assertThat(state.lookup(KEY, T0, 60_000)).isEmpty();
        assertThat(state.isCircuitOpen("lint", 1)).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void cachedOutput_isIsolatedFromCallerAndHits() {
        RunState state = RunState.local();
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("files", new ArrayList<>(List.of("a.txt")));
        state.store(KEY, output, T0);

        ((List<Object>) output.get("files")).add("b.txt");
        output.put("extra", true);

        Map<String, Object> hit = (Map<String, Object>) state.lookup(KEY, T0, 1_000).orElseThrow().output();
        assertThat(hit).isEqualTo(Map.of("files", List.of("a.txt")));
        assertThatThrownBy(() -> hit.put("extra", true)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> ((List<Object>) hit.get("files")).add("c.txt"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
