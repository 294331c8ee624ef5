package com.agentflow.orchestrator.engine;

import com.agentflow.orchestrator.model.StructuredValues;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state owned by exactly one run: the result cache and the
 * per-agent consecutive-failure counters.
 *
 * A fresh instance is created for every {@code ExecutionContext}. Tasks
 * within a run execute sequentially, so no synchronization is needed;
 * sharing an instance between concurrent runs is not supported.
 */
public final class RunState {

    /** A cached success; {@code output} may be null and is a private copy. */
    public record CacheEntry(Object output, Instant cachedAt) {}

    private final boolean cachingEnabled;
    private final boolean circuitBreakingEnabled;

    private final Map<TaskCacheKey, CacheEntry> cache = new HashMap<>();
    private final Map<String, Integer> consecutiveFailures = new HashMap<>();

    private RunState(boolean cachingEnabled, boolean circuitBreakingEnabled) {
        this.cachingEnabled         = cachingEnabled;
        this.circuitBreakingEnabled = circuitBreakingEnabled;
    }

    /** Full policy enforcement: caching and circuit breaking. */
    public static RunState local() {
        return new RunState(true, true);
    }

    /** Remote transports keep their own cache and breaker. */
    public static RunState remote() {
        return new RunState(false, false);
    }

    // ------------------------------------------------------------------
    // Cache
    // ------------------------------------------------------------------

    /** Entry for {@code key} if it was cached less than {@code ttlMs} before {@code now}. */
    public Optional<CacheEntry> lookup(TaskCacheKey key, Instant now, long ttlMs) {
        if (!cachingEnabled || ttlMs <= 0) {
            return Optional.empty();
        }
        CacheEntry entry = cache.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (Duration.between(entry.cachedAt(), now).toMillis() < ttlMs) {
            return Optional.of(new CacheEntry(StructuredValues.freeze(entry.output()), entry.cachedAt()));
        }
        cache.remove(key);
        return Optional.empty();
    }

    /** Caches a copy of {@code output}; later changes to the caller's object are not seen. */
    public void store(TaskCacheKey key, Object output, Instant now) {
        if (cachingEnabled) {
            cache.put(key, new CacheEntry(StructuredValues.freeze(output), now));
        }
    }

    public int cacheSize() {
        return cache.size();
    }

    // ------------------------------------------------------------------
    // Circuit breaker
    // ------------------------------------------------------------------

    public boolean isCircuitOpen(String agent, int threshold) {
        return circuitBreakingEnabled && threshold > 0 && failures(agent) >= threshold;
    }

    public void recordSuccess(String agent) {
        consecutiveFailures.remove(agent);
    }

    /** Returns the new consecutive-failure count. */
    public int recordFailure(String agent) {
        return consecutiveFailures.merge(agent, 1, Integer::sum);
    }

    public int failures(String agent) {
        return consecutiveFailures.getOrDefault(agent, 0);
    }
}
