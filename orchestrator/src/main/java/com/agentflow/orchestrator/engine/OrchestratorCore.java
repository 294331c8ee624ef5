package com.agentflow.orchestrator.engine;

import com.agentflow.orchestrator.agent.AgentRegistry;
import com.agentflow.orchestrator.model.AgentResult;
import com.agentflow.orchestrator.model.AgentTask;
import com.agentflow.orchestrator.model.ExecutionContext;
import com.agentflow.orchestrator.model.Policy;
import com.agentflow.orchestrator.model.TaskStatus;
import com.agentflow.orchestrator.workflow.WorkflowValidator;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The policy engine: runs a task list under a policy and returns exactly
 * one {@link AgentResult} per task, in task order.
 *
 * Per task:
 * <ol>
 *   <li>Cache hit within the TTL → SUCCESS with the cached output, 0 attempts.</li>
 *   <li>Agent's consecutive failures reached the breaker threshold → SKIPPED,
 *       agent not invoked.</li>
 *   <li>Up to {@code maxRetries + 1} attempts, each bounded by {@code timeoutMs},
 *       with a linear {@code backoffMs * attempt} wait after each failure.</li>
 *   <li>First success → cache the output, reset the failure counter.</li>
 *   <li>Attempts exhausted → bump the failure counter; the terminal status
 *       (ERROR or TIMEOUT) is that of the LAST attempt.</li>
 * </ol>
 *
 * Tasks run one at a time so later tasks observe cache and breaker updates
 * made by earlier ones. Each attempt runs on a pool thread so the deadline
 * can be enforced and the attempt interrupted.
 *
 * Nothing a task does makes {@link #run} throw. The only exceptions come
 * from malformed input, before any task executes.
 */
@Component
public class OrchestratorCore {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorCore.class);

    private final AgentRegistry   agents;
    private final MeterRegistry   meterRegistry;
    private final Clock           clock;
    private final Policy          defaults;
    private final ExecutorService attemptPool = Executors.newCachedThreadPool(new AttemptThreadFactory());

    public OrchestratorCore(AgentRegistry agents,
                            MeterRegistry meterRegistry,
                            Clock clock,
                            Policy defaultPolicy) {
        this.agents        = agents;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.defaults      = defaultPolicy;
    }

    @PreDestroy
    public void shutdown() {
        attemptPool.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /** Run tasks against the local agent registry with a fresh run state. */
    public List<AgentResult> run(List<AgentTask> tasks, ExecutionContext ctx, Policy policy) {
        return run(tasks, ctx, policy, RunState.local());
    }

    public List<AgentResult> run(List<AgentTask> tasks, ExecutionContext ctx, Policy policy, RunState state) {
        return execute(tasks, ctx, policy, state, (task, c, timeoutMs) -> agents.invoke(task, c));
    }

    /**
     * Run tasks through an arbitrary invoker so timeout/retry/backoff still
     * apply locally. The protocol transport passes {@link RunState#remote()};
     * the managed transport keeps full {@link RunState#local()} state.
     */
    public List<AgentResult> execute(List<AgentTask> tasks,
                                     ExecutionContext ctx,
                                     Policy policy,
                                     RunState state,
                                     AgentInvoker invoker) {
        WorkflowValidator.validateTasks(tasks);
        WorkflowValidator.validatePolicy(policy);
        Policy effective = resolve(policy);

        log.info("Run {} starting: {} task(s), timeout={}ms, maxAttempts={}, backoff={}ms, breaker={}",
                ctx.runId(), tasks.size(), effective.timeoutMillis(), effective.maxAttempts(),
                effective.backoffMillis(), effective.breakerThreshold());

        List<AgentResult> results = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            AgentTask task = tasks.get(i);
            try {
                results.add(record(runTask(task, ctx, effective, state, invoker)));
            } catch (TransportAbort abort) {
                log.error("Run {}: transport failed on task '{}', failing {} remaining task(s): {}",
                        ctx.runId(), task.name(), tasks.size() - i, abort.getMessage());
                results.add(record(AgentResult.failure(task.name(), TaskStatus.ERROR,
                        abort.getMessage(), abort.attempts, abort.durationMs)));
                for (AgentTask rest : tasks.subList(i + 1, tasks.size())) {
                    results.add(record(AgentResult.failure(rest.name(), TaskStatus.ERROR,
                            "Not dispatched: " + abort.getMessage(), 0, 0L)));
                }
                break;
            }
        }

        log.info("Run {} finished: {} result(s)", ctx.runId(), results.size());
        return results;
    }

    Policy resolve(Policy policy) {
        return policy == null ? defaults : policy.withDefaults(defaults);
    }

    // ------------------------------------------------------------------
    // One task
    // ------------------------------------------------------------------

    private AgentResult runTask(AgentTask task,
                                ExecutionContext ctx,
                                Policy policy,
                                RunState state,
                                AgentInvoker invoker) {
        String agent = task.name();
        long start = System.nanoTime();

        TaskCacheKey key = TaskCacheKey.of(task);
        Optional<RunState.CacheEntry> hit = state.lookup(key, clock.instant(), policy.cacheTtlMillis());
        if (hit.isPresent()) {
            log.debug("Run {}: cache hit for '{}'", ctx.runId(), agent);
            return AgentResult.success(agent, hit.get().output(), 0, elapsedMs(start));
        }

        if (state.isCircuitOpen(agent, policy.breakerThreshold())) {
            log.warn("Run {}: circuit open for '{}' ({} consecutive failures), skipping",
                    ctx.runId(), agent, state.failures(agent));
            return AgentResult.skipped(agent,
                    "Circuit open after " + state.failures(agent) + " consecutive failure(s)");
        }

        int maxAttempts = policy.maxAttempts();
        Attempt last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                last = attemptOnce(task, ctx, policy.timeoutMillis(), invoker);
            } catch (TransportException e) {
                throw new TransportAbort(e.getMessage(), attempt, elapsedMs(start));
            }

            if (last.succeeded()) {
                state.store(key, last.output(), clock.instant());
                state.recordSuccess(agent);
                return AgentResult.success(agent, last.output(), attempt, elapsedMs(start));
            }

            if (attempt < maxAttempts) {
                log.warn("Run {}: '{}' attempt {}/{} failed ({}), retrying: {}",
                        ctx.runId(), agent, attempt, maxAttempts, last.status(), last.message());
                backoff(policy.backoffMillis() * attempt, agent, attempt, start);
            }
        }

        int failures = state.recordFailure(agent);
        log.warn("Run {}: '{}' failed after {} attempt(s) with {} (consecutive failures={}): {}",
                ctx.runId(), agent, maxAttempts, last.status(), failures, last.message());
        return AgentResult.failure(agent, last.status(), last.message(), maxAttempts, elapsedMs(start));
    }

    /**
     * One bounded attempt. Returns the outcome; only a transport failure
     * escapes, as {@link TransportException}.
     */
    private Attempt attemptOnce(AgentTask task, ExecutionContext ctx, long timeoutMs, AgentInvoker invoker) {
        Future<Object> future = attemptPool.submit(() -> invoker.invoke(task, ctx, timeoutMs));
        try {
            Object output = timeoutMs > 0
                    ? future.get(timeoutMs, TimeUnit.MILLISECONDS)
                    : future.get();
            return Attempt.ok(output);
        } catch (TimeoutException e) {
            future.cancel(true);
            return Attempt.failed(TaskStatus.TIMEOUT, "Timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TransportException te) {
                throw te;
            }
            if (cause instanceof TimeoutException) {
                return Attempt.failed(TaskStatus.TIMEOUT, describe(cause));
            }
            return Attempt.failed(TaskStatus.ERROR, describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for '" + task.name() + "'", e);
        }
    }

    private void backoff(long waitMs, String agent, int attempt, long start) {
        if (waitMs <= 0) {
            return;
        }
        try {
            Thread.sleep(waitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportAbort("Interrupted during backoff for '" + agent + "'", attempt, elapsedMs(start));
        }
    }

    private AgentResult record(AgentResult result) {
        meterRegistry.counter("agentflow.task.results",
                "agent", result.task(), "status", result.status().wireName()).increment();
        return result;
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getSimpleName() : msg;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    // ------------------------------------------------------------------
    // Internal types
    // ------------------------------------------------------------------

    private record Attempt(boolean succeeded, Object output, TaskStatus status, String message) {
        static Attempt ok(Object output) {
            return new Attempt(true, output, TaskStatus.SUCCESS, null);
        }

        static Attempt failed(TaskStatus status, String message) {
            return new Attempt(false, null, status, message);
        }
    }

    /** Carries a transport failure out of {@link #runTask} with the attempt bookkeeping. */
    private static final class TransportAbort extends RuntimeException {
        final int  attempts;
        final long durationMs;

        TransportAbort(String message, int attempts, long durationMs) {
            super(message);
            this.attempts   = attempts;
            this.durationMs = durationMs;
        }
    }

    private static final class AttemptThreadFactory implements ThreadFactory {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "agent-attempt-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
