package com.sandy.aiot.gateway.tools;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fixed group of named tasks started together and joined against one deadline.
 * Every task yields a {@link TaskOutcome}; one failure never fails the group.
 * <pre>
 * ParallelTasks tasks = new ParallelTasks(executor);
 * tasks.submit("health", () -> provider.getHealth(id));
 * Map&lt;String, TaskOutcome&lt;?&gt;&gt; outcomes = tasks.awaitAll(450);
 * </pre>
 */
@Slf4j
public class ParallelTasks {

    private final Executor executor;
    private final Map<String, CompletableFuture<?>> futures = new LinkedHashMap<>();
    private final Map<String, Long> startedAt = new LinkedHashMap<>();

    public ParallelTasks(Executor executor) {
        this.executor = executor;
    }

    public <T> void submit(String name, Callable<T> task) {
        if (futures.containsKey(name)) throw new IllegalArgumentException("duplicate task name " + name);
        startedAt.put(name, System.currentTimeMillis());
        CompletableFuture<T> f;
        try {
            f = CompletableFuture.supplyAsync(() -> {
                try {
                    return task.call();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            // pool saturated: reported as a failed task, the other tasks still run
            log.warn("Task rejected name={} message={}", name, e.getMessage());
            f = CompletableFuture.failedFuture(e);
        }
        futures.put(name, f);
    }

    public int size() {
        return futures.size();
    }

    /**
     * Waits until every task has finished or the deadline passes. Tasks still running at the
     * deadline are cancelled and reported as timed out.
     */
    public Map<String, TaskOutcome<?>> awaitAll(long timeoutMs) {
        long deadline = System.currentTimeMillis() + timeoutMs;
        Map<String, TaskOutcome<?>> outcomes = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<?>> entry : futures.entrySet()) {
            String name = entry.getKey();
            CompletableFuture<?> f = entry.getValue();
            long remaining = Math.max(0, deadline - System.currentTimeMillis());
            outcomes.put(name, await(name, f, remaining));
        }
        return outcomes;
    }

    private <T> TaskOutcome<T> await(String name, CompletableFuture<T> f, long remainingMs) {
        try {
            T value = f.get(remainingMs, TimeUnit.MILLISECONDS);
            return TaskOutcome.succeeded(name, value, elapsed(name));
        } catch (TimeoutException e) {
            f.cancel(true);
            log.warn("Task timed out name={} elapsedMs={}", name, elapsed(name));
            return TaskOutcome.timedOut(name, elapsed(name));
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            log.warn("Task failed name={} errorType={} message={}", name, cause.getClass().getSimpleName(), cause.getMessage());
            return TaskOutcome.failed(name, cause, elapsed(name));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            return TaskOutcome.failed(name, e, elapsed(name));
        }
    }

    /** Names of the tasks that did not succeed, in submission order. */
    public static List<String> unsuccessful(Map<String, TaskOutcome<?>> outcomes) {
        List<String> names = new ArrayList<>();
        outcomes.forEach((name, o) -> { if (!o.isSuccess()) names.add(name); });
        return names;
    }

    private long elapsed(String name) {
        return System.currentTimeMillis() - startedAt.getOrDefault(name, System.currentTimeMillis());
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof ExecutionException || cur instanceof CompletionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
