package com.sandy.aiot.gateway.tools;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ParallelTasksTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void oneFailureDoesNotAffectTheOthers() {
        ParallelTasks tasks = new ParallelTasks(executor);
        tasks.submit("a", () -> 1);
        tasks.submit("b", () -> { throw new IllegalStateException("boom"); });
        tasks.submit("c", () -> "ok");

        Map<String, TaskOutcome<?>> outcomes = tasks.awaitAll(1000);

        assertEquals(List.of("a", "b", "c"), List.copyOf(outcomes.keySet()));
        assertEquals(1, outcomes.get("a").value().orElseThrow());
        assertEquals(TaskOutcome.Status.FAILED, outcomes.get("b").status());
        assertEquals("IllegalStateException: boom", outcomes.get("b").failureMessage());
        assertEquals("ok", outcomes.get("c").value().orElseThrow());
        assertEquals(List.of("b"), ParallelTasks.unsuccessful(outcomes));
    }

    @Test
    void slowTaskTimesOutAgainstTheSharedDeadline() {
        ParallelTasks tasks = new ParallelTasks(executor);
        tasks.submit("fast", () -> "done");
        tasks.submit("slow", () -> { Thread.sleep(5_000); return "late"; });

        long start = System.currentTimeMillis();
        Map<String, TaskOutcome<?>> outcomes = tasks.awaitAll(200);
        long elapsed = System.currentTimeMillis() - start;

        assertTrue(outcomes.get("fast").isSuccess());
        assertEquals(TaskOutcome.Status.TIMED_OUT, outcomes.get("slow").status());
        assertTrue(elapsed < 1_000, "awaitAll took " + elapsed + "ms");
    }

    @Test
    void taskRejectedBySaturatedPoolIsReportedAsFailed() {
        ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.setQueueCapacity(0);
        single.initialize();
        try {
            CountDownLatch release = new CountDownLatch(1);
            ParallelTasks tasks = new ParallelTasks(single);
            tasks.submit("busy", () -> release.await(5, TimeUnit.SECONDS));
            tasks.submit("rejected", () -> "never runs");
            release.countDown();

            Map<String, TaskOutcome<?>> outcomes = tasks.awaitAll(1000);

            assertTrue(outcomes.get("busy").isSuccess());
            assertEquals(TaskOutcome.Status.FAILED, outcomes.get("rejected").status());
            assertTrue(outcomes.get("rejected").failureMessage().startsWith("TaskRejectedException"));
            assertEquals(List.of("rejected"), ParallelTasks.unsuccessful(outcomes));
        } finally {
            single.shutdown();
        }
    }

    @Test
    void duplicateNamesAreRejected() {
        ParallelTasks tasks = new ParallelTasks(executor);
        tasks.submit("x", () -> 1);
        assertThrows(IllegalArgumentException.class, () -> tasks.submit("x", () -> 2));
    }
}
