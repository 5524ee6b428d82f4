package com.sandy.aiot.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.gateway.TestJobs.Body;
import com.sandy.aiot.gateway.entity.DeviceEvent;
import com.sandy.aiot.gateway.entity.JobStatus;
import com.sandy.aiot.gateway.entity.QueueJob;
import com.sandy.aiot.gateway.repository.DeviceEventRepository;
import com.sandy.aiot.gateway.repository.QueueJobRepository;
import com.sandy.aiot.gateway.service.EventStore;
import com.sandy.aiot.gateway.service.impl.DeviceEventJobHandler;
import com.sandy.aiot.gateway.service.impl.DurableJobQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@TestPropertySource(properties = "gateway.queue.backoff-base-ms=0")
class DurableJobQueueTest {
    @Autowired DurableJobQueue queue;
    @Autowired QueueJobRepository jobRepository;
    @Autowired DeviceEventRepository eventRepository;
    @Autowired EventStore eventStore;
    @Autowired ObjectMapper objectMapper;

    @BeforeEach
    void clean() {
        jobRepository.deleteAll();
        eventRepository.deleteAll();
    }

    private int drain() {
        int processed = 0;
        while (queue.runOnce()) {
            if (++processed > 1000) fail("queue did not drain");
        }
        return processed;
    }

    @Test
    void failingJobIsRetriedUntilMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        TestJobs.register(queue, "always_fails", job -> {
            calls.incrementAndGet();
            throw new IllegalStateException("downstream unavailable");
        });
        long id = queue.enqueue("always_fails", Map.of("n", 1));

        drain();

        QueueJob job = jobRepository.findById(id).orElseThrow();
        assertEquals(3, calls.get());
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertEquals(3, job.getAttempts());
        assertEquals("IllegalStateException: downstream unavailable", job.getLastError());
        assertNotNull(job.getCompletedAt());
        assertNull(job.getLockedBy());
        assertEquals(1, queue.stats().getFailed());
        assertEquals(List.of(id), queue.failedJobs(10).stream().map(QueueJob::getId).toList());
    }

    @Test
    void jobWithoutHandlerEndsFailed() {
        long id = queue.enqueue("no_such_type", "{}");
        drain();
        QueueJob job = jobRepository.findById(id).orElseThrow();
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertTrue(job.getLastError().startsWith("UnknownJobTypeException"));
    }

    @Test
    void failedJobCanBeRetriedManually() {
        AtomicBoolean healthy = new AtomicBoolean(false);
        TestJobs.register(queue, "flaky", job -> {
            if (!healthy.get()) throw new IllegalStateException("still down");
        });
        long id = queue.enqueue("flaky", "{}");
        drain();
        assertEquals(JobStatus.FAILED, jobRepository.findById(id).orElseThrow().getStatus());

        healthy.set(true);
        QueueJob requeued = queue.retryFailed(id);
        assertEquals(JobStatus.PENDING, requeued.getStatus());
        assertEquals(0, requeued.getAttempts());

        drain();
        QueueJob job = jobRepository.findById(id).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals(1, job.getAttempts());
        assertNull(job.getLastError());

        assertThrows(IllegalArgumentException.class, () -> queue.retryFailed(id));
        assertThrows(NoSuchElementException.class, () -> queue.retryFailed(-1L));
    }

    @Test
    void concurrentWorkersNeverRunAJobTwice() throws Exception {
        Map<Long, AtomicInteger> runs = new ConcurrentHashMap<>();
        TestJobs.register(queue, "counted", job -> runs.computeIfAbsent(job.getId(), k -> new AtomicInteger()).incrementAndGet());
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 40; i++) ids.add(queue.enqueue("counted", Map.of("i", i)));

        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Thread t = new Thread(() -> {
                while (queue.runOnce()) {
                    Thread.yield();
                }
            });
            threads.add(t);
            t.start();
        }
        for (Thread t : threads) t.join(30_000);
        drain();

        assertEquals(40, runs.size());
        for (Long id : ids) {
            assertEquals(1, runs.get(id).get(), "job " + id + " ran more than once");
        }
        assertEquals(40, queue.stats().getCompleted());
    }

    @Test
    void interruptedJobIsRecoveredAfterRestart() {
        TestJobs.register(queue, "resumable", job -> { });
        Instant crashTime = Instant.now().minus(Duration.ofMinutes(1));
        QueueJob orphan = jobRepository.save(QueueJob.builder()
                .type("resumable").payload("{}")
                .attempts(1).maxAttempts(3)
                .status(JobStatus.ACTIVE)
                .lockedBy("node-dead/queue-worker-1").lockedAt(crashTime)
                .nextRunAt(crashTime).createdAt(crashTime).updatedAt(crashTime)
                .build());

        assertFalse(queue.runOnce());
        assertEquals(1, queue.recoverInterruptedJobs());

        QueueJob pending = jobRepository.findById(orphan.getId()).orElseThrow();
        assertEquals(JobStatus.PENDING, pending.getStatus());
        assertNull(pending.getLockedBy());

        assertTrue(queue.runOnce());
        QueueJob done = jobRepository.findById(orphan.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.getStatus());
        assertEquals(2, done.getAttempts());
    }

    @Test
    void onlyExpiredLeasesAreReleased() {
        Instant now = Instant.now();
        QueueJob fresh = jobRepository.save(activeJob(now.minus(Duration.ofMinutes(1))));
        QueueJob stale = jobRepository.save(activeJob(now.minus(Duration.ofMinutes(11))));

        assertEquals(1, queue.releaseExpiredLeases());
        assertEquals(JobStatus.ACTIVE, jobRepository.findById(fresh.getId()).orElseThrow().getStatus());
        assertEquals(JobStatus.PENDING, jobRepository.findById(stale.getId()).orElseThrow().getStatus());
    }

    @Test
    void workerThatLostItsLeaseDoesNotOverwriteTheNewClaim() {
        // while the handler runs, its lease is released and another worker claims the job
        Body stealLease = job -> {
            QueueJob released = jobRepository.findById(job.getId()).orElseThrow();
            released.setStatus(JobStatus.PENDING);
            released.setLockedBy(null);
            released.setLockedAt(null);
            jobRepository.save(released);
            assertEquals(1, jobRepository.claim(job.getId(), "node-other/queue-worker-9", Instant.now(), JobStatus.PENDING, JobStatus.ACTIVE));
        };
        TestJobs.register(queue, "slow_ok", stealLease);
        TestJobs.register(queue, "slow_fails", job -> {
            stealLease.run(job);
            throw new IllegalStateException("too late");
        });
        long ok = queue.enqueue("slow_ok", "{}");
        long failing = queue.enqueue("slow_fails", "{}");

        assertTrue(queue.runOnce());
        assertTrue(queue.runOnce());

        for (long id : List.of(ok, failing)) {
            QueueJob job = jobRepository.findById(id).orElseThrow();
            assertEquals(JobStatus.ACTIVE, job.getStatus());
            assertEquals("node-other/queue-worker-9", job.getLockedBy());
            assertEquals(2, job.getAttempts());
            assertNull(job.getLastError());
            assertNull(job.getCompletedAt());
        }
    }

    private static QueueJob activeJob(Instant lockedAt) {
        return QueueJob.builder().type("lease").payload("{}").attempts(1).maxAttempts(3)
                .status(JobStatus.ACTIVE).lockedBy("w").lockedAt(lockedAt)
                .nextRunAt(lockedAt).createdAt(lockedAt).updatedAt(lockedAt).build();
    }

    @Test
    void cleanupHonoursRetentionPerStatus() {
        Instant now = Instant.now();
        QueueJob oldCompleted = jobRepository.save(finished(JobStatus.COMPLETED, now.minus(Duration.ofDays(8))));
        QueueJob recentCompleted = jobRepository.save(finished(JobStatus.COMPLETED, now.minus(Duration.ofDays(2))));
        QueueJob keptFailed = jobRepository.save(finished(JobStatus.FAILED, now.minus(Duration.ofDays(8))));
        QueueJob oldFailed = jobRepository.save(finished(JobStatus.FAILED, now.minus(Duration.ofDays(31))));

        assertEquals(2, queue.cleanup());
        assertFalse(jobRepository.existsById(oldCompleted.getId()));
        assertTrue(jobRepository.existsById(recentCompleted.getId()));
        assertTrue(jobRepository.existsById(keptFailed.getId()));
        assertFalse(jobRepository.existsById(oldFailed.getId()));
    }

    private static QueueJob finished(JobStatus status, Instant at) {
        return QueueJob.builder().type("old").payload("{}").attempts(1).maxAttempts(3)
                .status(status).nextRunAt(at).createdAt(at).updatedAt(at).completedAt(at).build();
    }

    @Test
    void replayedDeviceEventIsStoredOnce() {
        DeviceEvent event = TestEvents.switchEvent("d-replay", "on", Instant.parse("2025-03-01T10:00:00Z"));
        queue.enqueue(DeviceEventJobHandler.TYPE, event);
        queue.enqueue(DeviceEventJobHandler.TYPE, event);

        assertEquals(2, drain());

        assertEquals(1, eventStore.count("d-replay", null));
        assertEquals(2, queue.stats().getCompleted());
        DeviceEvent stored = eventStore.latest("d-replay").orElseThrow();
        assertEquals(event.getId(), stored.getId());
        assertEquals("on", stored.getValue().asText());
        assertEquals(event.getSequenceEpoch(), stored.getSequenceEpoch());
    }
}
