package com.sandy.aiot.gateway.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.gateway.entity.JobStatus;
import com.sandy.aiot.gateway.entity.QueueJob;
import com.sandy.aiot.gateway.repository.QueueJobRepository;
import com.sandy.aiot.gateway.service.JobHandler;
import com.sandy.aiot.gateway.service.UnknownJobTypeException;
import com.sandy.aiot.gateway.tools.BackoffPolicy;
import com.sandy.aiot.gateway.vo.QueueStats;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Database-backed at-least-once work queue.
 * <p>
 * Jobs are committed before {@link #enqueue} returns. Workers claim a due job with a
 * conditional PENDING -> ACTIVE update, so a job is never executed by two workers at once.
 * Failed attempts are rescheduled with exponential backoff until {@code maxAttempts},
 * then kept as FAILED for inspection.
 */
@Service
@Slf4j
public class DurableJobQueue {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final QueueJobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();
    private final String nodeId = "node-" + UUID.randomUUID().toString().substring(0, 8);
    private final AtomicInteger workerSeq = new AtomicInteger();
    private final AtomicLong claimSeq = new AtomicLong();

    @Value("${gateway.queue.enabled:true}")
    private boolean enabled;
    @Value("${gateway.queue.workers:4}")
    private int workerCount;
    @Value("${gateway.queue.poll-interval-ms:1000}")
    private long pollIntervalMs;
    @Value("${gateway.queue.max-attempts:3}")
    private int maxAttempts;
    @Value("${gateway.queue.backoff-base-ms:1000}")
    private long backoffBaseMs;
    @Value("${gateway.queue.backoff-max-ms:60000}")
    private long backoffMaxMs;
    @Value("${gateway.queue.backoff-jitter:0.2}")
    private double backoffJitter;
    @Value("${gateway.queue.lease-ms:600000}")
    private long leaseMs;
    @Value("${gateway.queue.completed-retention-days:7}")
    private int completedRetentionDays;
    @Value("${gateway.queue.failed-retention-days:30}")
    private int failedRetentionDays;

    private BackoffPolicy backoffPolicy;
    private ExecutorService workers;
    private volatile boolean running;

    public DurableJobQueue(QueueJobRepository jobRepository, ObjectMapper objectMapper, List<JobHandler> handlerBeans) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        handlerBeans.forEach(h -> registerHandler(h.type(), h));
    }

    @PostConstruct
    public void init() {
        backoffPolicy = new BackoffPolicy(backoffBaseMs, backoffMaxMs, backoffJitter);
        log.info("Durable queue initialized: enabled={} workers={} maxAttempts={} backoffBaseMs={} backoffMaxMs={} handlers={}",
                enabled, workerCount, maxAttempts, backoffBaseMs, backoffMaxMs, handlers.keySet());
    }

    public void registerHandler(String type, JobHandler handler) {
        JobHandler previous = handlers.put(type, handler);
        if (previous != null && previous != handler) {
            log.warn("Job handler replaced type={} previous={} current={}", type, previous.getClass().getSimpleName(), handler.getClass().getSimpleName());
        }
    }

    public long enqueue(String type, Object payload) {
        QueueJob saved = jobRepository.save(newJob(type, payload));
        log.debug("Job enqueued jobId={} type={}", saved.getId(), type);
        return saved.getId();
    }

    /** Persists the whole batch in one transaction; nothing is stored if any payload fails to serialize. */
    public List<Long> enqueueAll(String type, Collection<?> payloads) {
        List<QueueJob> jobs = new ArrayList<>(payloads.size());
        for (Object p : payloads) jobs.add(newJob(type, p));
        List<Long> ids = new ArrayList<>(jobs.size());
        jobRepository.saveAll(jobs).forEach(j -> ids.add(j.getId()));
        log.debug("Jobs enqueued type={} count={}", type, ids.size());
        return ids;
    }

    private QueueJob newJob(String type, Object payload) {
        if (type == null || type.isBlank()) throw new IllegalArgumentException("job type required");
        Instant now = Instant.now();
        return QueueJob.builder()
                .type(type)
                .payload(toJson(payload))
                .attempts(0)
                .maxAttempts(maxAttempts)
                .nextRunAt(now)
                .status(JobStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private String toJson(Object payload) {
        if (payload instanceof String s) return s;
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload not serializable: " + e.getOriginalMessage(), e);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!enabled) {
            log.info("Durable queue workers disabled");
            return;
        }
        int recovered = recoverInterruptedJobs();
        running = true;
        workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "queue-worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < workerCount; i++) {
            workers.submit(this::workerLoop);
        }
        log.info("Durable queue started workers={} recoveredJobs={} nodeId={}", workerCount, recovered, nodeId);
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        if (workers == null) return;
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Queue workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void workerLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            boolean worked;
            try {
                worked = runOnce();
            } catch (Exception e) {
                log.error("Queue poll failed worker={} error={}", Thread.currentThread().getName(), e.getMessage(), e);
                worked = false;
            }
            if (!worked) {
                try {
                    Thread.sleep(pollIntervalMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    /**
     * Claims and executes at most one due job. Returns true when a job was processed
     * (successfully or not), false when nothing was due.
     */
    public boolean runOnce() {
        Instant now = Instant.now();
        List<QueueJob> due = jobRepository.findTop10ByStatusAndNextRunAtLessThanEqualOrderByNextRunAtAscIdAsc(JobStatus.PENDING, now);
        String worker = nodeId + "/" + Thread.currentThread().getName();
        for (QueueJob candidate : due) {
            // unique per claim, so a stale worker can never match a later claim of the same job
            String lockToken = worker + "#" + claimSeq.incrementAndGet();
            if (jobRepository.claim(candidate.getId(), lockToken, now, JobStatus.PENDING, JobStatus.ACTIVE) != 1) {
                continue; // another worker won it
            }
            QueueJob job = jobRepository.findById(candidate.getId()).orElse(null);
            if (job == null) continue;
            execute(job, lockToken);
            return true;
        }
        return false;
    }

    private void execute(QueueJob job, String lockToken) {
        long start = System.currentTimeMillis();
        try {
            JobHandler handler = handlers.get(job.getType());
            if (handler == null) throw new UnknownJobTypeException(job.getType());
            handler.handle(job);
            markCompleted(job, lockToken);
            log.debug("Job completed jobId={} type={} attempts={} durationMs={}", job.getId(), job.getType(), job.getAttempts(), System.currentTimeMillis() - start);
        } catch (Exception e) {
            markAttemptFailed(job, lockToken, e);
        }
    }

    private void markCompleted(QueueJob job, String lockToken) {
        Instant now = Instant.now();
        int n = jobRepository.finishIfOwned(job.getId(), lockToken, JobStatus.COMPLETED, null, job.getNextRunAt(), now, now, JobStatus.ACTIVE);
        if (n != 1) leaseLost(job, lockToken, JobStatus.COMPLETED);
    }

    private void markAttemptFailed(QueueJob job, String lockToken, Exception e) {
        Instant now = Instant.now();
        String error = truncate(e.getClass().getSimpleName() + ": " + e.getMessage());
        int n;
        if (job.getAttempts() < job.getMaxAttempts()) {
            long delay = backoffPolicy.delayMs(job.getAttempts());
            n = jobRepository.finishIfOwned(job.getId(), lockToken, JobStatus.PENDING, error, now.plusMillis(delay), null, now, JobStatus.ACTIVE);
            if (n == 1) {
                log.warn("Job attempt failed, retry scheduled jobId={} type={} attempts={}/{} delayMs={} error={}",
                        job.getId(), job.getType(), job.getAttempts(), job.getMaxAttempts(), delay, error);
            }
        } else {
            n = jobRepository.finishIfOwned(job.getId(), lockToken, JobStatus.FAILED, error, job.getNextRunAt(), now, now, JobStatus.ACTIVE);
            if (n == 1) {
                log.error("Job failed permanently jobId={} type={} attempts={} error={}", job.getId(), job.getType(), job.getAttempts(), error);
            }
        }
        if (n != 1) leaseLost(job, lockToken, JobStatus.FAILED);
    }

    private void leaseLost(QueueJob job, String lockToken, JobStatus outcome) {
        log.warn("Job outcome discarded, lease no longer held jobId={} type={} lockToken={} outcome={}",
                job.getId(), job.getType(), lockToken, outcome);
    }

    /** Crash recovery: every ACTIVE job goes back to PENDING. Single-node deployments only. */
    public int recoverInterruptedJobs() {
        Instant now = Instant.now();
        int n = jobRepository.releaseActiveLockedBefore(now.plusMillis(1), now, JobStatus.PENDING, JobStatus.ACTIVE);
        if (n > 0) log.warn("Recovered interrupted jobs count={}", n);
        return n;
    }

    @Scheduled(fixedDelayString = "${gateway.queue.lease-check-interval-ms:60000}")
    public void scheduledLeaseCheck() {
        if (!enabled) return;
        try { releaseExpiredLeases(); } catch (Exception e) { log.error("Lease check failed: {}", e.getMessage(), e); }
    }

    public int releaseExpiredLeases() {
        Instant now = Instant.now();
        int n = jobRepository.releaseActiveLockedBefore(now.minusMillis(leaseMs), now, JobStatus.PENDING, JobStatus.ACTIVE);
        if (n > 0) log.warn("Released jobs with expired lease count={} leaseMs={}", n, leaseMs);
        return n;
    }

    @Scheduled(fixedDelayString = "${gateway.queue.cleanup-interval-ms:3600000}")
    public void scheduledCleanup() {
        if (!enabled) return;
        try { cleanup(); } catch (Exception e) { log.error("Queue cleanup failed: {}", e.getMessage(), e); }
    }

    public int cleanup() {
        Instant now = Instant.now();
        int completed = jobRepository.deleteByStatusUpdatedBefore(JobStatus.COMPLETED, now.minus(Duration.ofDays(completedRetentionDays)));
        int failed = jobRepository.deleteByStatusUpdatedBefore(JobStatus.FAILED, now.minus(Duration.ofDays(failedRetentionDays)));
        if (completed + failed > 0) {
            log.info("Queue cleanup removed completed={} failed={}", completed, failed);
        }
        return completed + failed;
    }

    public QueueStats stats() {
        return QueueStats.builder()
                .pending(jobRepository.countByStatus(JobStatus.PENDING))
                .active(jobRepository.countByStatus(JobStatus.ACTIVE))
                .completed(jobRepository.countByStatus(JobStatus.COMPLETED))
                .failed(jobRepository.countByStatus(JobStatus.FAILED))
                .build();
    }

    public List<QueueJob> failedJobs(int limit) {
        int size = Math.max(1, Math.min(limit, 500));
        return jobRepository.findByStatusOrderByUpdatedAtDesc(JobStatus.FAILED, PageRequest.of(0, size));
    }

    /** Manual re-queue of a FAILED job with a fresh attempt budget. */
    public QueueJob retryFailed(long jobId) {
        QueueJob job = jobRepository.findById(jobId)
                .orElseThrow(() -> new NoSuchElementException("Job not found: " + jobId));
        if (job.getStatus() != JobStatus.FAILED) {
            throw new IllegalArgumentException("Job " + jobId + " is " + job.getStatus() + ", only FAILED jobs can be retried");
        }
        Instant now = Instant.now();
        job.setStatus(JobStatus.PENDING);
        job.setAttempts(0);
        job.setNextRunAt(now);
        job.setCompletedAt(null);
        job.setUpdatedAt(now);
        QueueJob saved = jobRepository.save(job);
        log.info("Failed job re-queued jobId={} type={} lastError={}", jobId, job.getType(), job.getLastError());
        return saved;
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_ERROR_LENGTH) return s;
        return s.substring(0, MAX_ERROR_LENGTH);
    }
}
