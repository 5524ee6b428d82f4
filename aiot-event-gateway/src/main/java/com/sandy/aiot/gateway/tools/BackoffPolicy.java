package com.sandy.aiot.gateway.tools;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential retry delay: {@code min(base * 2^attempts, max)} plus up to {@code jitter * delay} extra.
 */
public final class BackoffPolicy {

    private final long baseMs;
    private final long maxMs;
    private final double jitter;

    public BackoffPolicy(long baseMs, long maxMs, double jitter) {
        if (baseMs < 0 || maxMs < 0) throw new IllegalArgumentException("backoff delays must be >= 0");
        if (jitter < 0) throw new IllegalArgumentException("jitter must be >= 0");
        this.baseMs = baseMs;
        this.maxMs = maxMs;
        this.jitter = jitter;
    }

    /** Delay without jitter. */
    public long baseDelayMs(int attempts) {
        double raw = baseMs * Math.pow(2, Math.max(0, attempts));
        return (long) Math.min(raw, (double) maxMs);
    }

    public long delayMs(int attempts) {
        long delay = baseDelayMs(attempts);
        if (jitter == 0 || delay == 0) return delay;
        return delay + (long) (ThreadLocalRandom.current().nextDouble() * jitter * delay);
    }

    /** Upper bound of {@link #delayMs(int)}. */
    public long maxDelayMs(int attempts) {
        long delay = baseDelayMs(attempts);
        return delay + (long) (jitter * delay);
    }
}
