package io.histingest.retry;

import io.histingest.core.PipelineError;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retries transient failures up to {@code maxRetries} times. Delay for retry n is
 * {@code base * multiplier^(n-1)} capped at {@code max}, plus optional jitter.
 * <p>
 * Delays strictly increase until they reach the cap: each base delay is at least one
 * millisecond above the previous one, and jitter never reaches the next base delay.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private static final int MAX_EXPONENT = 30;

    private final int maxRetries;
    private final long baseMillis;
    private final double multiplier;
    private final long maxMillis;
    private final double jitterFraction;

    public ExponentialBackoffRetryPolicy(int maxRetries, long baseMillis, double multiplier, long maxMillis, double jitterFraction) {
        if (!(multiplier > 1.0)) throw new IllegalArgumentException("multiplier must be > 1");
        if (jitterFraction < 0 || jitterFraction > 1) throw new IllegalArgumentException("jitterFraction must be in [0,1]");
        this.maxRetries = Math.max(0, maxRetries);
        this.baseMillis = Math.max(1, baseMillis);
        this.multiplier = multiplier;
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.jitterFraction = jitterFraction;
    }

    public ExponentialBackoffRetryPolicy(int maxRetries, long baseMillis, double multiplier, long maxMillis) {
        this(maxRetries, baseMillis, multiplier, maxMillis, 0.0);
    }

    public int maxRetries() { return maxRetries; }

    @Override
    public boolean shouldRetry(int attempt, PipelineError error) {
        return error.isTransient() && attempt <= maxRetries;
    }

    @Override
    public long backoffMillis(int retry) {
        int n = Math.min(MAX_EXPONENT + 1, Math.max(1, retry));
        long delay = scheduled(n);
        if (jitterFraction > 0 && delay < maxMillis) {
            long next = scheduled(n + 1);
            long spread = Math.min((long) (delay * jitterFraction), next - delay - 1);
            if (spread > 0) delay += ThreadLocalRandom.current().nextLong(spread + 1);
        }
        return Math.min(delay, maxMillis);
    }

    /** Un-jittered delay for retry n, strictly above retry n-1 until capped. */
    private long scheduled(int n) {
        long delay = baseMillis;
        for (int i = 2; i <= n && delay < maxMillis; i++) {
            double raw = baseMillis * Math.pow(multiplier, i - 1);
            long grown = raw >= maxMillis ? maxMillis : (long) raw;
            delay = Math.min(maxMillis, Math.max(grown, delay + 1));
        }
        return delay;
    }
}
