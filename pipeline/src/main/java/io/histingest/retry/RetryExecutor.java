package io.histingest.retry;

import com.codahale.metrics.Counter;
import io.histingest.core.CancellationToken;
import io.histingest.core.ErrorKind;
import io.histingest.core.PipelineError;
import io.histingest.core.PipelineException;
import io.histingest.core.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an operation under a per-attempt timeout and retries transient failures according
 * to a {@link RetryPolicy}. Exceptions never escape; every outcome is a {@link Result}.
 */
public class RetryExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    @FunctionalInterface
    public interface Attempt<T> {
        Result<T> call() throws Exception;
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Counter retries;
    private final ExecutorService timeoutPool;

    public RetryExecutor(RetryPolicy policy, Sleeper sleeper, Counter retries) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.retries = retries == null ? new Counter() : retries;
        AtomicInteger n = new AtomicInteger();
        this.timeoutPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "retry-attempt-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param operation     name used in logs and error messages
     * @param transientKind kind reported for timeouts; its escalation is used for unexpected exceptions
     * @param timeout       per-attempt limit, null or zero for none
     */
    public <T> Result<T> execute(String operation, ErrorKind transientKind, Duration timeout,
                                 CancellationToken token, Attempt<T> attempt) {
        return run(operation, transientKind, timeout, token, attempt, false);
    }

    /**
     * Like {@link #execute} for calls that advance a cursor, such as pulling the next chunk.
     * A timed-out call is not abandoned: later attempts keep waiting for it and take its result,
     * and a new call starts only once the previous one has failed. At most one call runs at a
     * time until retries are exhausted, when the outstanding call is interrupted.
     */
    public <T> Result<T> executeSerially(String operation, ErrorKind transientKind, Duration timeout,
                                         CancellationToken token, Attempt<T> attempt) {
        return run(operation, transientKind, timeout, token, attempt, true);
    }

    private <T> Result<T> run(String operation, ErrorKind transientKind, Duration timeout,
                              CancellationToken token, Attempt<T> attempt, boolean serial) {
        boolean timed = timeout != null && !timeout.isZero() && !timeout.isNegative();
        Future<Result<T>> pending = null;
        int attempts = 0;
        while (true) {
            if (token != null && token.isCancelled()) {
                abandon(pending);
                return Result.err(token.toError().withAttempts(attempts));
            }
            attempts++;
            Result<T> result;
            if (!timed) {
                result = direct(operation, transientKind, attempt);
            } else {
                if (pending == null) pending = timeoutPool.submit(attempt::call);
                try {
                    result = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                    pending = null;
                } catch (TimeoutException te) {
                    if (!serial) {
                        abandon(pending);
                        pending = null;
                    }
                    result = Result.err(PipelineError.of(transientKind, "timeout",
                            operation + " timed out after " + timeout.toMillis() + " ms", te));
                } catch (ExecutionException ee) {
                    pending = null;
                    Throwable cause = ee.getCause() == null ? ee : ee.getCause();
                    result = Result.err(classify(operation, transientKind, cause));
                } catch (InterruptedException ie) {
                    abandon(pending);
                    Thread.currentThread().interrupt();
                    return Result.err(PipelineError.of(ErrorKind.CANCELLED, "interrupted", operation + " interrupted", ie)
                            .withAttempts(attempts));
                }
            }
            if (result.isOk()) return result;

            PipelineError error = result.error();
            if (!error.isTransient()) {
                abandon(pending);
                return Result.err(error.withAttempts(attempts));
            }
            if (!policy.shouldRetry(attempts, error)) {
                abandon(pending);
                log.warn("{} failed after {} attempts, giving up: {}", operation, attempts, error.message());
                return Result.err(error.exhausted(attempts));
            }
            long delay = policy.backoffMillis(attempts);
            retries.inc();
            log.warn("{} attempt {} failed ({}), retrying in {} ms", operation, attempts, error.message(), delay);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                abandon(pending);
                Thread.currentThread().interrupt();
                return Result.err(PipelineError.of(ErrorKind.CANCELLED, "interrupted",
                        operation + " interrupted during backoff").withAttempts(attempts));
            }
        }
    }

    private <T> Result<T> direct(String operation, ErrorKind transientKind, Attempt<T> attempt) {
        try {
            return attempt.call();
        } catch (Exception e) {
            return Result.err(classify(operation, transientKind, e));
        }
    }

    private static void abandon(Future<?> pending) {
        if (pending != null) pending.cancel(true);
    }

    static PipelineError classify(String operation, ErrorKind transientKind, Throwable t) {
        if (t instanceof PipelineException) {
            return PipelineError.fromException((PipelineException) t);
        }
        if (t instanceof InterruptedException) {
            return PipelineError.of(ErrorKind.CANCELLED, "interrupted", operation + " interrupted", t);
        }
        if (t instanceof TimeoutException) {
            return PipelineError.of(transientKind, "timeout", operation + " timed out", t);
        }
        return PipelineError.of(transientKind.escalated(), "unexpected",
                operation + " failed: " + t, t);
    }

    @Override
    public void close() {
        timeoutPool.shutdownNow();
    }
}
