package io.histingest.market.runtime;

import io.histingest.core.CancellationToken;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * A job running in the background.
 */
public final class JobHandle {
    private final String jobId;
    private final CancellationToken token;
    private final Future<JobOutcome> outcome;

    JobHandle(String jobId, CancellationToken token, Future<JobOutcome> outcome) {
        this.jobId = jobId;
        this.token = token;
        this.outcome = outcome;
    }

    public String jobId() { return jobId; }

    /**
     * Requests cancellation. The job stops pulling chunks, lets in-flight chunks finish and ends FAILED.
     */
    public void cancel(String reason) { token.cancel(reason); }

    public boolean isDone() { return outcome.isDone(); }

    public JobOutcome await() throws InterruptedException {
        try {
            return outcome.get();
        } catch (ExecutionException | CancellationException e) {
            throw new IllegalStateException("job " + jobId + " ended abnormally", e);
        }
    }
}
