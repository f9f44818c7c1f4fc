package io.histingest.retry;

import io.histingest.core.PipelineError;

public interface RetryPolicy {
    /**
     * @param attempt attempts made so far, starting at 1
     */
    boolean shouldRetry(int attempt, PipelineError error);

    /**
     * Delay before retry number {@code retry} (1-based).
     */
    long backoffMillis(int retry);
}
