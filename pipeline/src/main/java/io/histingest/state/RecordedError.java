package io.histingest.state;

import io.histingest.core.ErrorKind;
import io.histingest.core.PipelineError;

import java.time.Instant;

/**
 * Error surfaced to the operator through the state snapshot.
 *
 * @param chunkSeq chunk the error belongs to, null for job-level errors
 */
public record RecordedError(
        Instant at,
        ErrorKind kind,
        String code,
        String message,
        String remediation,
        Long chunkSeq,
        int attempts,
        boolean retriesExhausted
) {
    public static RecordedError from(PipelineError e, Long chunkSeq, Instant at) {
        return new RecordedError(at, e.kind(), e.code(), e.message(), e.remediation(), chunkSeq,
                e.attempts(), e.retriesExhausted());
    }
}
