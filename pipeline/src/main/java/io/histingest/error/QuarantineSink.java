package io.histingest.error;

import io.histingest.core.Result;

/**
 * Durable, append-only destination for records that could not be transformed or validated.
 * Implementations never throw: a failed write comes back as a
 * {@link io.histingest.core.ErrorKind#QUARANTINE_PERSISTENCE} error.
 */
public interface QuarantineSink {

    /**
     * @return the location the entry was written to
     */
    Result<String> record(QuarantineEntry entry);

    /** Where entries for the given job are kept, for user-facing summaries. */
    String locationFor(String jobName);
}
