package io.histingest.progress;

import java.time.Duration;
import java.time.Instant;

/**
 * Totals reported once a job reaches a terminal state.
 */
public record JobSummary(
        String status,
        Instant startTime,
        Instant endTime,
        double durationSeconds,
        long recordsFetched,
        long recordsTransformed,
        long recordsValidated,
        long recordsStored,
        long recordsNewlyInserted,
        long recordsQuarantined,
        long quarantineEntries,
        long chunksProcessed,
        long errorsEncountered,
        String quarantineLocation
) {
    public static double seconds(Instant start, Instant end) {
        if (start == null || end == null) return 0.0;
        return Duration.between(start, end).toMillis() / 1000.0;
    }
}
