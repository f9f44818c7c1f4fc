package io.histingest.state;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of an {@link OperationState}, the unit persisted by {@link OperationStateStore}.
 *
 * @param totalRecords provider estimate, 0 when unknown
 * @param failure      the error that failed the job, null unless status is FAILED
 */
public record OperationSnapshot(
        String jobId,
        String jobName,
        String schema,
        OperationStatus status,
        long recordsFetched,
        long recordsProcessed,
        long totalRecords,
        long chunksProcessed,
        long recordsStored,
        long recordsNewlyInserted,
        long recordsQuarantined,
        long quarantineEntries,
        List<ChunkMetrics> chunkMetrics,
        List<RecordedError> errors,
        RecordedError failure,
        Instant startedAt,
        Instant endedAt,
        Instant updatedAt
) {
    public OperationSnapshot {
        chunkMetrics = chunkMetrics == null ? List.of() : List.copyOf(chunkMetrics);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean isTerminal() { return status != null && status.isTerminal(); }
}
