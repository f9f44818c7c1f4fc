package io.histingest.state;

import io.histingest.core.PipelineError;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Mutable progress record for one job. Every method locks on this instance; callers that must
 * pair a mutation with side effects (progress events, store writes) synchronize on it as well,
 * so observers see counters in the order they changed. Counters never decrease.
 */
public class OperationState {
    static final int MAX_CHUNK_METRICS = 256;

    private final String jobId;
    private final String jobName;
    private final String schema;
    private final Clock clock;

    private OperationStatus status = OperationStatus.PENDING;
    private long recordsFetched;
    private long recordsProcessed;
    private long totalRecords;
    private long chunksProcessed;
    private long recordsStored;
    private long recordsNewlyInserted;
    private long recordsQuarantined;
    private long quarantineEntries;
    private long lastTickAt;
    private final Deque<ChunkMetrics> chunkMetrics = new ArrayDeque<>();
    private final List<RecordedError> errors = new ArrayList<>();
    private RecordedError failure;
    private final Instant startedAt;
    private Instant endedAt;
    private Instant updatedAt;

    public OperationState(String jobId, String jobName, String schema, Clock clock) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.jobName = jobName;
        this.schema = schema;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.updatedAt = startedAt;
    }

    public String jobId() { return jobId; }

    public synchronized OperationStatus status() { return status; }

    /**
     * Moves to a working state. Moving to the current state is a no-op.
     *
     * @return true when the status changed
     * @throws IllegalStateException on a transition out of a terminal state
     */
    public synchronized boolean moveTo(OperationStatus next) {
        if (next == status) return false;
        if (next.isTerminal()) throw new IllegalArgumentException("use finish() for terminal state " + next);
        if (!status.canMoveTo(next)) throw new IllegalStateException("illegal transition " + status + " -> " + next);
        status = next;
        touch();
        return true;
    }

    public synchronized void finish(OperationStatus terminal, PipelineError cause) {
        if (!terminal.isTerminal()) throw new IllegalArgumentException(terminal + " is not terminal");
        if (!status.canMoveTo(terminal)) throw new IllegalStateException("illegal transition " + status + " -> " + terminal);
        status = terminal;
        if (cause != null) {
            failure = RecordedError.from(cause, null, clock.instant());
            errors.add(failure);
        }
        endedAt = clock.instant();
        touch();
    }

    public synchronized void estimateTotal(long total) {
        if (total > totalRecords) totalRecords = total;
        touch();
    }

    public synchronized void recordsFetched(int n) {
        recordsFetched += n;
        if (recordsFetched > totalRecords && totalRecords > 0) totalRecords = recordsFetched;
        touch();
    }

    public synchronized void chunkCompleted(ChunkMetrics m) {
        chunksProcessed++;
        recordsProcessed += m.records();
        recordsStored += m.stored();
        recordsNewlyInserted += m.newlyInserted();
        recordsQuarantined += m.quarantined();
        quarantineEntries += m.quarantineEntries();
        chunkMetrics.addLast(m);
        while (chunkMetrics.size() > MAX_CHUNK_METRICS) chunkMetrics.removeFirst();
        touch();
    }

    public synchronized void addError(PipelineError e, Long chunkSeq) {
        errors.add(RecordedError.from(e, chunkSeq, clock.instant()));
        touch();
    }

    /**
     * True once at least {@code every} records were processed since the last tick.
     */
    public synchronized boolean tickDue(long every) {
        if (every <= 0) return true;
        if (recordsProcessed - lastTickAt >= every) {
            lastTickAt = recordsProcessed;
            return true;
        }
        return false;
    }

    public synchronized long recordsStored() { return recordsStored; }
    public synchronized long recordsQuarantined() { return recordsQuarantined; }
    public synchronized long recordsProcessed() { return recordsProcessed; }

    public synchronized OperationSnapshot snapshot() {
        return new OperationSnapshot(jobId, jobName, schema, status,
                recordsFetched, recordsProcessed, totalRecords, chunksProcessed,
                recordsStored, recordsNewlyInserted, recordsQuarantined, quarantineEntries,
                new ArrayList<>(chunkMetrics), errors, failure, startedAt, endedAt, updatedAt);
    }

    private void touch() {
        updatedAt = clock.instant();
    }
}
