package io.histingest.market.runtime;

import io.histingest.core.ErrorKind;
import io.histingest.core.PipelineError;
import io.histingest.progress.JobSummary;
import io.histingest.state.OperationSnapshot;
import io.histingest.state.OperationStatus;

/**
 * Result of one job run. Never carries an exception out of the orchestrator; a failed job
 * reports its root cause in {@link #error()}.
 *
 * @param quarantineLocation where quarantined records were written, null when none were
 */
public record JobOutcome(
        String jobId,
        String jobName,
        OperationStatus status,
        OperationSnapshot snapshot,
        PipelineError error,
        JobSummary summary,
        String quarantineLocation
) {
    public boolean succeeded() { return status != OperationStatus.FAILED; }

    /** One-line summary for the operator. */
    public String describe() {
        StringBuilder sb = new StringBuilder("Job ").append(jobName);
        switch (status) {
            case COMPLETED:
                sb.append(" completed: ").append(snapshot.recordsStored()).append(" records stored (")
                        .append(snapshot.recordsNewlyInserted()).append(" new) in ")
                        .append(snapshot.chunksProcessed()).append(" chunks");
                break;
            case COMPLETED_WITH_QUARANTINE:
                sb.append(" completed with warnings: ").append(snapshot.recordsStored()).append(" records stored, ")
                        .append(snapshot.recordsQuarantined()).append(" quarantined");
                if (quarantineLocation != null) sb.append(". Quarantined records: ").append(quarantineLocation);
                break;
            case FAILED:
                sb.append(" failed: ").append(error == null ? "unknown error" : error.describe());
                if (snapshot.recordsStored() > 0) {
                    sb.append(" (").append(snapshot.recordsStored()).append(" records stored before the failure)");
                }
                break;
            default:
                sb.append(" is ").append(status);
        }
        long lostQuarantine = snapshot.errors().stream().filter(e -> e.kind() == ErrorKind.QUARANTINE_PERSISTENCE).count();
        if (lostQuarantine > 0) sb.append("; ").append(lostQuarantine).append(" quarantine write(s) failed");
        return sb.toString();
    }
}
