package io.histingest.state;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Key/value store of job snapshots keyed by job id. Writes for one job id overwrite the
 * previous snapshot; writes for different job ids never interfere.
 */
public interface OperationStateStore {
    Optional<OperationSnapshot> get(String jobId) throws IOException;

    void put(OperationSnapshot snapshot) throws IOException;

    List<OperationSnapshot> list() throws IOException;

    boolean delete(String jobId) throws IOException;

    /**
     * Removes snapshots of finished jobs that ended before {@code now - age}.
     *
     * @return number of snapshots removed
     */
    default int purgeTerminalOlderThan(Duration age, Instant now) throws IOException {
        Instant cutoff = now.minus(age);
        int removed = 0;
        for (OperationSnapshot s : list()) {
            if (s.isTerminal() && s.endedAt() != null && s.endedAt().isBefore(cutoff)) {
                if (delete(s.jobId())) removed++;
            }
        }
        return removed;
    }
}
