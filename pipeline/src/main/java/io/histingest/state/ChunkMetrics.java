package io.histingest.state;

public record ChunkMetrics(
        long chunkSeq,
        int records,
        int valid,
        int quarantined,
        long stored,
        long newlyInserted,
        int quarantineEntries,
        long durationMillis
) {
}
