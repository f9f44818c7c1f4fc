package io.histingest.progress;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Progress notification sent to a {@link ProgressReporter}. Optional fields are null when
 * they do not apply to the event.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
        int version,
        String jobId,
        String description,
        long completed,
        long total,
        Stage stage,
        Long recordsStored,
        Long recordsQuarantined,
        Long chunksProcessed,
        String error,
        JobSummary finalStats
) {
    public static final int VERSION = 1;

    public static ProgressEvent started(String jobId, String description, long total) {
        return new ProgressEvent(VERSION, jobId, description, 0, total, Stage.EXTRACTION, null, null, null, null, null);
    }

    public static ProgressEvent chunk(String jobId, String description, long completed, long total,
                                      long stored, long quarantined, long chunks) {
        return new ProgressEvent(VERSION, jobId, description, completed, total, Stage.STORAGE,
                stored, quarantined, chunks, null, null);
    }

    public static ProgressEvent finished(String jobId, String description, long completed, long total, JobSummary summary) {
        return new ProgressEvent(VERSION, jobId, description, completed, total, null,
                summary.recordsStored(), summary.recordsQuarantined(), summary.chunksProcessed(), null, summary);
    }

    public static ProgressEvent failed(String jobId, String description, long completed, long total,
                                       String error, JobSummary summary) {
        return new ProgressEvent(VERSION, jobId, description, completed, total, null,
                summary == null ? null : summary.recordsStored(),
                summary == null ? null : summary.recordsQuarantined(),
                summary == null ? null : summary.chunksProcessed(), error, summary);
    }

    public boolean isFinal() { return finalStats != null || error != null; }
}
