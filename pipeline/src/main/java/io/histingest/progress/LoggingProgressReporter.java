package io.histingest.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingProgressReporter implements ProgressReporter {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressReporter.class);

    @Override
    public void report(ProgressEvent e) {
        if (e.error() != null) {
            log.error("[{}] {}: {}", e.jobId(), e.description(), e.error());
        } else if (e.finalStats() != null) {
            JobSummary s = e.finalStats();
            log.info("[{}] {} ({} stored, {} quarantined, {} chunks in {}s)", e.jobId(), e.description(),
                    s.recordsStored(), s.recordsQuarantined(), s.chunksProcessed(), s.durationSeconds());
        } else {
            log.info("[{}] {} {}/{} stage={} stored={} quarantined={}", e.jobId(), e.description(),
                    e.completed(), e.total(), e.stage() == null ? "-" : e.stage().wireName(),
                    e.recordsStored(), e.recordsQuarantined());
        }
    }
}
