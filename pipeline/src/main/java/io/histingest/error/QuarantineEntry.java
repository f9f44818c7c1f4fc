package io.histingest.error;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One quarantined group of records sharing a failure reason. Written once and never modified.
 *
 * @param failedRecords the raw payloads as received from the provider
 * @param context       chunk sequence, reason code, dataset and other diagnostics
 */
public record QuarantineEntry(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("job_name") String jobName,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("schema") String schema,
        @JsonProperty("error_type") String errorType,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("failed_records") List<Map<String, Object>> failedRecords,
        @JsonProperty("context") Map<String, Object> context
) {
    public QuarantineEntry {
        failedRecords = failedRecords == null ? List.of() : List.copyOf(failedRecords);
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public int recordCount() { return failedRecords.size(); }
}
