package io.histingest.core;

import java.util.Objects;

/**
 * A failure carried as a value through the pipeline.
 *
 * @param kind              taxonomy bucket
 * @param code              short machine-readable reason (rule id, field name, SQL state...)
 * @param message           human readable detail
 * @param remediation       optional hint for the operator, may be null
 * @param attempts          attempts made before giving up, 0 when not retried
 * @param retriesExhausted  true when a transient failure was escalated after the retry budget ran out
 * @param cause             original exception, may be null
 */
public record PipelineError(
        ErrorKind kind,
        String code,
        String message,
        String remediation,
        int attempts,
        boolean retriesExhausted,
        Throwable cause
) {
    public PipelineError {
        Objects.requireNonNull(kind, "kind");
        code = code == null ? kind.name().toLowerCase() : code;
        message = message == null ? "" : message;
    }

    public static PipelineError of(ErrorKind kind, String code, String message) {
        return new PipelineError(kind, code, message, null, 0, false, null);
    }

    public static PipelineError of(ErrorKind kind, String code, String message, Throwable cause) {
        return new PipelineError(kind, code, message, null, 0, false, cause);
    }

    public static PipelineError fromException(PipelineException e) {
        return new PipelineError(e.kind(), e.code(), e.getMessage(), e.remediation(), 0, false, e);
    }

    public PipelineError withRemediation(String hint) {
        return new PipelineError(kind, code, message, hint, attempts, retriesExhausted, cause);
    }

    public PipelineError withAttempts(int n) {
        return new PipelineError(kind, code, message, remediation, n, retriesExhausted, cause);
    }

    /** Re-labels a transient failure as its permanent counterpart after the last retry. */
    public PipelineError exhausted(int n) {
        return new PipelineError(kind.escalated(), code, message, remediation, n, true, cause);
    }

    public boolean isTransient() { return kind.isTransient(); }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind.name().toLowerCase()).append(": ").append(message);
        if (retriesExhausted) sb.append(" (gave up after ").append(attempts).append(" attempts)");
        if (remediation != null && !remediation.isBlank()) sb.append(". Suggested: ").append(remediation);
        return sb.toString();
    }
}
