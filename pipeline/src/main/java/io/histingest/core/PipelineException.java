package io.histingest.core;

/**
 * Base for exceptions raised by collaborators at the pipeline boundary (providers, storage).
 * Each carries the {@link ErrorKind} it maps to so the retry executor can classify it.
 */
public class PipelineException extends Exception {
    private final ErrorKind kind;
    private final String code;
    private final String remediation;

    public PipelineException(ErrorKind kind, String code, String message, String remediation, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
        this.remediation = remediation;
    }

    public PipelineException(ErrorKind kind, String code, String message) {
        this(kind, code, message, null, null);
    }

    public ErrorKind kind() { return kind; }
    public String code() { return code; }
    public String remediation() { return remediation; }
}
