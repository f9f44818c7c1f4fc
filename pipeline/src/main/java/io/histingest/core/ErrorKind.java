package io.histingest.core;

/**
 * Closed taxonomy of failures the ingestion pipeline distinguishes.
 */
public enum ErrorKind {
    PROVIDER_TRANSIENT(true),
    PROVIDER_PERMANENT(false),
    TRANSFORM(false),
    VALIDATION(false),
    STORAGE_TRANSIENT(true),
    STORAGE_PERMANENT(false),
    QUARANTINE_PERSISTENCE(false),
    CANCELLED(false),
    INVALID_JOB_CONFIG(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() { return transientFailure; }

    /** Kinds that stop a job. Record-level and quarantine failures never do. */
    public boolean isFatal() {
        return this != TRANSFORM && this != VALIDATION && this != QUARANTINE_PERSISTENCE;
    }

    /** The permanent counterpart used once retries are exhausted. */
    public ErrorKind escalated() {
        switch (this) {
            case PROVIDER_TRANSIENT: return PROVIDER_PERMANENT;
            case STORAGE_TRANSIENT: return STORAGE_PERMANENT;
            default: return this;
        }
    }
}
