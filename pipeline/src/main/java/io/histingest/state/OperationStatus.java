package io.histingest.state;

public enum OperationStatus {
    PENDING,
    EXTRACTING,
    TRANSFORMING,
    VALIDATING,
    STORING,
    COMPLETED,
    COMPLETED_WITH_QUARANTINE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPLETED_WITH_QUARANTINE || this == FAILED;
    }

    /**
     * Terminal states are final and nothing returns to PENDING. Working states may follow each
     * other in any order because chunks overlap.
     */
    public boolean canMoveTo(OperationStatus next) {
        if (isTerminal()) return false;
        if (next == PENDING) return false;
        if (this == PENDING) return next == EXTRACTING || next == FAILED;
        return true;
    }
}
