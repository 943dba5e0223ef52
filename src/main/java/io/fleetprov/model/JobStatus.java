package io.fleetprov.model;

public enum JobStatus {
    PENDING,
    RUNNING,
    AWAITING_RETRY,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
